package com.spreadsheet.engine.exceptions;

/**
 * Signals a broken internal contract, such as an AST node the parser
 * should never have produced or an ordering that still contains a cycle.
 * This is a defect in the engine, never a spreadsheet error value.
 */
public class EngineInvariantException extends IllegalStateException {
    public EngineInvariantException(String message) {
        super(message);
    }
}
