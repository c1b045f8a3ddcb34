package com.spreadsheet.engine.exceptions;

/**
 * Raised by the formula parser for malformed input: unterminated text,
 * unmatched parentheses, malformed references, unexpected tokens.
 * Carries the zero-based character offset (within the formula text,
 * including the leading '=') where the problem was detected.
 */
public class FormulaSyntaxException extends Exception {

    private final int position;

    public FormulaSyntaxException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
