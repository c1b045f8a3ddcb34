package com.spreadsheet.engine.formula;

import java.util.List;

/**
 * Implementation of a built-in function. Arguments arrive evaluated and
 * error-free, with arity already checked against the registration.
 */
@FunctionalInterface
public interface SpreadsheetFunction {
    EvaluationResult apply(List<FunctionArgument> args);
}
