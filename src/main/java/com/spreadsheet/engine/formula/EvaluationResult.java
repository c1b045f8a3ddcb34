package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.CellError;
import com.spreadsheet.engine.models.CellValue;
import com.spreadsheet.engine.models.ErrorKind;

import java.util.Objects;

/**
 * Outcome of evaluating an expression: exactly one of a value or an error.
 */
public final class EvaluationResult {

    private final CellValue value;
    private final CellError error;

    private EvaluationResult(CellValue value, CellError error) {
        this.value = value;
        this.error = error;
    }

    public static EvaluationResult of(CellValue value) {
        return new EvaluationResult(Objects.requireNonNull(value, "value"), null);
    }

    public static EvaluationResult error(CellError error) {
        return new EvaluationResult(null, Objects.requireNonNull(error, "error"));
    }

    public static EvaluationResult error(ErrorKind kind, String message) {
        return error(new CellError(kind, message));
    }

    public static EvaluationResult number(double number) {
        if (!Double.isFinite(number)) {
            return error(ErrorKind.NUM, "Result is not a finite number");
        }
        return of(CellValue.number(number));
    }

    public boolean isError() {
        return error != null;
    }

    /**
     * @return the value, or null when this result is an error
     */
    public CellValue getValue() {
        return value;
    }

    /**
     * @return the error, or null when this result is a value
     */
    public CellError getError() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EvaluationResult)) {
            return false;
        }
        EvaluationResult that = (EvaluationResult) o;
        return Objects.equals(value, that.value) && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return isError() ? error.toString() : value.toString();
    }
}
