package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.CellValue;

import java.util.Collections;
import java.util.List;

/**
 * An already-evaluated, error-free function argument: either a single
 * value or the values of every cell in a range (row-major).
 */
public final class FunctionArgument {

    private final CellValue value;
    private final List<CellValue> rangeValues;

    private FunctionArgument(CellValue value, List<CellValue> rangeValues) {
        this.value = value;
        this.rangeValues = rangeValues;
    }

    public static FunctionArgument scalar(CellValue value) {
        return new FunctionArgument(value, null);
    }

    public static FunctionArgument range(List<CellValue> values) {
        return new FunctionArgument(null, Collections.unmodifiableList(values));
    }

    public boolean isRange() {
        return rangeValues != null;
    }

    public CellValue getValue() {
        if (isRange()) {
            throw new IllegalStateException("Range argument has no single value");
        }
        return value;
    }

    /**
     * The range's values, or the single value as a one-element list.
     */
    public List<CellValue> getValues() {
        return isRange() ? rangeValues : Collections.singletonList(value);
    }
}
