package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.CellError;
import com.spreadsheet.engine.models.CellValue;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Presentation-side rendering of cell results. Numbers are rounded to the
 * configured number of decimal digits here and only here; stored values
 * keep full precision.
 */
public class ValueFormatter {

    public static final int DEFAULT_PRECISION = 5;

    private final int precision;

    public ValueFormatter() {
        this(DEFAULT_PRECISION);
    }

    public ValueFormatter(int precision) {
        if (precision < 0) {
            throw new IllegalArgumentException("Display precision must be non-negative: " + precision);
        }
        this.precision = precision;
    }

    public int getPrecision() {
        return precision;
    }

    public String format(CellValue value, CellError error) {
        if (error != null) {
            return error.getCode();
        }
        if (value instanceof CellValue.NumberValue) {
            return formatNumber(((CellValue.NumberValue) value).getValue());
        }
        return ValueCoercion.toText(value);
    }

    public String formatNumber(double number) {
        if (!Double.isFinite(number)) {
            return String.valueOf(number);
        }
        return BigDecimal.valueOf(number)
                .setScale(precision, RoundingMode.HALF_UP)
                .stripTrailingZeros()
                .toPlainString();
    }
}
