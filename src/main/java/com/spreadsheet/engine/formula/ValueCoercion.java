package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.CellValue;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Conversions between value kinds used by operators and functions.
 * Coercions that can fail return null rather than throwing.
 */
public final class ValueCoercion {

    private static final CellValue.Visitor<Double> TO_NUMBER = new CellValue.Visitor<Double>() {
        @Override
        public Double visitNumber(double number) {
            return number;
        }

        @Override
        public Double visitText(String text) {
            return LiteralParser.parseNumber(text);
        }

        @Override
        public Double visitBoolean(boolean bool) {
            return bool ? 1.0 : 0.0;
        }

        @Override
        public Double visitDate(LocalDate date) {
            return null;
        }

        @Override
        public Double visitEmpty() {
            return 0.0;
        }
    };

    private static final CellValue.Visitor<String> TO_TEXT = new CellValue.Visitor<String>() {
        @Override
        public String visitNumber(double number) {
            return formatNumber(number);
        }

        @Override
        public String visitText(String text) {
            return text;
        }

        @Override
        public String visitBoolean(boolean bool) {
            return bool ? "TRUE" : "FALSE";
        }

        @Override
        public String visitDate(LocalDate date) {
            return date.toString();
        }

        @Override
        public String visitEmpty() {
            return "";
        }
    };

    private static final CellValue.Visitor<Boolean> TO_BOOLEAN = new CellValue.Visitor<Boolean>() {
        @Override
        public Boolean visitNumber(double number) {
            return number != 0;
        }

        @Override
        public Boolean visitText(String text) {
            String trimmed = text.trim();
            if ("true".equalsIgnoreCase(trimmed)) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(trimmed)) {
                return Boolean.FALSE;
            }
            return null;
        }

        @Override
        public Boolean visitBoolean(boolean bool) {
            return bool;
        }

        @Override
        public Boolean visitDate(LocalDate date) {
            return null;
        }

        @Override
        public Boolean visitEmpty() {
            return Boolean.FALSE;
        }
    };

    private ValueCoercion() {
    }

    /**
     * Number, Boolean (1/0), Empty (0) or unambiguously numeric text; null otherwise.
     */
    public static Double toNumber(CellValue value) {
        return value.accept(TO_NUMBER);
    }

    public static String toText(CellValue value) {
        return value.accept(TO_TEXT);
    }

    /**
     * Boolean, Number (non-zero), "true"/"false" text, Empty (false); null otherwise.
     */
    public static Boolean toBoolean(CellValue value) {
        return value.accept(TO_BOOLEAN);
    }

    /**
     * Full-precision text form of a number: integral values without a
     * fraction, everything else in plain (non-scientific) notation.
     */
    public static String formatNumber(double number) {
        if (number == Math.rint(number) && Math.abs(number) < 1e15) {
            return String.valueOf((long) number);
        }
        return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
    }

    /**
     * Orders two values for the comparison operators.
     *
     * @return negative, zero or positive; null when the kinds cannot be compared
     */
    public static Integer compare(CellValue left, CellValue right) {
        if (left.isEmpty() && right.isEmpty()) {
            return 0;
        }
        if (left.isEmpty()) {
            left = emptyLike(right);
        } else if (right.isEmpty()) {
            right = emptyLike(left);
        }
        if (left == null || right == null) {
            return null;
        }
        boolean leftText = left instanceof CellValue.TextValue;
        boolean rightText = right instanceof CellValue.TextValue;
        if (leftText && rightText) {
            return toText(left).compareToIgnoreCase(toText(right));
        }
        boolean leftDate = left instanceof CellValue.DateValue;
        boolean rightDate = right instanceof CellValue.DateValue;
        if (leftDate || rightDate) {
            if (leftDate && rightDate) {
                return ((CellValue.DateValue) left).getValue().compareTo(((CellValue.DateValue) right).getValue());
            }
            return null;
        }
        Double l = toNumber(left);
        Double r = toNumber(right);
        if (l == null || r == null) {
            return null;
        }
        return Double.compare(l, r);
    }

    // Empty takes the neutral value of whatever it is compared with
    private static CellValue emptyLike(CellValue other) {
        switch (other.getType()) {
            case TEXT:
                return CellValue.text("");
            case BOOLEAN:
                return CellValue.bool(false);
            case NUMBER:
                return CellValue.number(0);
            default:
                return null;
        }
    }
}
