package com.spreadsheet.engine.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Closed set of computed cell values: Number, Text, Boolean, Date, Empty.
 * The constructor is private, so the nested classes are the only variants;
 * consumers branch on them through {@link Visitor}.
 */
public abstract class CellValue {

    public interface Visitor<R> {
        R visitNumber(double number);

        R visitText(String text);

        R visitBoolean(boolean bool);

        R visitDate(LocalDate date);

        R visitEmpty();
    }

    private static final CellValue EMPTY = new EmptyValue();
    private static final CellValue TRUE = new BooleanValue(true);
    private static final CellValue FALSE = new BooleanValue(false);

    private CellValue() {
    }

    public static CellValue number(double value) {
        return new NumberValue(value);
    }

    public static CellValue text(String value) {
        return new TextValue(Objects.requireNonNull(value, "text"));
    }

    public static CellValue bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static CellValue date(LocalDate value) {
        return new DateValue(Objects.requireNonNull(value, "date"));
    }

    public static CellValue empty() {
        return EMPTY;
    }

    public abstract ValueType getType();

    public abstract <R> R accept(Visitor<R> visitor);

    public boolean isEmpty() {
        return getType() == ValueType.EMPTY;
    }

    /**
     * JSON form: a number, string, boolean, ISO date string, or null.
     */
    @JsonValue
    public abstract Object toJson();

    public static final class NumberValue extends CellValue {
        private final double value;

        private NumberValue(double value) {
            this.value = value;
        }

        public double getValue() {
            return value;
        }

        @Override
        public ValueType getType() {
            return ValueType.NUMBER;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumber(value);
        }

        @Override
        public Object toJson() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof NumberValue && Double.compare(value, ((NumberValue) o).value) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(value);
        }

        @Override
        public String toString() {
            return "Number(" + value + ")";
        }
    }

    public static final class TextValue extends CellValue {
        private final String value;

        private TextValue(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        @Override
        public ValueType getType() {
            return ValueType.TEXT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitText(value);
        }

        @Override
        public Object toJson() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof TextValue && value.equals(((TextValue) o).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return "Text(" + value + ")";
        }
    }

    public static final class BooleanValue extends CellValue {
        private final boolean value;

        private BooleanValue(boolean value) {
            this.value = value;
        }

        public boolean getValue() {
            return value;
        }

        @Override
        public ValueType getType() {
            return ValueType.BOOLEAN;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBoolean(value);
        }

        @Override
        public Object toJson() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BooleanValue && value == ((BooleanValue) o).value;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return "Boolean(" + value + ")";
        }
    }

    public static final class DateValue extends CellValue {
        private final LocalDate value;

        private DateValue(LocalDate value) {
            this.value = value;
        }

        public LocalDate getValue() {
            return value;
        }

        @Override
        public ValueType getType() {
            return ValueType.DATE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDate(value);
        }

        @Override
        public Object toJson() {
            return value.toString();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof DateValue && value.equals(((DateValue) o).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return "Date(" + value + ")";
        }
    }

    public static final class EmptyValue extends CellValue {
        private EmptyValue() {
        }

        @Override
        public ValueType getType() {
            return ValueType.EMPTY;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEmpty();
        }

        @Override
        public Object toJson() {
            return null;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof EmptyValue;
        }

        @Override
        public int hashCode() {
            return 0;
        }

        @Override
        public String toString() {
            return "Empty";
        }
    }
}
