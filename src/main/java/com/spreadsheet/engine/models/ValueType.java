package com.spreadsheet.engine.models;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Enumerates the kinds of value a cell can hold:
 * NUMBER, TEXT, BOOLEAN, DATE, EMPTY.
 */
public enum ValueType {
    NUMBER,
    TEXT,
    BOOLEAN,
    DATE,
    EMPTY;

    /**
     * Allows case-insensitive JSON input.
     * For example, "number" -> NUMBER, "bOolean" -> BOOLEAN, etc.
     */
    @JsonCreator
    public static ValueType fromValue(String value) {
        return ValueType.valueOf(value.toUpperCase());
    }
}
