package com.spreadsheet.engine.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Spreadsheet error codes a cell can carry instead of a value.
 */
public enum ErrorKind {
    DIV_ZERO("#DIV/0!"),
    REF("#REF!"),
    VALUE("#VALUE!"),
    NAME("#NAME?"),
    CIRCULAR("#CIRCULAR!"),
    NOT_AVAILABLE("#N/A"),
    NULL("#NULL!"),
    // value out of range: non-finite results, dependency depth over the ceiling
    NUM("#NUM!");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
