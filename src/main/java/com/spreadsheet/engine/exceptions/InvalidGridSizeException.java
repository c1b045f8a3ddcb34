package com.spreadsheet.engine.exceptions;

/**
 * Thrown when a sheet is requested with a row or column count
 * outside the supported grid limits.
 */
public class InvalidGridSizeException extends RuntimeException {
    public InvalidGridSizeException(String message) {
        super(message);
    }
}
