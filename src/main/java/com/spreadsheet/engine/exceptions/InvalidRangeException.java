package com.spreadsheet.engine.exceptions;

/**
 * Thrown when a range's start corner lies after its end corner
 * on either axis (e.g. "C3:A1"), or the range text is malformed.
 */
public class InvalidRangeException extends RuntimeException {
    public InvalidRangeException(String message) {
        super(message);
    }
}
