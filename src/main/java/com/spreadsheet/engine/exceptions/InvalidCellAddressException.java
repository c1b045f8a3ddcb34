package com.spreadsheet.engine.exceptions;

/**
 * Thrown when a caller supplies cell address text that is not valid
 * A1 notation, or an address outside the sheet's grid.
 * For example, "Invalid cell address: 1A".
 */
public class InvalidCellAddressException extends RuntimeException {
    public InvalidCellAddressException(String message) {
        super(message);
    }
}
