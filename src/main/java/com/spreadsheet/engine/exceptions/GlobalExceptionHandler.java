package com.spreadsheet.engine.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Catches custom exceptions from anywhere in the controllers or services,
 * returning error JSON with an HTTP 4xx code for caller mistakes.
 * Formula problems never get here; they are stored on the cell.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidCellAddressException.class)
    public ResponseEntity<ErrorResponse> handleInvalidAddress(InvalidCellAddressException ex) {
        ErrorResponse error = new ErrorResponse("INVALID_CELL_ADDRESS", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidRangeException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRange(InvalidRangeException ex) {
        ErrorResponse error = new ErrorResponse("INVALID_RANGE", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidGridSizeException.class)
    public ResponseEntity<ErrorResponse> handleInvalidGridSize(InvalidGridSizeException ex) {
        ErrorResponse error = new ErrorResponse("INVALID_GRID_SIZE", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(SheetNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSheetNotFound(SheetNotFoundException ex) {
        ErrorResponse error = new ErrorResponse("SHEET_NOT_FOUND", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        // Engine invariant violations land here; they are defects, not user errors
        log.error("Unhandled error", ex);
        ErrorResponse error = new ErrorResponse("SERVER_ERROR", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
