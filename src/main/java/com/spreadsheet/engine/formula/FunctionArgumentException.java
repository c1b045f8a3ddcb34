package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.CellError;
import com.spreadsheet.engine.models.ErrorKind;

/**
 * Raised inside a function body when an argument cannot be used;
 * the registry turns it into the carried error value.
 */
class FunctionArgumentException extends RuntimeException {

    private final CellError error;

    FunctionArgumentException(ErrorKind kind, String message) {
        super(message);
        this.error = new CellError(kind, message);
    }

    CellError getError() {
        return error;
    }
}
