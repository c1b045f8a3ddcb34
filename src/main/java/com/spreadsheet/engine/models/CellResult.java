package com.spreadsheet.engine.models;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Outcome of one cell in a recalculation pass.
 * Holds either a value or an error, plus whether the outcome differs
 * from what the cell held before the pass.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CellResult {
    private final CellAddress address;
    private final CellValue value;
    private final CellError error;
    private final boolean changed;

    public CellResult(CellAddress address, CellValue value, CellError error, boolean changed) {
        this.address = address;
        this.value = error == null ? value : null;
        this.error = error;
        this.changed = changed;
    }

    public CellAddress getAddress() {
        return address;
    }

    public CellValue getValue() {
        return value;
    }

    public CellError getError() {
        return error;
    }

    public boolean isChanged() {
        return changed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellResult)) {
            return false;
        }
        CellResult that = (CellResult) o;
        return changed == that.changed
                && address.equals(that.address)
                && Objects.equals(value, that.value)
                && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, value, error, changed);
    }

    @Override
    public String toString() {
        return address + "=" + (error != null ? error.getCode() : value) + (changed ? " (changed)" : "");
    }
}
