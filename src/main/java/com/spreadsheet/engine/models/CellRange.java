package com.spreadsheet.engine.models;

import com.fasterxml.jackson.annotation.JsonValue;
import com.spreadsheet.engine.exceptions.InvalidRangeException;

import java.util.ArrayList;
import java.util.List;

/**
 * Rectangular block of cells between two corners, inclusive.
 * The start corner must not be after the end corner on either axis;
 * such a range is rejected rather than silently flipped.
 * A single-cell range has start == end.
 */
public final class CellRange {

    private final CellAddress start;
    private final CellAddress end;

    public CellRange(CellAddress start, CellAddress end) {
        if (start == null || end == null) {
            throw new InvalidRangeException("Range corners must not be null");
        }
        if (start.getRow() > end.getRow() || start.getColumn() > end.getColumn()) {
            throw new InvalidRangeException("Invalid range " + start + ":" + end
                    + ": start must not be after end");
        }
        this.start = start;
        this.end = end;
    }

    public static CellRange of(CellAddress single) {
        return new CellRange(single, single);
    }

    /**
     * Accepts "A1:C3" or a single address "B2".
     */
    public static CellRange fromText(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidRangeException("Range must not be empty");
        }
        String[] parts = text.trim().split(":", -1);
        if (parts.length == 1) {
            return of(CellAddress.fromText(parts[0]));
        }
        if (parts.length != 2) {
            throw new InvalidRangeException("Invalid range: " + text);
        }
        return new CellRange(CellAddress.fromText(parts[0]), CellAddress.fromText(parts[1]));
    }

    public CellAddress getStart() {
        return start;
    }

    public CellAddress getEnd() {
        return end;
    }

    public boolean isSingleCell() {
        return start.equals(end);
    }

    public boolean contains(CellAddress address) {
        return address.getRow() >= start.getRow() && address.getRow() <= end.getRow()
                && address.getColumn() >= start.getColumn() && address.getColumn() <= end.getColumn();
    }

    public boolean isWithin(int rowCount, int columnCount) {
        return end.isWithin(rowCount, columnCount);
    }

    public long size() {
        return (long) (end.getRow() - start.getRow() + 1) * (end.getColumn() - start.getColumn() + 1);
    }

    /**
     * Enumerates the covered addresses row by row, left to right.
     * Every call builds a new list.
     */
    public List<CellAddress> expand() {
        List<CellAddress> addresses = new ArrayList<>();
        for (int row = start.getRow(); row <= end.getRow(); row++) {
            for (int col = start.getColumn(); col <= end.getColumn(); col++) {
                addresses.add(new CellAddress(row, col));
            }
        }
        return addresses;
    }

    @JsonValue
    public String toText() {
        return isSingleCell() ? start.toText() : start.toText() + ":" + end.toText();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRange)) {
            return false;
        }
        CellRange that = (CellRange) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return 31 * start.hashCode() + end.hashCode();
    }

    @Override
    public String toString() {
        return toText();
    }
}
