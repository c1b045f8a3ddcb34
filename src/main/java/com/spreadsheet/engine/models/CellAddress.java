package com.spreadsheet.engine.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.spreadsheet.engine.exceptions.InvalidCellAddressException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable (row, column) position of a cell, both zero-based.
 * The text form is A1 notation: bijective base-26 column letters
 * followed by the 1-based row number, e.g. (0,0) -> "A1", (9,27) -> "AB10".
 */
public final class CellAddress implements Comparable<CellAddress> {

    // Letters, then a row number without leading zero
    private static final Pattern A1_PATTERN = Pattern.compile("^([A-Za-z]+)([1-9][0-9]*)$");

    private final int row;
    private final int column;

    public CellAddress(int row, int column) {
        if (row < 0 || column < 0) {
            throw new InvalidCellAddressException("Row and column must be non-negative: (" + row + ", " + column + ")");
        }
        this.row = row;
        this.column = column;
    }

    public static CellAddress of(int row, int column) {
        return new CellAddress(row, column);
    }

    /**
     * Parses A1 notation (case-insensitive).
     * Throws InvalidCellAddressException for malformed text or a
     * column/row too large to be represented.
     */
    @JsonCreator
    public static CellAddress fromText(String text) {
        if (text == null) {
            throw new InvalidCellAddressException("Cell address must not be null");
        }
        Matcher matcher = A1_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            throw new InvalidCellAddressException("Invalid cell address: " + text);
        }
        int column = lettersToColumn(matcher.group(1));
        long rowNumber;
        try {
            rowNumber = Long.parseLong(matcher.group(2));
        } catch (NumberFormatException e) {
            throw new InvalidCellAddressException("Row number out of range in address: " + text);
        }
        if (rowNumber > Integer.MAX_VALUE) {
            throw new InvalidCellAddressException("Row number out of range in address: " + text);
        }
        return new CellAddress((int) rowNumber - 1, column);
    }

    /**
     * Bijective base-26: A=0 ... Z=25, AA=26, AB=27 ...
     */
    public static String columnToLetters(int column) {
        if (column < 0) {
            throw new InvalidCellAddressException("Column index must be non-negative: " + column);
        }
        StringBuilder letters = new StringBuilder();
        int remaining = column + 1;
        while (remaining > 0) {
            int digit = (remaining - 1) % 26;
            letters.append((char) ('A' + digit));
            remaining = (remaining - 1) / 26;
        }
        return letters.reverse().toString();
    }

    /**
     * Exact inverse of {@link #columnToLetters(int)}.
     */
    public static int lettersToColumn(String letters) {
        if (letters == null || letters.isEmpty()) {
            throw new InvalidCellAddressException("Column letters must not be empty");
        }
        long value = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = Character.toUpperCase(letters.charAt(i));
            if (c < 'A' || c > 'Z') {
                throw new InvalidCellAddressException("Invalid column letters: " + letters);
            }
            value = value * 26 + (c - 'A' + 1);
            if (value - 1 > Integer.MAX_VALUE) {
                throw new InvalidCellAddressException("Column out of range: " + letters);
            }
        }
        return (int) (value - 1);
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    public boolean isWithin(int rowCount, int columnCount) {
        return row < rowCount && column < columnCount;
    }

    @JsonValue
    public String toText() {
        return columnToLetters(column) + (row + 1L);
    }

    @Override
    public int compareTo(CellAddress other) {
        int byRow = Integer.compare(row, other.row);
        return byRow != 0 ? byRow : Integer.compare(column, other.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress that = (CellAddress) o;
        return row == that.row && column == that.column;
    }

    @Override
    public int hashCode() {
        return 31 * row + column;
    }

    @Override
    public String toString() {
        return toText();
    }
}
