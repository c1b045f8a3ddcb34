package com.spreadsheet.engine.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.spreadsheet.engine.formula.ParsedFormula;

/**
 * Represents a single spreadsheet cell.
 * Stores:
 * - its address
 * - rawValue (literal text or a formula beginning with "=")
 * - the parsed formula, present only when rawValue is a valid formula
 * - the computed value, or an error; never both at once
 * - displayValue (value rounded for presentation, or the error code)
 * - dirty flag to signal the computed value may be stale
 * - chainDepth, the length of the longest formula chain ending here
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Cell {
    private final CellAddress address;
    private String rawValue = "";
    private ParsedFormula formula;
    private CellValue value = CellValue.empty();
    private CellError error;
    private String displayValue = "";
    private boolean dirty;
    private int chainDepth;

    public Cell(CellAddress address) {
        this.address = address;
    }

    /**
     * Detached copy, safe to hand out after the sheet lock is released.
     */
    public Cell copy() {
        Cell copy = new Cell(address);
        copy.rawValue = rawValue;
        copy.formula = formula;
        copy.value = value;
        copy.error = error;
        copy.displayValue = displayValue;
        copy.dirty = dirty;
        copy.chainDepth = chainDepth;
        return copy;
    }

    public CellAddress getAddress() {
        return address;
    }

    public String getRawValue() {
        return rawValue;
    }

    public void setRawValue(String rawValue) {
        this.rawValue = rawValue == null ? "" : rawValue;
        this.dirty = true;
    }

    @JsonIgnore
    public boolean isFormula() {
        return rawValue.startsWith("=");
    }

    @JsonIgnore
    public ParsedFormula getFormula() {
        return formula;
    }

    public void setFormula(ParsedFormula formula) {
        this.formula = formula;
    }

    /**
     * The computed value, or null while the cell holds an error.
     */
    public CellValue getValue() {
        return error == null ? value : null;
    }

    /**
     * Last computed value, kept across a syntax error until a valid
     * formula replaces it.
     */
    @JsonIgnore
    public CellValue getRetainedValue() {
        return value;
    }

    public CellError getError() {
        return error;
    }

    public ValueType getDataType() {
        return error == null ? value.getType() : null;
    }

    public String getDisplayValue() {
        return displayValue;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return rawValue.isEmpty() && error == null;
    }

    /**
     * Stores a successful computation; clears any error.
     */
    public void setComputedValue(CellValue value, String displayValue) {
        this.value = value;
        this.error = null;
        this.displayValue = displayValue;
        this.dirty = false;
    }

    /**
     * Stores an evaluation error; the previous value is dropped.
     */
    public void setError(CellError error, String displayValue) {
        this.value = CellValue.empty();
        this.error = error;
        this.displayValue = displayValue;
        this.dirty = false;
    }

    /**
     * Stores a formula syntax error while keeping the last computed value.
     */
    public void setSyntaxError(CellError error, String displayValue) {
        this.error = error;
        this.displayValue = displayValue;
        this.dirty = false;
    }

    public void setDirty(boolean dirty) {
        this.dirty = dirty;
    }

    @JsonIgnore
    public boolean isDirty() {
        return dirty;
    }

    /**
     * 0 for literal cells; otherwise 1 + the deepest chain among the
     * formula cells this one reads, as of the last pass that touched it.
     */
    @JsonIgnore
    public int getChainDepth() {
        return chainDepth;
    }

    public void setChainDepth(int chainDepth) {
        this.chainDepth = chainDepth;
    }
}
