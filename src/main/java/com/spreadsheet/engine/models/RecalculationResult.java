package com.spreadsheet.engine.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.List;

/**
 * Summary of one recalculation pass. Results are listed in evaluation
 * order: circular and unparseable cells first, then every other cell
 * after the cells it depends on.
 */
public class RecalculationResult {
    private final List<CellResult> results;
    private final double executionTimeMs;
    private final int evaluatedCount;
    private final int circularCount;

    public RecalculationResult(List<CellResult> results, double executionTimeMs, int evaluatedCount, int circularCount) {
        this.results = Collections.unmodifiableList(results);
        this.executionTimeMs = executionTimeMs;
        this.evaluatedCount = evaluatedCount;
        this.circularCount = circularCount;
    }

    public List<CellResult> getResults() {
        return results;
    }

    public double getExecutionTimeMs() {
        return executionTimeMs;
    }

    public int getEvaluatedCount() {
        return evaluatedCount;
    }

    public int getCircularCount() {
        return circularCount;
    }

    /**
     * The result for one cell, or null if the cell was not part of the pass.
     */
    @JsonIgnore
    public CellResult getResult(CellAddress address) {
        for (CellResult result : results) {
            if (result.getAddress().equals(address)) {
                return result;
            }
        }
        return null;
    }

    @JsonIgnore
    public int indexOf(CellAddress address) {
        for (int i = 0; i < results.size(); i++) {
            if (results.get(i).getAddress().equals(address)) {
                return i;
            }
        }
        return -1;
    }
}
