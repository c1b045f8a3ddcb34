package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.CellAddress;

/**
 * Callback through which the evaluator reads other cells.
 */
public interface CellLookup {

    /**
     * Whether the address lies inside the sheet's grid.
     */
    boolean contains(CellAddress address);

    /**
     * Current computed value or error of an in-grid cell.
     */
    EvaluationResult lookup(CellAddress address);
}
