package com.spreadsheet.engine.models;

import com.spreadsheet.engine.graph.DependencyGraph;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents an entire spreadsheet:
 * - Has a unique ID
 * - A fixed grid size (rows x columns)
 * - A sparse map of address -> Cell; unwritten cells are implicitly empty
 * - The dependency graph derived from the cells' formulas
 * - A read/write lock serialising writers on this sheet
 */
public class Sheet {

    // Generates unique IDs for newly created sheets
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final int rowCount;
    private final int columnCount;
    private final Map<CellAddress, Cell> cells = new ConcurrentHashMap<>();
    private final DependencyGraph dependencyGraph = new DependencyGraph();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Sheet(int rowCount, int columnCount) {
        this.id = ID_GENERATOR.getAndIncrement();
        this.rowCount = rowCount;
        this.columnCount = columnCount;
    }

    public long getId() {
        return id;
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public boolean contains(CellAddress address) {
        return address.isWithin(rowCount, columnCount);
    }

    public Map<CellAddress, Cell> getCells() {
        return Collections.unmodifiableMap(cells);
    }

    /**
     * Returns the stored cell, or null if nothing was ever written there.
     */
    public Cell getCell(CellAddress address) {
        return cells.get(address);
    }

    /**
     * Returns the stored cell, materialising an empty one on first write.
     */
    public Cell getOrCreateCell(CellAddress address) {
        return cells.computeIfAbsent(address, Cell::new);
    }

    /**
     * Every cell whose raw content is a formula, in row-major order.
     */
    public List<CellAddress> getFormulaCells() {
        List<CellAddress> formulaCells = new ArrayList<>();
        for (Cell cell : cells.values()) {
            if (cell.isFormula()) {
                formulaCells.add(cell.getAddress());
            }
        }
        Collections.sort(formulaCells);
        return formulaCells;
    }

    public boolean isFormulaCell(CellAddress address) {
        Cell cell = cells.get(address);
        return cell != null && cell.isFormula();
    }

    /**
     * Empties every cell and drops all dependency edges.
     */
    public void clear() {
        cells.clear();
        dependencyGraph.clear();
    }

    public DependencyGraph getDependencyGraph() {
        return dependencyGraph;
    }

    // Text views of the adjacency maps
    public Map<String, Set<String>> getForwardGraph() {
        return dependencyGraph.getForwardGraph();
    }

    public Map<String, Set<String>> getReverseGraph() {
        return dependencyGraph.getReverseGraph();
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
