package com.spreadsheet.engine.services;

import com.spreadsheet.engine.config.EngineProperties;
import com.spreadsheet.engine.exceptions.FormulaSyntaxException;
import com.spreadsheet.engine.exceptions.InvalidCellAddressException;
import com.spreadsheet.engine.exceptions.InvalidGridSizeException;
import com.spreadsheet.engine.exceptions.InvalidRangeException;
import com.spreadsheet.engine.exceptions.SheetNotFoundException;
import com.spreadsheet.engine.formula.FormulaEvaluator;
import com.spreadsheet.engine.formula.FormulaParser;
import com.spreadsheet.engine.formula.FunctionRegistry;
import com.spreadsheet.engine.formula.LiteralParser;
import com.spreadsheet.engine.formula.ParsedFormula;
import com.spreadsheet.engine.formula.ValueFormatter;
import com.spreadsheet.engine.graph.CircularReferenceDetector;
import com.spreadsheet.engine.graph.CycleSearchResult;
import com.spreadsheet.engine.graph.DependencyGraph;
import com.spreadsheet.engine.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Main business logic for creating sheets, writing cell content,
 * recalculating and inspecting dependencies.
 * <p>
 * Every write goes through {@link #writeCell}, which keeps the cell store
 * and the dependency graph in step. Writes and passes take the sheet's
 * write lock; reads take its read lock.
 */
@Service
public class SheetService {

    private static final Logger log = LoggerFactory.getLogger(SheetService.class);

    // All sheets live here in memory; persistence belongs to the caller
    private final Map<Long, Sheet> sheets = new ConcurrentHashMap<>();

    private final EngineProperties properties;
    private final FormulaParser parser;
    private final ValueFormatter formatter;
    private final RecalculationEngine engine;

    public SheetService() {
        this(new EngineProperties());
    }

    @Autowired
    public SheetService(EngineProperties properties) {
        this.properties = properties;
        this.parser = new FormulaParser(properties.getMaxDepth());
        this.formatter = new ValueFormatter(properties.getDisplayPrecision());
        FormulaEvaluator evaluator = new FormulaEvaluator(FunctionRegistry.withBuiltins(), properties.getMaxDepth());
        this.engine = new RecalculationEngine(evaluator, formatter, properties.getMaxDepth());
    }

    /**
     * Creates an empty sheet of the given size and returns its ID.
     */
    public long createSheet(int rows, int columns) {
        if (rows < 1 || rows > properties.getMaxRows()) {
            throw new InvalidGridSizeException("Row count must be between 1 and " + properties.getMaxRows() + ", got " + rows);
        }
        if (columns < 1 || columns > properties.getMaxColumns()) {
            throw new InvalidGridSizeException("Column count must be between 1 and " + properties.getMaxColumns() + ", got " + columns);
        }
        Sheet sheet = new Sheet(rows, columns);
        sheets.put(sheet.getId(), sheet);
        log.info("Created sheet {} with {} rows and {} columns", sheet.getId(), rows, columns);
        return sheet.getId();
    }

    /**
     * Retrieves a Sheet by ID. Throws if not found.
     */
    public Sheet getSheet(long sheetId) {
        Sheet sheet = sheets.get(sheetId);
        if (sheet == null) {
            throw new SheetNotFoundException("Sheet not found: " + sheetId);
        }
        return sheet;
    }

    /**
     * Replaces the whole content of the sheet and runs a full pass.
     * Every address is validated before anything is cleared.
     */
    public RecalculationResult loadSnapshot(long sheetId, Map<String, String> contents) {
        Sheet sheet = getSheet(sheetId);
        Map<CellAddress, String> parsed = resolveAddresses(sheet, contents);

        sheet.getLock().writeLock().lock();
        try {
            sheet.clear();
            parsed.forEach((address, raw) -> writeCell(sheet, address, raw));
            log.info("Loaded {} cells into sheet {}", parsed.size(), sheetId);
            return engine.recalculateAll(sheet);
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    /**
     * Writes one cell, then recalculates it and everything that reads it.
     */
    public RecalculationResult setCellContent(long sheetId, String addressText, String rawValue) {
        Sheet sheet = getSheet(sheetId);
        CellAddress address = resolveAddress(sheet, addressText);

        sheet.getLock().writeLock().lock();
        try {
            writeCell(sheet, address, rawValue);
            return engine.recalculateFrom(sheet, List.of(address));
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    /**
     * Writes several cells and recalculates their dependents in a single pass.
     */
    public RecalculationResult setCellContents(long sheetId, Map<String, String> contents) {
        Sheet sheet = getSheet(sheetId);
        Map<CellAddress, String> parsed = resolveAddresses(sheet, contents);

        sheet.getLock().writeLock().lock();
        try {
            parsed.forEach((address, raw) -> writeCell(sheet, address, raw));
            return engine.recalculateFrom(sheet, new ArrayList<>(parsed.keySet()));
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    /**
     * A copy of the stored cell taken under the read lock, or an empty cell
     * for an address that was never written.
     */
    public Cell getCell(long sheetId, String addressText) {
        Sheet sheet = getSheet(sheetId);
        CellAddress address = resolveAddress(sheet, addressText);

        sheet.getLock().readLock().lock();
        try {
            Cell cell = sheet.getCell(address);
            return cell != null ? cell.copy() : new Cell(address);
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * Recalculates every formula cell, or only those inside {@code rangeText} when given.
     */
    public RecalculationResult recalculate(long sheetId, String rangeText) {
        Sheet sheet = getSheet(sheetId);
        CellRange range = null;
        if (rangeText != null && !rangeText.isBlank()) {
            range = CellRange.fromText(rangeText.trim());
            if (!range.isWithin(sheet.getRowCount(), sheet.getColumnCount())) {
                throw new InvalidRangeException("Range " + range.toText() + " is outside the sheet");
            }
        }

        sheet.getLock().writeLock().lock();
        try {
            return range == null ? engine.recalculateAll(sheet) : engine.recalculateRange(sheet, range);
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    /**
     * Returns address -> display value for every non-empty cell, row by row.
     * No evaluation here, because each cell's value is stored by the last pass.
     */
    public Map<String, String> getSheetData(long sheetId) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            Map<String, String> data = new LinkedHashMap<>();
            sheet.getCells().keySet().stream().sorted().forEach(address -> {
                Cell cell = sheet.getCell(address);
                if (!cell.isEmpty()) {
                    data.put(address.toText(), cell.getDisplayValue());
                }
            });
            return data;
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * References read by the cell's formula, as A1 text.
     */
    public Set<String> getDependencies(long sheetId, String addressText) {
        Sheet sheet = getSheet(sheetId);
        CellAddress address = resolveAddress(sheet, addressText);

        sheet.getLock().readLock().lock();
        try {
            Set<String> refs = new LinkedHashSet<>();
            sheet.getDependencyGraph().getDependencies(address).forEach(ref -> refs.add(ref.toText()));
            return refs;
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * Formula cells that read the cell directly or through a range.
     */
    public Set<String> getDependents(long sheetId, String addressText) {
        Sheet sheet = getSheet(sheetId);
        CellAddress address = resolveAddress(sheet, addressText);

        sheet.getLock().readLock().lock();
        try {
            Set<String> readers = new LinkedHashSet<>();
            sheet.getDependencyGraph().getDependents(address).forEach(reader -> readers.add(reader.toText()));
            return readers;
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    public CycleSearchResult findCycle(long sheetId, String addressText) {
        Sheet sheet = getSheet(sheetId);
        CellAddress address = resolveAddress(sheet, addressText);

        sheet.getLock().readLock().lock();
        try {
            return new CircularReferenceDetector(sheet.getDependencyGraph(), properties.getMaxDepth()).findCycle(address);
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    public Map<String, Set<String>> getForwardGraph(long sheetId) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().readLock().lock();
        try {
            return sheet.getForwardGraph();
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    public Map<String, Set<String>> getReverseGraph(long sheetId) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().readLock().lock();
        try {
            return sheet.getReverseGraph();
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    /**
     * Stores raw content and refreshes the cell's graph edges.
     * Literals get their value immediately; formulas wait for the pass.
     * A formula that fails to parse keeps the previous value, shows #NAME?
     * and has no edges.
     */
    private void writeCell(Sheet sheet, CellAddress address, String rawValue) {
        Cell cell = sheet.getOrCreateCell(address);
        DependencyGraph graph = sheet.getDependencyGraph();
        cell.setRawValue(rawValue);

        if (!cell.isFormula()) {
            cell.setFormula(null);
            graph.clearFormula(address);
            CellValue value = LiteralParser.parse(cell.getRawValue());
            cell.setComputedValue(value, formatter.format(value, null));
            cell.setChainDepth(0);
            return;
        }

        try {
            ParsedFormula formula = parser.parse(cell.getRawValue());
            cell.setFormula(formula);
            graph.setFormula(address, formula.getReferences());
            log.debug("Sheet {}: {} now reads {}", sheet.getId(), address, formula.getReferences());
        } catch (FormulaSyntaxException e) {
            cell.setFormula(null);
            graph.clearFormula(address);
            CellError error = CellError.of(ErrorKind.NAME, e.getMessage(), "position", String.valueOf(e.getPosition()));
            cell.setSyntaxError(error, error.getCode());
            log.debug("Sheet {}: {} has a syntax error: {}", sheet.getId(), address, e.getMessage());
        }
    }

    private CellAddress resolveAddress(Sheet sheet, String addressText) {
        CellAddress address = CellAddress.fromText(addressText);
        if (!sheet.contains(address)) {
            throw new InvalidCellAddressException("Cell " + address.toText() + " is outside the "
                    + sheet.getRowCount() + "x" + sheet.getColumnCount() + " grid");
        }
        return address;
    }

    private Map<CellAddress, String> resolveAddresses(Sheet sheet, Map<String, String> contents) {
        Map<CellAddress, String> parsed = new LinkedHashMap<>();
        if (contents != null) {
            contents.forEach((text, raw) -> parsed.put(resolveAddress(sheet, text), raw));
        }
        return parsed;
    }
}
