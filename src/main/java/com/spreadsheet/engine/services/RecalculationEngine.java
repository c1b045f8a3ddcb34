package com.spreadsheet.engine.services;

import com.spreadsheet.engine.exceptions.EngineInvariantException;
import com.spreadsheet.engine.formula.CellLookup;
import com.spreadsheet.engine.formula.EvaluationResult;
import com.spreadsheet.engine.formula.FormulaEvaluator;
import com.spreadsheet.engine.formula.ValueFormatter;
import com.spreadsheet.engine.graph.CircularReferenceDetector;
import com.spreadsheet.engine.graph.CycleSearchResult;
import com.spreadsheet.engine.graph.DependencyGraph;
import com.spreadsheet.engine.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Runs recalculation passes over a sheet.
 * <p>
 * A pass marks circular cells first, orders the remaining formula cells so
 * every dependency is evaluated before its dependents, then evaluates them
 * one by one, writing each result before the next cell is looked at.
 * Callers must hold the sheet's write lock.
 */
public class RecalculationEngine {

    private static final Logger log = LoggerFactory.getLogger(RecalculationEngine.class);

    enum State {
        PENDING,
        IN_PROGRESS,
        ORDERED,
        RESOLVED,
        CIRCULAR
    }

    private final FormulaEvaluator evaluator;
    private final ValueFormatter formatter;
    private final int maxDepth;

    public RecalculationEngine(FormulaEvaluator evaluator, ValueFormatter formatter, int maxDepth) {
        this.evaluator = evaluator;
        this.formatter = formatter;
        this.maxDepth = maxDepth;
    }

    /**
     * Every formula-bearing cell of the sheet.
     */
    public RecalculationResult recalculateAll(Sheet sheet) {
        return run(sheet, sheet.getFormulaCells());
    }

    /**
     * Only the formula-bearing cells inside {@code range}; everything else is left as is.
     */
    public RecalculationResult recalculateRange(Sheet sheet, CellRange range) {
        List<CellAddress> scope = sheet.getFormulaCells().stream()
                .filter(range::contains)
                .collect(Collectors.toList());
        return run(sheet, scope);
    }

    /**
     * The edited cells and everything that transitively reads them.
     */
    public RecalculationResult recalculateFrom(Sheet sheet, Collection<CellAddress> edited) {
        Set<CellAddress> scope = new TreeSet<>();
        for (CellAddress address : sheet.getDependencyGraph().collectDependents(edited)) {
            if (sheet.isFormulaCell(address)) {
                scope.add(address);
            }
        }
        return run(sheet, scope);
    }

    private RecalculationResult run(Sheet sheet, Collection<CellAddress> scope) {
        long start = System.nanoTime();
        Pass pass = new Pass(sheet, scope);
        List<CellResult> results = pass.execute();
        double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;

        log.info("Sheet {}: recalculated {} cells ({} circular) in {} ms",
                sheet.getId(), pass.evaluatedCount, pass.circularCount, String.format("%.3f", elapsedMs));
        return new RecalculationResult(results, elapsedMs, pass.evaluatedCount, pass.circularCount);
    }

    private final class Pass {
        private final Sheet sheet;
        private final DependencyGraph graph;
        private final Map<CellAddress, State> states = new LinkedHashMap<>();
        private final Map<CellAddress, Integer> chainDepth = new HashMap<>();
        private final Map<CellAddress, CellValue> previousValues = new HashMap<>();
        private final Map<CellAddress, CellError> previousErrors = new HashMap<>();
        private final List<CellResult> results = new ArrayList<>();
        private Map<CellAddress, List<CellAddress>> circular;
        private int evaluatedCount;
        private int circularCount;

        Pass(Sheet sheet, Collection<CellAddress> scope) {
            this.sheet = sheet;
            this.graph = sheet.getDependencyGraph();
            for (CellAddress address : scope) {
                Cell cell = sheet.getOrCreateCell(address);
                states.put(address, State.PENDING);
                previousValues.put(address, cell.getValue());
                previousErrors.put(address, cell.getError());
                cell.setDirty(true);
            }
        }

        List<CellResult> execute() {
            restampSyntaxErrors();
            markCircular();
            for (CellAddress address : order()) {
                evaluate(address);
            }
            return results;
        }

        // Cells whose formula failed to parse keep their #NAME? and never reach the evaluator
        private void restampSyntaxErrors() {
            for (Map.Entry<CellAddress, State> entry : states.entrySet()) {
                Cell cell = sheet.getCell(entry.getKey());
                if (cell.getFormula() != null) {
                    continue;
                }
                CellError error = cell.getError() != null
                        ? cell.getError()
                        : new CellError(ErrorKind.NAME, "Formula could not be parsed");
                cell.setSyntaxError(error, error.getCode());
                cell.setChainDepth(1);
                entry.setValue(State.RESOLVED);
                record(entry.getKey());
            }
        }

        private void markCircular() {
            CircularReferenceDetector detector = new CircularReferenceDetector(graph, maxDepth);
            circular = detector.findCircularCells(states.keySet());
            // Members of one cycle share the same path list
            Map<List<CellAddress>, String> described = new IdentityHashMap<>();
            for (Map.Entry<CellAddress, List<CellAddress>> entry : circular.entrySet()) {
                CellAddress address = entry.getKey();
                if (!states.containsKey(address)) {
                    continue;
                }
                String path = described.computeIfAbsent(entry.getValue(),
                        cycle -> CycleSearchResult.cycle(cycle).describePath());
                CellError error = CellError.of(ErrorKind.CIRCULAR, "Circular reference: " + path, "cycle", path);
                Cell cell = sheet.getCell(address);
                cell.setError(error, formatter.format(null, error));
                cell.setChainDepth(1);
                states.put(address, State.CIRCULAR);
                circularCount++;
                record(address);
            }
            if (!circular.isEmpty()) {
                log.warn("Sheet {}: {} cells are part of circular references", sheet.getId(), circular.size());
                log.debug("Sheet {}: circular cells {}", sheet.getId(), circular.keySet());
            }
        }

        /**
         * Post-order walk over the pending cells. Cells outside the pass are
         * read as stored, so only in-pass dependencies constrain the order.
         * A cell leaves the walk as ORDERED; meeting a cell that is still
         * IN_PROGRESS means a cycle slipped past {@link #markCircular()}.
         */
        private List<CellAddress> order() {
            List<CellAddress> ordered = new ArrayList<>();
            for (CellAddress root : new ArrayList<>(states.keySet())) {
                if (states.get(root) != State.PENDING) {
                    continue;
                }
                Deque<CellAddress> cells = new ArrayDeque<>();
                Deque<Iterator<CellAddress>> frames = new ArrayDeque<>();
                states.put(root, State.IN_PROGRESS);
                cells.push(root);
                frames.push(graph.getFormulaDependencies(root).iterator());

                while (!frames.isEmpty()) {
                    Iterator<CellAddress> next = frames.peek();
                    if (next.hasNext()) {
                        CellAddress dependency = next.next();
                        State state = states.get(dependency);
                        if (state == State.PENDING) {
                            states.put(dependency, State.IN_PROGRESS);
                            cells.push(dependency);
                            frames.push(graph.getFormulaDependencies(dependency).iterator());
                        } else if (state == State.IN_PROGRESS) {
                            throw new EngineInvariantException("Unmarked cycle through " + dependency);
                        }
                        continue;
                    }
                    frames.pop();
                    CellAddress done = cells.pop();
                    states.put(done, State.ORDERED);
                    chainDepth.put(done, 1 + deepestDependency(done));
                    ordered.add(done);
                }
            }
            return ordered;
        }

        /**
         * Fresh depth for dependencies ordered in this pass; any other formula
         * cell contributes the depth stored by the last pass that reached it.
         */
        private int deepestDependency(CellAddress address) {
            int deepest = 0;
            for (CellAddress dependency : graph.getFormulaDependencies(address)) {
                Integer depth = chainDepth.get(dependency);
                if (depth == null) {
                    Cell stored = sheet.getCell(dependency);
                    depth = stored == null ? 0 : stored.getChainDepth();
                }
                deepest = Math.max(deepest, depth);
            }
            return deepest;
        }

        private void evaluate(CellAddress address) {
            Cell cell = sheet.getCell(address);
            int depth = chainDepth.get(address);
            cell.setChainDepth(depth);
            EvaluationResult result;
            if (depth > maxDepth) {
                result = EvaluationResult.error(CellError.of(ErrorKind.NUM,
                        "Dependency chain deeper than " + maxDepth + " cells", "depth", String.valueOf(depth)));
            } else {
                result = evaluator.evaluate(cell.getFormula(), lookup);
            }

            if (result.isError()) {
                cell.setError(result.getError(), formatter.format(null, result.getError()));
            } else {
                cell.setComputedValue(result.getValue(), formatter.format(result.getValue(), null));
            }
            states.put(address, State.RESOLVED);
            evaluatedCount++;
            log.debug("Sheet {}: {} -> {}", sheet.getId(), address, cell.getDisplayValue());
            record(address);
        }

        private void record(CellAddress address) {
            Cell cell = sheet.getCell(address);
            boolean changed = !Objects.equals(previousValues.get(address), cell.getValue())
                    || !Objects.equals(previousErrors.get(address), cell.getError());
            results.add(new CellResult(address, cell.getValue(), cell.getError(), changed));
        }

        private final CellLookup lookup = new CellLookup() {
            @Override
            public boolean contains(CellAddress address) {
                return sheet.contains(address);
            }

            @Override
            public EvaluationResult lookup(CellAddress address) {
                if (circular.containsKey(address)) {
                    Map<String, String> details = new LinkedHashMap<>();
                    details.put("reference", address.toText());
                    details.put("cause", ErrorKind.CIRCULAR.getCode());
                    return EvaluationResult.error(new CellError(ErrorKind.REF,
                            "Reference to circular cell " + address.toText(), details));
                }
                Cell cell = sheet.getCell(address);
                if (cell == null) {
                    return EvaluationResult.of(CellValue.empty());
                }
                if (cell.getError() != null) {
                    return EvaluationResult.error(cell.getError());
                }
                return EvaluationResult.of(cell.getValue());
            }
        };
    }
}
