package com.spreadsheet.engine.graph;

import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellRange;

import java.util.*;

/**
 * Bidirectional index of formula references.
 * <p>
 * Forward: formula cell -> references it reads (cells as 1x1 ranges, and ranges).
 * Reverse: referenced cell -> formula cells reading it, plus one entry per
 * referenced range. Ranges are stored once per formula and only expanded
 * when traversed, so edge count follows formula count, not range size.
 * <p>
 * Every mutation replaces a cell's whole edge set under the graph's monitor,
 * so readers never see a half-updated formula.
 */
public class DependencyGraph {

    private final Map<CellAddress, Set<CellRange>> dependencies = new HashMap<>();
    private final Map<CellAddress, Set<CellAddress>> cellDependents = new HashMap<>();
    private final Map<CellRange, Set<CellAddress>> rangeDependents = new HashMap<>();

    /**
     * Replaces the outgoing edges of {@code cell} with one edge per reference.
     */
    public synchronized void setFormula(CellAddress cell, Collection<CellRange> references) {
        removeEdges(cell);
        Set<CellRange> refs = new LinkedHashSet<>(references);
        dependencies.put(cell, refs);
        for (CellRange ref : refs) {
            if (ref.isSingleCell()) {
                cellDependents.computeIfAbsent(ref.getStart(), k -> new TreeSet<>()).add(cell);
            } else {
                rangeDependents.computeIfAbsent(ref, k -> new TreeSet<>()).add(cell);
            }
        }
    }

    /**
     * Drops every edge created by the cell's previous formula, if any.
     */
    public synchronized void clearFormula(CellAddress cell) {
        removeEdges(cell);
    }

    private void removeEdges(CellAddress cell) {
        Set<CellRange> old = dependencies.remove(cell);
        if (old == null) {
            return;
        }
        for (CellRange ref : old) {
            if (ref.isSingleCell()) {
                detach(cellDependents, ref.getStart(), cell);
            } else {
                detach(rangeDependents, ref, cell);
            }
        }
    }

    private static <K> void detach(Map<K, Set<CellAddress>> reverse, K key, CellAddress reader) {
        Set<CellAddress> readers = reverse.get(key);
        if (readers != null) {
            readers.remove(reader);
            if (readers.isEmpty()) {
                reverse.remove(key);
            }
        }
    }

    public synchronized boolean hasFormula(CellAddress cell) {
        return dependencies.containsKey(cell);
    }

    public synchronized Set<CellAddress> getFormulaCells() {
        return new TreeSet<>(dependencies.keySet());
    }

    /**
     * Direct references of the cell's formula; empty for non-formula cells.
     */
    public synchronized Set<CellRange> getDependencies(CellAddress cell) {
        Set<CellRange> refs = dependencies.get(cell);
        return refs == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(refs));
    }

    /**
     * Formula cells that read {@code cell}, directly or through a range.
     */
    public synchronized Set<CellAddress> getDependents(CellAddress cell) {
        Set<CellAddress> readers = new TreeSet<>(cellDependents.getOrDefault(cell, Collections.emptySet()));
        for (Map.Entry<CellRange, Set<CellAddress>> entry : rangeDependents.entrySet()) {
            if (entry.getKey().contains(cell)) {
                readers.addAll(entry.getValue());
            }
        }
        return readers;
    }

    /**
     * The formula-bearing cells among the cell's references, ranges expanded.
     * Non-formula cells have no outgoing edges, so only these matter for
     * ordering and cycle search.
     */
    public synchronized List<CellAddress> getFormulaDependencies(CellAddress cell) {
        Set<CellRange> refs = dependencies.get(cell);
        if (refs == null) {
            return Collections.emptyList();
        }
        Set<CellAddress> result = new LinkedHashSet<>();
        for (CellRange ref : refs) {
            if (ref.isSingleCell()) {
                if (dependencies.containsKey(ref.getStart())) {
                    result.add(ref.getStart());
                }
            } else if (ref.size() <= dependencies.size()) {
                for (CellAddress address : ref.expand()) {
                    if (dependencies.containsKey(address)) {
                        result.add(address);
                    }
                }
            } else {
                for (CellAddress address : new TreeSet<>(dependencies.keySet())) {
                    if (ref.contains(address)) {
                        result.add(address);
                    }
                }
            }
        }
        return new ArrayList<>(result);
    }

    /**
     * The seeds plus every cell that transitively reads one of them,
     * in breadth-first discovery order.
     */
    public synchronized Set<CellAddress> collectDependents(Collection<CellAddress> seeds) {
        Set<CellAddress> visited = new LinkedHashSet<>(seeds);
        Queue<CellAddress> queue = new ArrayDeque<>(seeds);
        while (!queue.isEmpty()) {
            CellAddress current = queue.poll();
            for (CellAddress reader : getDependents(current)) {
                if (visited.add(reader)) {
                    queue.add(reader);
                }
            }
        }
        return visited;
    }

    public synchronized int getEdgeCount() {
        int count = 0;
        for (Set<CellRange> refs : dependencies.values()) {
            count += refs.size();
        }
        return count;
    }

    public synchronized void clear() {
        dependencies.clear();
        cellDependents.clear();
        rangeDependents.clear();
    }

    /**
     * Formula cell -> references it reads, as A1 text.
     */
    public synchronized Map<String, Set<String>> getForwardGraph() {
        Map<String, Set<String>> view = new TreeMap<>();
        for (Map.Entry<CellAddress, Set<CellRange>> entry : dependencies.entrySet()) {
            Set<String> refs = new LinkedHashSet<>();
            entry.getValue().forEach(ref -> refs.add(ref.toText()));
            view.put(entry.getKey().toText(), refs);
        }
        return view;
    }

    /**
     * Referenced cell or range -> formula cells reading it, as A1 text.
     */
    public synchronized Map<String, Set<String>> getReverseGraph() {
        Map<String, Set<String>> view = new TreeMap<>();
        cellDependents.forEach((cell, readers) -> view.put(cell.toText(), toText(readers)));
        rangeDependents.forEach((range, readers) -> view.put(range.toText(), toText(readers)));
        return view;
    }

    private static Set<String> toText(Set<CellAddress> addresses) {
        Set<String> text = new LinkedHashSet<>();
        addresses.forEach(address -> text.add(address.toText()));
        return text;
    }
}
