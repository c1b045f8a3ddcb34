package com.spreadsheet.engine.graph;

import com.spreadsheet.engine.models.CellAddress;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Finds circular references in a {@link DependencyGraph} before anything
 * is evaluated. Ranges are expanded to the formula cells they cover.
 * Both searches are iterative, so long chains cannot overflow the stack.
 */
public class CircularReferenceDetector {

    private final DependencyGraph graph;
    private final int maxDepth;

    public CircularReferenceDetector(DependencyGraph graph, int maxDepth) {
        this.graph = graph;
        this.maxDepth = maxDepth;
    }

    /**
     * Depth-first walk from {@code start}. Stops at the first cell seen
     * again while still on the current path, or when the path grows past
     * the depth ceiling.
     */
    public CycleSearchResult findCycle(CellAddress start) {
        List<CellAddress> path = new ArrayList<>();
        Set<CellAddress> onPath = new HashSet<>();
        Set<CellAddress> explored = new HashSet<>();
        Deque<Iterator<CellAddress>> frames = new ArrayDeque<>();

        path.add(start);
        onPath.add(start);
        frames.push(graph.getFormulaDependencies(start).iterator());

        while (!frames.isEmpty()) {
            Iterator<CellAddress> next = frames.peek();
            if (!next.hasNext()) {
                frames.pop();
                CellAddress done = path.remove(path.size() - 1);
                onPath.remove(done);
                explored.add(done);
                continue;
            }
            CellAddress dependency = next.next();
            if (onPath.contains(dependency)) {
                List<CellAddress> cycle = new ArrayList<>(path.subList(path.indexOf(dependency), path.size()));
                cycle.add(dependency);
                return CycleSearchResult.cycle(cycle);
            }
            if (explored.contains(dependency)) {
                continue;
            }
            if (path.size() >= maxDepth) {
                List<CellAddress> chain = new ArrayList<>(path);
                chain.add(dependency);
                return CycleSearchResult.depthExceeded(chain);
            }
            path.add(dependency);
            onPath.add(dependency);
            frames.push(graph.getFormulaDependencies(dependency).iterator());
        }
        return CycleSearchResult.none();
    }

    /**
     * Every cell reachable from {@code roots} that lies on some cycle.
     * Uses strongly connected components, so cells on overlapping cycles
     * are all reported. Members of one component share a single cycle
     * path, taken through the component's first cell in row-major order.
     */
    public Map<CellAddress, List<CellAddress>> findCircularCells(Collection<CellAddress> roots) {
        Map<CellAddress, List<CellAddress>> circular = new TreeMap<>();
        for (Set<CellAddress> component : findCyclicComponents(roots)) {
            List<CellAddress> cycle = Collections.unmodifiableList(cycleThrough(Collections.min(component), component));
            for (CellAddress cell : component) {
                circular.put(cell, cycle);
            }
        }
        return circular;
    }

    private List<Set<CellAddress>> findCyclicComponents(Collection<CellAddress> roots) {
        Map<CellAddress, Integer> index = new HashMap<>();
        Map<CellAddress, Integer> lowLink = new HashMap<>();
        Deque<CellAddress> stack = new ArrayDeque<>();
        Set<CellAddress> onStack = new HashSet<>();
        List<Set<CellAddress>> components = new ArrayList<>();
        int counter = 0;

        for (CellAddress root : roots) {
            if (index.containsKey(root) || !graph.hasFormula(root)) {
                continue;
            }
            Deque<CellAddress> cells = new ArrayDeque<>();
            Deque<Iterator<CellAddress>> frames = new ArrayDeque<>();
            index.put(root, counter);
            lowLink.put(root, counter++);
            stack.push(root);
            onStack.add(root);
            cells.push(root);
            frames.push(graph.getFormulaDependencies(root).iterator());

            while (!frames.isEmpty()) {
                CellAddress cell = cells.peek();
                Iterator<CellAddress> next = frames.peek();
                if (next.hasNext()) {
                    CellAddress dependency = next.next();
                    if (!index.containsKey(dependency)) {
                        index.put(dependency, counter);
                        lowLink.put(dependency, counter++);
                        stack.push(dependency);
                        onStack.add(dependency);
                        cells.push(dependency);
                        frames.push(graph.getFormulaDependencies(dependency).iterator());
                    } else if (onStack.contains(dependency)) {
                        lowLink.put(cell, Math.min(lowLink.get(cell), index.get(dependency)));
                    }
                    continue;
                }
                frames.pop();
                cells.pop();
                if (!cells.isEmpty()) {
                    CellAddress parent = cells.peek();
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(cell)));
                }
                if (lowLink.get(cell).equals(index.get(cell))) {
                    Set<CellAddress> component = new LinkedHashSet<>();
                    CellAddress member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(cell));
                    if (component.size() > 1 || graph.getFormulaDependencies(cell).contains(cell)) {
                        components.add(component);
                    }
                }
            }
        }
        return components;
    }

    // Shortest way back to the cell without leaving its component
    private List<CellAddress> cycleThrough(CellAddress cell, Set<CellAddress> component) {
        Map<CellAddress, CellAddress> parent = new HashMap<>();
        Deque<CellAddress> queue = new ArrayDeque<>();
        queue.add(cell);
        while (!queue.isEmpty()) {
            CellAddress current = queue.poll();
            for (CellAddress dependency : graph.getFormulaDependencies(current)) {
                if (!component.contains(dependency)) {
                    continue;
                }
                if (dependency.equals(cell)) {
                    List<CellAddress> path = new ArrayList<>();
                    path.add(cell);
                    for (CellAddress step = current; !step.equals(cell); step = parent.get(step)) {
                        path.add(step);
                    }
                    path.add(cell);
                    Collections.reverse(path);
                    return path;
                }
                if (!parent.containsKey(dependency)) {
                    parent.put(dependency, current);
                    queue.add(dependency);
                }
            }
        }
        return Collections.singletonList(cell);
    }
}
