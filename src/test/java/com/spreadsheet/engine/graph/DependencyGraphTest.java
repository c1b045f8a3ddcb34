package com.spreadsheet.engine.graph;

import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    private DependencyGraph graph;

    @BeforeEach
    void setUp() {
        graph = new DependencyGraph();
    }

    private static CellAddress a(String text) {
        return CellAddress.fromText(text);
    }

    private static CellRange r(String text) {
        return CellRange.fromText(text);
    }

    @Test
    void testForwardAndReverseStayConsistent() {
        graph.setFormula(a("C1"), List.of(r("A1"), r("B1")));
        assertEquals(Set.of(r("A1"), r("B1")), graph.getDependencies(a("C1")));
        assertEquals(Set.of(a("C1")), graph.getDependents(a("A1")));
        assertEquals(Set.of(a("C1")), graph.getDependents(a("B1")));

        // Rewriting the formula drops the old edges
        graph.setFormula(a("C1"), List.of(r("B1")));
        assertTrue(graph.getDependents(a("A1")).isEmpty());
        assertEquals(Set.of(a("C1")), graph.getDependents(a("B1")));
        assertEquals(Map.of("B1", Set.of("C1")), graph.getReverseGraph());
    }

    @Test
    void testClearFormulaRemovesAllEdges() {
        graph.setFormula(a("C1"), List.of(r("A1"), r("A1:A5")));
        graph.clearFormula(a("C1"));
        assertFalse(graph.hasFormula(a("C1")));
        assertTrue(graph.getDependents(a("A3")).isEmpty());
        assertTrue(graph.getReverseGraph().isEmpty());
        assertEquals(0, graph.getEdgeCount());
    }

    @Test
    void testRangeIsStoredOnce() {
        graph.setFormula(a("B1"), List.of(r("A1:A1000")));
        assertEquals(1, graph.getEdgeCount());
        assertEquals(Set.of(a("B1")), graph.getDependents(a("A500")));
        assertTrue(graph.getDependents(a("A1001")).isEmpty());
        assertEquals(Map.of("B1", Set.of("A1:A1000")), graph.getForwardGraph());
    }

    @Test
    void testFormulaDependenciesExpandRangesToFormulaCells() {
        graph.setFormula(a("A2"), List.of(r("Z1")));
        graph.setFormula(a("A4"), List.of(r("Z1")));
        graph.setFormula(a("B1"), List.of(r("A1:A5"), r("C1")));
        assertEquals(List.of(a("A2"), a("A4")), graph.getFormulaDependencies(a("B1")));
        assertTrue(graph.getFormulaDependencies(a("Z1")).isEmpty());
    }

    @Test
    void testCollectDependentsIsTransitive() {
        graph.setFormula(a("B1"), List.of(r("A1")));
        graph.setFormula(a("C1"), List.of(r("B1")));
        graph.setFormula(a("D1"), List.of(r("A1:C1")));
        graph.setFormula(a("E1"), List.of(r("Z9")));
        Set<CellAddress> reached = graph.collectDependents(List.of(a("A1")));
        assertEquals(Set.of(a("A1"), a("B1"), a("C1"), a("D1")), reached);
    }

    @Test
    void testClear() {
        graph.setFormula(a("B1"), List.of(r("A1")));
        graph.clear();
        assertTrue(graph.getFormulaCells().isEmpty());
        assertTrue(graph.getForwardGraph().isEmpty());
    }
}
