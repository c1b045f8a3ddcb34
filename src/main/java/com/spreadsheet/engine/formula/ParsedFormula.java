package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.CellRange;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Result of parsing a formula: the AST plus the flattened set of
 * direct references (single cells as 1x1 ranges) for the dependency graph.
 */
public final class ParsedFormula {

    private final String source;
    private final FormulaNode root;
    private final Set<CellRange> references;
    private final List<String> functionNames;

    public ParsedFormula(String source, FormulaNode root, Set<CellRange> references, List<String> functionNames) {
        this.source = source;
        this.root = Objects.requireNonNull(root);
        this.references = Collections.unmodifiableSet(new LinkedHashSet<>(references));
        this.functionNames = List.copyOf(functionNames);
    }

    public String getSource() {
        return source;
    }

    public FormulaNode getRoot() {
        return root;
    }

    public Set<CellRange> getReferences() {
        return references;
    }

    public List<String> getFunctionNames() {
        return functionNames;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParsedFormula)) {
            return false;
        }
        ParsedFormula that = (ParsedFormula) o;
        return root.equals(that.root) && references.equals(that.references);
    }

    @Override
    public int hashCode() {
        return Objects.hash(root, references);
    }

    @Override
    public String toString() {
        return "=" + root.toFormulaText();
    }
}
