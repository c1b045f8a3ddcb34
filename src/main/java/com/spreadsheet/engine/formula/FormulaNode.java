package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellRange;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Abstract syntax tree of a formula. The variants are the nested classes;
 * the private constructor keeps the set closed. Nodes are immutable and
 * compare structurally, so parsing the same text twice yields equal trees.
 */
public abstract class FormulaNode {

    public interface Visitor<R> {
        R visitNumber(NumberLiteral node);

        R visitText(TextLiteral node);

        R visitBoolean(BooleanLiteral node);

        R visitCellReference(CellReference node);

        R visitRangeReference(RangeReference node);

        R visitUnary(UnaryOperation node);

        R visitBinary(BinaryOperation node);

        R visitFunctionCall(FunctionCall node);
    }

    public enum UnaryOperator {
        NEGATE("-"),
        PLUS("+"),
        NOT("NOT");

        private final String symbol;

        UnaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    public enum BinaryOperator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        POWER("^"),
        CONCAT("&"),
        EQUAL("="),
        NOT_EQUAL("<>"),
        LESS_THAN("<"),
        LESS_THAN_OR_EQUAL("<="),
        GREATER_THAN(">"),
        GREATER_THAN_OR_EQUAL(">=");

        private final String symbol;

        BinaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        public boolean isComparison() {
            return ordinal() >= EQUAL.ordinal();
        }

        public static BinaryOperator fromSymbol(String symbol) {
            for (BinaryOperator op : values()) {
                if (op.symbol.equals(symbol)) {
                    return op;
                }
            }
            throw new IllegalArgumentException("Unknown operator: " + symbol);
        }
    }

    private FormulaNode() {
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Renders the node back to formula text (without the leading '='),
     * fully parenthesising nested operations.
     */
    public abstract String toFormulaText();

    @Override
    public String toString() {
        return toFormulaText();
    }

    public static final class NumberLiteral extends FormulaNode {
        private final double value;

        public NumberLiteral(double value) {
            this.value = value;
        }

        public double getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumber(this);
        }

        @Override
        public String toFormulaText() {
            return value == Math.rint(value) && Math.abs(value) < 1e15
                    ? String.valueOf((long) value) : String.valueOf(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof NumberLiteral && Double.compare(value, ((NumberLiteral) o).value) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(value);
        }
    }

    public static final class TextLiteral extends FormulaNode {
        private final String value;

        public TextLiteral(String value) {
            this.value = Objects.requireNonNull(value);
        }

        public String getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitText(this);
        }

        @Override
        public String toFormulaText() {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof TextLiteral && value.equals(((TextLiteral) o).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }
    }

    public static final class BooleanLiteral extends FormulaNode {
        private final boolean value;

        public BooleanLiteral(boolean value) {
            this.value = value;
        }

        public boolean getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBoolean(this);
        }

        @Override
        public String toFormulaText() {
            return value ? "TRUE" : "FALSE";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BooleanLiteral && value == ((BooleanLiteral) o).value;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }
    }

    public static final class CellReference extends FormulaNode {
        private final CellAddress address;

        public CellReference(CellAddress address) {
            this.address = Objects.requireNonNull(address);
        }

        public CellAddress getAddress() {
            return address;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCellReference(this);
        }

        @Override
        public String toFormulaText() {
            return address.toText();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof CellReference && address.equals(((CellReference) o).address);
        }

        @Override
        public int hashCode() {
            return address.hashCode();
        }
    }

    public static final class RangeReference extends FormulaNode {
        private final CellRange range;

        public RangeReference(CellRange range) {
            this.range = Objects.requireNonNull(range);
        }

        public CellRange getRange() {
            return range;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRangeReference(this);
        }

        @Override
        public String toFormulaText() {
            return range.getStart().toText() + ":" + range.getEnd().toText();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof RangeReference && range.equals(((RangeReference) o).range);
        }

        @Override
        public int hashCode() {
            return range.hashCode();
        }
    }

    public static final class UnaryOperation extends FormulaNode {
        private final UnaryOperator operator;
        private final FormulaNode operand;

        public UnaryOperation(UnaryOperator operator, FormulaNode operand) {
            this.operator = Objects.requireNonNull(operator);
            this.operand = Objects.requireNonNull(operand);
        }

        public UnaryOperator getOperator() {
            return operator;
        }

        public FormulaNode getOperand() {
            return operand;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnary(this);
        }

        @Override
        public String toFormulaText() {
            if (operator == UnaryOperator.NOT) {
                return "NOT(" + operand.toFormulaText() + ")";
            }
            return operator.getSymbol() + operand.toFormulaText();
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof UnaryOperation)) {
                return false;
            }
            UnaryOperation that = (UnaryOperation) o;
            return operator == that.operator && operand.equals(that.operand);
        }

        @Override
        public int hashCode() {
            return Objects.hash(operator, operand);
        }
    }

    public static final class BinaryOperation extends FormulaNode {
        private final BinaryOperator operator;
        private final FormulaNode left;
        private final FormulaNode right;

        public BinaryOperation(BinaryOperator operator, FormulaNode left, FormulaNode right) {
            this.operator = Objects.requireNonNull(operator);
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
        }

        public BinaryOperator getOperator() {
            return operator;
        }

        public FormulaNode getLeft() {
            return left;
        }

        public FormulaNode getRight() {
            return right;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }

        @Override
        public String toFormulaText() {
            return "(" + left.toFormulaText() + operator.getSymbol() + right.toFormulaText() + ")";
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof BinaryOperation)) {
                return false;
            }
            BinaryOperation that = (BinaryOperation) o;
            return operator == that.operator && left.equals(that.left) && right.equals(that.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash(operator, left, right);
        }
    }

    public static final class FunctionCall extends FormulaNode {
        private final String name;
        private final List<FormulaNode> arguments;

        public FunctionCall(String name, List<FormulaNode> arguments) {
            this.name = Objects.requireNonNull(name);
            this.arguments = Collections.unmodifiableList(arguments);
        }

        public String getName() {
            return name;
        }

        public List<FormulaNode> getArguments() {
            return arguments;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionCall(this);
        }

        @Override
        public String toFormulaText() {
            return name + arguments.stream()
                    .map(FormulaNode::toFormulaText)
                    .collect(Collectors.joining(",", "(", ")"));
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof FunctionCall)) {
                return false;
            }
            FunctionCall that = (FunctionCall) o;
            return name.equals(that.name) && arguments.equals(that.arguments);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, arguments);
        }
    }
}
