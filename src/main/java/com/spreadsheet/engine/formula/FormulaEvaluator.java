package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.exceptions.EngineInvariantException;
import com.spreadsheet.engine.formula.FormulaNode.BinaryOperation;
import com.spreadsheet.engine.formula.FormulaNode.FunctionCall;
import com.spreadsheet.engine.formula.FormulaNode.RangeReference;
import com.spreadsheet.engine.formula.FunctionRegistry.FunctionDefinition;
import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellError;
import com.spreadsheet.engine.models.CellRange;
import com.spreadsheet.engine.models.CellValue;
import com.spreadsheet.engine.models.ErrorKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Walks a formula AST and produces a value or a typed error.
 * <p>
 * In-formula problems never escape as exceptions. Operands are evaluated
 * left to right and the first error wins without the operation being
 * attempted. Nesting beyond {@code maxDepth} yields #NUM!.
 */
public class FormulaEvaluator {

    private final FunctionRegistry functions;
    private final int maxDepth;

    public FormulaEvaluator(FunctionRegistry functions, int maxDepth) {
        this.functions = functions;
        this.maxDepth = maxDepth;
    }

    public EvaluationResult evaluate(ParsedFormula formula, CellLookup lookup) {
        return evaluate(formula.getRoot(), lookup);
    }

    public EvaluationResult evaluate(FormulaNode root, CellLookup lookup) {
        return new Evaluation(lookup).eval(root);
    }

    private final class Evaluation implements FormulaNode.Visitor<EvaluationResult> {
        private final CellLookup lookup;
        private int depth;

        Evaluation(CellLookup lookup) {
            this.lookup = lookup;
        }

        private EvaluationResult eval(FormulaNode node) {
            if (node == null) {
                throw new EngineInvariantException("Null AST node reached the evaluator");
            }
            if (++depth > maxDepth) {
                depth--;
                return EvaluationResult.error(ErrorKind.NUM, "Formula nesting exceeds " + maxDepth + " levels");
            }
            try {
                return node.accept(this);
            } finally {
                depth--;
            }
        }

        @Override
        public EvaluationResult visitNumber(FormulaNode.NumberLiteral node) {
            return EvaluationResult.number(node.getValue());
        }

        @Override
        public EvaluationResult visitText(FormulaNode.TextLiteral node) {
            return EvaluationResult.of(CellValue.text(node.getValue()));
        }

        @Override
        public EvaluationResult visitBoolean(FormulaNode.BooleanLiteral node) {
            return EvaluationResult.of(CellValue.bool(node.getValue()));
        }

        @Override
        public EvaluationResult visitCellReference(FormulaNode.CellReference node) {
            CellAddress address = node.getAddress();
            if (!lookup.contains(address)) {
                return invalidReference(address.toText());
            }
            return lookup.lookup(address);
        }

        @Override
        public EvaluationResult visitRangeReference(RangeReference node) {
            return EvaluationResult.error(CellError.of(ErrorKind.VALUE,
                    "Range " + node.getRange() + " cannot be used as a single value",
                    "reference", node.getRange().toText()));
        }

        @Override
        public EvaluationResult visitUnary(FormulaNode.UnaryOperation node) {
            EvaluationResult operand = eval(node.getOperand());
            if (operand.isError()) {
                return operand;
            }
            switch (node.getOperator()) {
                case NEGATE:
                case PLUS:
                    Double number = ValueCoercion.toNumber(operand.getValue());
                    if (number == null) {
                        return notANumber(operand.getValue());
                    }
                    return EvaluationResult.number(node.getOperator() == FormulaNode.UnaryOperator.NEGATE ? -number : number);
                case NOT:
                    Boolean bool = ValueCoercion.toBoolean(operand.getValue());
                    if (bool == null) {
                        return EvaluationResult.error(ErrorKind.VALUE,
                                "NOT expects a logical value, got '" + ValueCoercion.toText(operand.getValue()) + "'");
                    }
                    return EvaluationResult.of(CellValue.bool(!bool));
                default:
                    throw new EngineInvariantException("Unhandled unary operator " + node.getOperator());
            }
        }

        /**
         * Operands are folded along the left spine in a loop, so a flat chain
         * such as {@code A1+A2+...+An} costs one level of depth, not n.
         */
        @Override
        public EvaluationResult visitBinary(BinaryOperation node) {
            Deque<BinaryOperation> spine = new ArrayDeque<>();
            FormulaNode current = node;
            while (current instanceof BinaryOperation) {
                spine.push((BinaryOperation) current);
                current = ((BinaryOperation) current).getLeft();
            }
            EvaluationResult accumulated = eval(current);
            while (!spine.isEmpty()) {
                if (accumulated.isError()) {
                    return accumulated;
                }
                BinaryOperation operation = spine.pop();
                EvaluationResult right = eval(operation.getRight());
                if (right.isError()) {
                    return right;
                }
                accumulated = apply(operation.getOperator(), accumulated.getValue(), right.getValue());
            }
            return accumulated;
        }

        private EvaluationResult apply(FormulaNode.BinaryOperator operator, CellValue l, CellValue r) {
            if (operator == FormulaNode.BinaryOperator.CONCAT) {
                return EvaluationResult.of(CellValue.text(ValueCoercion.toText(l) + ValueCoercion.toText(r)));
            }
            if (operator.isComparison()) {
                return compare(operator, l, r);
            }
            Double a = ValueCoercion.toNumber(l);
            if (a == null) {
                return notANumber(l);
            }
            Double b = ValueCoercion.toNumber(r);
            if (b == null) {
                return notANumber(r);
            }
            switch (operator) {
                case ADD:
                    return EvaluationResult.number(a + b);
                case SUBTRACT:
                    return EvaluationResult.number(a - b);
                case MULTIPLY:
                    return EvaluationResult.number(a * b);
                case DIVIDE:
                    if (b == 0) {
                        return EvaluationResult.error(ErrorKind.DIV_ZERO, "Division by zero");
                    }
                    return EvaluationResult.number(a / b);
                case POWER:
                    return BuiltinFunctions.power(a, b);
                default:
                    throw new EngineInvariantException("Unhandled binary operator " + operator);
            }
        }

        @Override
        public EvaluationResult visitFunctionCall(FunctionCall node) {
            FunctionDefinition function = functions.get(node.getName());
            if (function == null) {
                return EvaluationResult.error(CellError.of(ErrorKind.NAME,
                        "Unknown function " + node.getName(), "function", node.getName()));
            }
            int count = node.getArguments().size();
            if (count < function.getMinArgs()) {
                return EvaluationResult.error(CellError.of(ErrorKind.NOT_AVAILABLE,
                        function.getName() + " requires at least " + function.getMinArgs() + " argument(s), got " + count,
                        "function", function.getName()));
            }
            if (!function.acceptsArgumentCount(count)) {
                return EvaluationResult.error(CellError.of(ErrorKind.VALUE,
                        function.getName() + " accepts at most " + function.getMaxArgs() + " argument(s), got " + count,
                        "function", function.getName()));
            }

            List<FunctionArgument> arguments = new ArrayList<>(count);
            for (FormulaNode argument : node.getArguments()) {
                if (argument instanceof RangeReference && function.acceptsRanges()) {
                    CellRange range = ((RangeReference) argument).getRange();
                    if (!lookup.contains(range.getEnd())) {
                        return invalidReference(range.toText());
                    }
                    List<CellValue> values = new ArrayList<>();
                    for (CellAddress address : range.expand()) {
                        EvaluationResult cell = lookup.lookup(address);
                        if (cell.isError()) {
                            return cell;
                        }
                        values.add(cell.getValue());
                    }
                    arguments.add(FunctionArgument.range(values));
                } else {
                    EvaluationResult value = eval(argument);
                    if (value.isError()) {
                        return value;
                    }
                    arguments.add(FunctionArgument.scalar(value.getValue()));
                }
            }
            return function.invoke(arguments);
        }

        private EvaluationResult compare(FormulaNode.BinaryOperator operator, CellValue l, CellValue r) {
            Integer order = ValueCoercion.compare(l, r);
            if (order == null) {
                return EvaluationResult.error(ErrorKind.VALUE, "Cannot compare " + l.getType().name().toLowerCase()
                        + " with " + r.getType().name().toLowerCase());
            }
            boolean outcome;
            switch (operator) {
                case EQUAL:
                    outcome = order == 0;
                    break;
                case NOT_EQUAL:
                    outcome = order != 0;
                    break;
                case LESS_THAN:
                    outcome = order < 0;
                    break;
                case LESS_THAN_OR_EQUAL:
                    outcome = order <= 0;
                    break;
                case GREATER_THAN:
                    outcome = order > 0;
                    break;
                case GREATER_THAN_OR_EQUAL:
                    outcome = order >= 0;
                    break;
                default:
                    throw new EngineInvariantException("Not a comparison operator: " + operator);
            }
            return EvaluationResult.of(CellValue.bool(outcome));
        }

        private EvaluationResult notANumber(CellValue value) {
            return EvaluationResult.error(ErrorKind.VALUE, "Cannot use " + value.getType().name().toLowerCase()
                    + " '" + ValueCoercion.toText(value) + "' as a number");
        }

        private EvaluationResult invalidReference(String reference) {
            return EvaluationResult.error(CellError.of(ErrorKind.REF,
                    "Reference " + reference + " is outside the sheet", "reference", reference));
        }
    }
}
