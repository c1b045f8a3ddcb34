package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.exceptions.FormulaSyntaxException;
import com.spreadsheet.engine.exceptions.InvalidCellAddressException;
import com.spreadsheet.engine.exceptions.InvalidRangeException;
import com.spreadsheet.engine.formula.FormulaNode.BinaryOperator;
import com.spreadsheet.engine.formula.FormulaNode.UnaryOperator;
import com.spreadsheet.engine.formula.FormulaTokenizer.Token;
import com.spreadsheet.engine.formula.FormulaTokenizer.TokenType;
import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellRange;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for cell formulas.
 * <p>
 * Precedence, lowest first: comparison, concatenation (&amp;), additive,
 * multiplicative, exponent (^, left-associative), unary sign.
 * <p>
 * The parser is pure: it keeps no state between calls and never looks at
 * other cells. Nesting deeper than {@code maxNesting} is a syntax error so
 * that hostile input cannot exhaust the stack.
 */
public class FormulaParser {

    public static final int DEFAULT_MAX_NESTING = 100;

    private final int maxNesting;

    public FormulaParser() {
        this(DEFAULT_MAX_NESTING);
    }

    public FormulaParser(int maxNesting) {
        this.maxNesting = maxNesting;
    }

    /**
     * A raw cell value is a formula when it starts with '='.
     */
    public static boolean isFormula(String rawValue) {
        return rawValue != null && rawValue.startsWith("=");
    }

    public ParsedFormula parse(String formula) throws FormulaSyntaxException {
        if (!isFormula(formula)) {
            throw new FormulaSyntaxException("Formula must start with '='", 0);
        }
        List<Token> tokens = new FormulaTokenizer(formula, 1).tokenize();
        Parse parse = new Parse(tokens);
        FormulaNode root = parse.parseComparison();
        Token trailing = parse.peek();
        if (!trailing.is(TokenType.END)) {
            if (trailing.is(TokenType.RIGHT_PAREN)) {
                throw new FormulaSyntaxException("Unmatched ')'", trailing.position);
            }
            throw new FormulaSyntaxException("Unexpected " + trailing, trailing.position);
        }
        return new ParsedFormula(formula, root, parse.references, parse.functionNames);
    }

    /**
     * State of a single parse; discarded afterwards.
     */
    private final class Parse {
        private final List<Token> tokens;
        private final Set<CellRange> references = new LinkedHashSet<>();
        private final List<String> functionNames = new ArrayList<>();
        private int index;
        private int depth;

        Parse(List<Token> tokens) {
            this.tokens = tokens;
        }

        Token peek() {
            return tokens.get(index);
        }

        Token next() {
            Token token = tokens.get(index);
            if (!token.is(TokenType.END)) {
                index++;
            }
            return token;
        }

        FormulaNode parseComparison() throws FormulaSyntaxException {
            enter();
            FormulaNode left = parseConcat();
            while (isComparisonOperator(peek())) {
                BinaryOperator op = BinaryOperator.fromSymbol(next().text);
                left = new FormulaNode.BinaryOperation(op, left, parseConcat());
            }
            depth--;
            return left;
        }

        FormulaNode parseConcat() throws FormulaSyntaxException {
            FormulaNode left = parseAdditive();
            while (peek().isOperator("&")) {
                next();
                left = new FormulaNode.BinaryOperation(BinaryOperator.CONCAT, left, parseAdditive());
            }
            return left;
        }

        FormulaNode parseAdditive() throws FormulaSyntaxException {
            FormulaNode left = parseTerm();
            while (peek().isOperator("+") || peek().isOperator("-")) {
                BinaryOperator op = next().text.equals("+") ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
                left = new FormulaNode.BinaryOperation(op, left, parseTerm());
            }
            return left;
        }

        FormulaNode parseTerm() throws FormulaSyntaxException {
            FormulaNode left = parsePower();
            while (peek().isOperator("*") || peek().isOperator("/")) {
                BinaryOperator op = next().text.equals("*") ? BinaryOperator.MULTIPLY : BinaryOperator.DIVIDE;
                left = new FormulaNode.BinaryOperation(op, left, parsePower());
            }
            return left;
        }

        FormulaNode parsePower() throws FormulaSyntaxException {
            FormulaNode left = parseUnary();
            while (peek().isOperator("^")) {
                next();
                left = new FormulaNode.BinaryOperation(BinaryOperator.POWER, left, parseUnary());
            }
            return left;
        }

        FormulaNode parseUnary() throws FormulaSyntaxException {
            Token token = peek();
            if (token.isOperator("-") || token.isOperator("+")) {
                next();
                enter();
                UnaryOperator op = token.text.equals("-") ? UnaryOperator.NEGATE : UnaryOperator.PLUS;
                FormulaNode operand = parseUnary();
                depth--;
                return new FormulaNode.UnaryOperation(op, operand);
            }
            return parsePrimary();
        }

        FormulaNode parsePrimary() throws FormulaSyntaxException {
            Token token = next();
            switch (token.type) {
                case NUMBER:
                    return new FormulaNode.NumberLiteral(Double.parseDouble(token.text));
                case STRING:
                    return new FormulaNode.TextLiteral(token.text);
                case CELL_REF:
                    return parseReference(token);
                case IDENTIFIER:
                    if (peek().is(TokenType.LEFT_PAREN)) {
                        return parseFunctionCall(token);
                    }
                    if (token.text.equals("TRUE") || token.text.equals("FALSE")) {
                        return new FormulaNode.BooleanLiteral(token.text.equals("TRUE"));
                    }
                    throw new FormulaSyntaxException("Unknown name '" + token.text + "'", token.position);
                case LEFT_PAREN:
                    FormulaNode inner = parseComparison();
                    expect(TokenType.RIGHT_PAREN, "Unmatched '('", token.position);
                    return inner;
                case END:
                    throw new FormulaSyntaxException("Unexpected end of formula", token.position);
                default:
                    throw new FormulaSyntaxException("Unexpected " + token, token.position);
            }
        }

        FormulaNode parseReference(Token first) throws FormulaSyntaxException {
            CellAddress start = toAddress(first);
            if (!peek().is(TokenType.COLON)) {
                references.add(CellRange.of(start));
                return new FormulaNode.CellReference(start);
            }
            next();
            Token second = next();
            if (!second.is(TokenType.CELL_REF)) {
                throw new FormulaSyntaxException("Malformed range, expected a cell reference after ':'", second.position);
            }
            CellAddress end = toAddress(second);
            CellRange range;
            try {
                range = new CellRange(start, end);
            } catch (InvalidRangeException e) {
                throw new FormulaSyntaxException(e.getMessage(), first.position);
            }
            references.add(range);
            return new FormulaNode.RangeReference(range);
        }

        FormulaNode parseFunctionCall(Token name) throws FormulaSyntaxException {
            Token open = next();
            enter();
            List<FormulaNode> arguments = new ArrayList<>();
            if (!peek().is(TokenType.RIGHT_PAREN)) {
                arguments.add(parseComparison());
                while (peek().is(TokenType.COMMA)) {
                    next();
                    arguments.add(parseComparison());
                }
            }
            expect(TokenType.RIGHT_PAREN, "Unmatched '(' in call to " + name.text, open.position);
            depth--;
            if (name.text.equals("NOT") && arguments.size() == 1) {
                return new FormulaNode.UnaryOperation(UnaryOperator.NOT, arguments.get(0));
            }
            functionNames.add(name.text);
            return new FormulaNode.FunctionCall(name.text, arguments);
        }

        private CellAddress toAddress(Token token) throws FormulaSyntaxException {
            try {
                return CellAddress.fromText(token.text);
            } catch (InvalidCellAddressException e) {
                throw new FormulaSyntaxException("Malformed reference '" + token.text + "'", token.position);
            }
        }

        private void expect(TokenType type, String message, int position) throws FormulaSyntaxException {
            Token token = peek();
            if (!token.is(type)) {
                if (token.is(TokenType.END)) {
                    throw new FormulaSyntaxException(message, position);
                }
                throw new FormulaSyntaxException("Unexpected " + token, token.position);
            }
            next();
        }

        private void enter() throws FormulaSyntaxException {
            if (++depth > maxNesting) {
                throw new FormulaSyntaxException("Formula nesting exceeds " + maxNesting + " levels", peek().position);
            }
        }

        private boolean isComparisonOperator(Token token) {
            if (token.type != TokenType.OPERATOR) {
                return false;
            }
            switch (token.text) {
                case "=":
                case "<>":
                case "<":
                case ">":
                case "<=":
                case ">=":
                    return true;
                default:
                    return false;
            }
        }
    }
}
