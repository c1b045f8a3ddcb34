package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.exceptions.FormulaSyntaxException;
import com.spreadsheet.engine.formula.FormulaNode.BinaryOperation;
import com.spreadsheet.engine.formula.FormulaNode.BinaryOperator;
import com.spreadsheet.engine.formula.FormulaNode.CellReference;
import com.spreadsheet.engine.formula.FormulaNode.FunctionCall;
import com.spreadsheet.engine.formula.FormulaNode.NumberLiteral;
import com.spreadsheet.engine.formula.FormulaNode.RangeReference;
import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellRange;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FormulaParserTest {

    private final FormulaParser parser = new FormulaParser();

    private static FormulaNode num(double value) {
        return new NumberLiteral(value);
    }

    private static FormulaNode ref(String address) {
        return new CellReference(CellAddress.fromText(address));
    }

    @Test
    void testPrecedence() throws FormulaSyntaxException {
        FormulaNode root = parser.parse("=1+2*3").getRoot();
        assertEquals(new BinaryOperation(BinaryOperator.ADD, num(1),
                new BinaryOperation(BinaryOperator.MULTIPLY, num(2), num(3))), root);
    }

    @Test
    void testPowerIsLeftAssociative() throws FormulaSyntaxException {
        FormulaNode root = parser.parse("=2^3^2").getRoot();
        assertEquals(new BinaryOperation(BinaryOperator.POWER,
                new BinaryOperation(BinaryOperator.POWER, num(2), num(3)), num(2)), root);
    }

    @Test
    void testComparisonBindsLoosestAndConcatAboveAdditive() throws FormulaSyntaxException {
        assertEquals("((A1&(1+2))=\"x\")", parser.parse("=A1&1+2=\"x\"").getRoot().toFormulaText());
    }

    @Test
    void testReferencesAreCollectedOnce() throws FormulaSyntaxException {
        ParsedFormula formula = parser.parse("=a1+SUM(B1:B3)+A1");
        assertEquals("=a1+SUM(B1:B3)+A1", formula.getSource());
        assertEquals(Set.of(CellRange.fromText("A1"), CellRange.fromText("B1:B3")), formula.getReferences());
        assertEquals(List.of("SUM"), formula.getFunctionNames());
    }

    @Test
    void testFunctionCallArguments() throws FormulaSyntaxException {
        FormulaNode root = parser.parse("=IF(A1>0, \"pos\", \"neg\")").getRoot();
        assertTrue(root instanceof FunctionCall);
        FunctionCall call = (FunctionCall) root;
        assertEquals("IF", call.getName());
        assertEquals(3, call.getArguments().size());
        assertEquals(new RangeReference(CellRange.fromText("C1:D2")),
                ((FunctionCall) parser.parse("=sum(C1:D2)").getRoot()).getArguments().get(0));
    }

    @Test
    void testEscapedQuotesInText() throws FormulaSyntaxException {
        FormulaNode root = parser.parse("=\"say \"\"hi\"\"\"").getRoot();
        assertEquals(new FormulaNode.TextLiteral("say \"hi\""), root);
    }

    @Test
    void testBooleanLiterals() throws FormulaSyntaxException {
        assertEquals(new FormulaNode.BooleanLiteral(true), parser.parse("=true").getRoot());
        assertEquals(new FormulaNode.BooleanLiteral(false), parser.parse("=FALSE").getRoot());
    }

    @Test
    void testUnaryMinus() throws FormulaSyntaxException {
        assertEquals(new FormulaNode.UnaryOperation(FormulaNode.UnaryOperator.NEGATE, ref("B2")),
                parser.parse("=-B2").getRoot());
    }

    @Test
    void testSyntaxErrors() {
        assertThrows(FormulaSyntaxException.class, () -> parser.parse("="));
        assertThrows(FormulaSyntaxException.class, () -> parser.parse("=1+"));
        assertThrows(FormulaSyntaxException.class, () -> parser.parse("=(1+2"));
        assertThrows(FormulaSyntaxException.class, () -> parser.parse("=1+2)"));
        assertThrows(FormulaSyntaxException.class, () -> parser.parse("=\"open"));
        assertThrows(FormulaSyntaxException.class, () -> parser.parse("=1 $ 2"));
        assertThrows(FormulaSyntaxException.class, () -> parser.parse("=A01"));
        assertThrows(FormulaSyntaxException.class, () -> parser.parse("=foo"));
        assertThrows(FormulaSyntaxException.class, () -> parser.parse("=SUM(1,)"));
        assertThrows(FormulaSyntaxException.class, () -> parser.parse("1+1"));
    }

    @Test
    void testInvertedRangeIsSyntaxError() {
        FormulaSyntaxException ex = assertThrows(FormulaSyntaxException.class, () -> parser.parse("=SUM(C3:A1)"));
        assertTrue(ex.getMessage().contains("C3"));
    }

    @Test
    void testUnmatchedParenthesisMessages() {
        FormulaSyntaxException open = assertThrows(FormulaSyntaxException.class, () -> parser.parse("=(1"));
        assertTrue(open.getMessage().startsWith("Unmatched '('"));
        FormulaSyntaxException close = assertThrows(FormulaSyntaxException.class, () -> parser.parse("=1)"));
        assertTrue(close.getMessage().startsWith("Unmatched ')'"));
    }

    @Test
    void testNestingCeiling() throws FormulaSyntaxException {
        FormulaParser shallow = new FormulaParser(3);
        assertNotNull(shallow.parse("=((1))"));
        assertThrows(FormulaSyntaxException.class, () -> shallow.parse("=(((1)))"));
    }

    @Test
    void testDeepNestingDoesNotOverflowStack() {
        String formula = "=" + "(".repeat(5000) + "1" + ")".repeat(5000);
        assertThrows(FormulaSyntaxException.class, () -> parser.parse(formula));
    }
}
