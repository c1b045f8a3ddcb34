package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.exceptions.FormulaSyntaxException;
import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellValue;
import com.spreadsheet.engine.models.ErrorKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FunctionRegistryTest {

    private static final CellLookup EMPTY_GRID = new CellLookup() {
        @Override
        public boolean contains(CellAddress address) {
            return address.isWithin(10, 10);
        }

        @Override
        public EvaluationResult lookup(CellAddress address) {
            return EvaluationResult.of(CellValue.empty());
        }
    };

    @Test
    void testBuiltinLibrary() {
        FunctionRegistry registry = FunctionRegistry.withBuiltins();
        for (String name : List.of("SUM", "AVERAGE", "COUNT", "COUNTA", "MIN", "MAX", "IF", "AND", "OR", "NOT",
                "ISBLANK", "ABS", "ROUND", "SQRT", "POWER", "PI", "CONCATENATE", "LEN", "UPPER", "LOWER",
                "LEFT", "RIGHT", "MID")) {
            assertTrue(registry.contains(name), name);
        }
        assertTrue(registry.contains("sum"));
        assertFalse(registry.contains("IFERROR"));
        assertEquals(23, registry.getNames().size());
        assertTrue(registry.get("SUM").acceptsRanges());
        assertFalse(registry.get("UPPER").acceptsRanges());
    }

    @Test
    void testArityBounds() {
        FunctionRegistry.FunctionDefinition round = FunctionRegistry.withBuiltins().get("ROUND");
        assertEquals(1, round.getMinArgs());
        assertEquals(2, round.getMaxArgs());
        assertTrue(round.acceptsArgumentCount(2));
        assertFalse(round.acceptsArgumentCount(3));
        assertTrue(FunctionRegistry.withBuiltins().get("SUM").acceptsArgumentCount(50));
    }

    @Test
    void testInvalidArityIsRejected() {
        FunctionRegistry registry = new FunctionRegistry();
        assertThrows(IllegalArgumentException.class,
                () -> registry.register("BAD", 2, 1, args -> EvaluationResult.of(CellValue.empty())));
    }

    @Test
    void testCustomFunctionIsCallableFromFormulas() throws FormulaSyntaxException {
        FunctionRegistry registry = FunctionRegistry.withBuiltins();
        registry.register("double", 1, 1, args -> {
            Double value = ValueCoercion.toNumber(args.get(0).getValue());
            return value == null
                    ? EvaluationResult.error(ErrorKind.VALUE, "not a number")
                    : EvaluationResult.number(value * 2);
        });
        FormulaEvaluator evaluator = new FormulaEvaluator(registry, 100);
        FormulaParser parser = new FormulaParser();

        assertEquals(CellValue.number(42), evaluator.evaluate(parser.parse("=DOUBLE(21)"), EMPTY_GRID).getValue());
        assertEquals(ErrorKind.VALUE,
                evaluator.evaluate(parser.parse("=Double(\"x\")"), EMPTY_GRID).getError().getKind());
    }
}
