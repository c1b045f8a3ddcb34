package com.spreadsheet.engine.services;

import com.spreadsheet.engine.config.EngineProperties;
import com.spreadsheet.engine.exceptions.InvalidRangeException;
import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellError;
import com.spreadsheet.engine.models.CellResult;
import com.spreadsheet.engine.models.CellValue;
import com.spreadsheet.engine.models.ErrorKind;
import com.spreadsheet.engine.models.RecalculationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Recalculation passes, driven through the service's write path
 * on a 10x10 sheet.
 */
class RecalculationEngineTest {

    private SheetService sheetService;
    private long sheetId;

    @BeforeEach
    void setUp() {
        sheetService = new SheetService();
        sheetId = sheetService.createSheet(10, 10);
    }

    private static Map<String, String> cells(String... pairs) {
        Map<String, String> contents = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            contents.put(pairs[i], pairs[i + 1]);
        }
        return contents;
    }

    private Cell cell(String address) {
        return sheetService.getCell(sheetId, address);
    }

    private static CellAddress a(String text) {
        return CellAddress.fromText(text);
    }

    @Test
    void testSimpleFormula() {
        RecalculationResult result = sheetService.loadSnapshot(sheetId, cells("A1", "=1+1"));
        assertEquals(CellValue.number(2), cell("A1").getValue());
        assertNull(cell("A1").getError());
        assertEquals("2", cell("A1").getDisplayValue());
        assertFalse(cell("A1").isDirty());
        assertTrue(result.getResult(a("A1")).isChanged());
        assertEquals(1, result.getEvaluatedCount());
        assertTrue(result.getExecutionTimeMs() >= 0);
    }

    @Test
    void testDivisionByZero() {
        sheetService.loadSnapshot(sheetId, cells("A1", "=1/0"));
        assertEquals(ErrorKind.DIV_ZERO, cell("A1").getError().getKind());
        assertNull(cell("A1").getValue());
        assertEquals("#DIV/0!", cell("A1").getDisplayValue());
    }

    @Test
    void testTwoCellCycle() {
        RecalculationResult result = sheetService.loadSnapshot(sheetId, cells("A1", "=B1", "B1", "=A1"));
        for (String address : List.of("A1", "B1")) {
            assertEquals(ErrorKind.CIRCULAR, cell(address).getError().getKind());
            assertNull(cell(address).getValue());
            assertEquals("#CIRCULAR!", cell(address).getDisplayValue());
        }
        assertEquals(2, result.getCircularCount());
        assertEquals(0, result.getEvaluatedCount());
    }

    @Test
    void testSelfReferenceIsCircular() {
        sheetService.loadSnapshot(sheetId, cells("A1", "=A1+1"));
        assertEquals(ErrorKind.CIRCULAR, cell("A1").getError().getKind());
    }

    /**
     * Readers of a circular cell are not circular themselves; they get #REF!
     * pointing at the circular cell.
     */
    @Test
    void testDependentOfCircularCellGetsReferenceError() {
        sheetService.loadSnapshot(sheetId, cells("A1", "=B1", "B1", "=A1", "C1", "=A1+1", "D1", "=C1*2"));
        CellError error = cell("C1").getError();
        assertEquals(ErrorKind.REF, error.getKind());
        assertEquals("A1", error.getDetails().get("reference"));
        assertEquals("#CIRCULAR!", error.getDetails().get("cause"));
        assertEquals(error, cell("D1").getError());
    }

    @Test
    void testOutOfGridReference() {
        sheetService.loadSnapshot(sheetId, cells("A1", "=K1+1", "B1", "=SUM(A1:A11)"));
        assertEquals(ErrorKind.REF, cell("A1").getError().getKind());
        assertEquals(ErrorKind.REF, cell("B1").getError().getKind());
    }

    @Test
    void testInvertedRangeIsRejectedBeforeEvaluation() {
        sheetService.loadSnapshot(sheetId, cells("A1", "5", "A5", "=SUM(C3:A1)"));
        assertEquals(ErrorKind.NAME, cell("A5").getError().getKind());
        assertTrue(sheetService.getDependencies(sheetId, "A5").isEmpty());
        assertThrows(InvalidRangeException.class, () -> sheetService.recalculate(sheetId, "C3:A1"));
    }

    @Test
    void testFullRecalculationIsIdempotent() {
        sheetService.loadSnapshot(sheetId, cells(
                "A1", "3", "A2", "4",
                "B1", "=A1*A2", "B2", "=B1/7", "B3", "=SUM(A1:B2)", "C1", "=B3&\"!\""));
        Map<String, String> first = sheetService.getSheetData(sheetId);

        RecalculationResult again = sheetService.recalculate(sheetId, null);
        assertEquals(first, sheetService.getSheetData(sheetId));
        assertEquals(4, again.getResults().size());
        for (CellResult result : again.getResults()) {
            assertFalse(result.isChanged(), result.toString());
        }
    }

    @Test
    void testDependenciesResolveBeforeDependents() {
        RecalculationResult result = sheetService.loadSnapshot(sheetId, cells(
                "D1", "=C1+B1", "C1", "=B1+1", "B1", "=A1+1", "A1", "=1", "E1", "=SUM(A1:D1)"));
        assertTrue(result.indexOf(a("A1")) < result.indexOf(a("B1")));
        assertTrue(result.indexOf(a("B1")) < result.indexOf(a("C1")));
        assertTrue(result.indexOf(a("C1")) < result.indexOf(a("D1")));
        assertTrue(result.indexOf(a("D1")) < result.indexOf(a("E1")));
        assertEquals(CellValue.number(5), cell("D1").getValue());
        assertEquals(CellValue.number(11), cell("E1").getValue());
    }

    /**
     * A1 sorts first and is ordered on its own; B1 is reached later as a root
     * and must find A1 already ordered.
     */
    @Test
    void testFullPassOverCellsWrittenOneByOne() {
        sheetService.setCellContent(sheetId, "A1", "=1");
        sheetService.setCellContent(sheetId, "B1", "=A1+1");
        sheetService.setCellContent(sheetId, "A2", "=B1*A1");
        sheetService.setCellContent(sheetId, "C3", "=SUM(A1:B2)");

        RecalculationResult result = sheetService.recalculate(sheetId, null);

        assertEquals(4, result.getResults().size());
        assertEquals(4, result.getEvaluatedCount());
        assertEquals(CellValue.number(2), cell("B1").getValue());
        assertEquals(CellValue.number(2), cell("A2").getValue());
        assertEquals(CellValue.number(5), cell("C3").getValue());
        assertTrue(result.indexOf(a("B1")) < result.indexOf(a("A2")));
        assertTrue(result.indexOf(a("A2")) < result.indexOf(a("C3")));
    }

    @Test
    void testScopedRecalculationLeavesOtherCellsUntouched() {
        sheetService.loadSnapshot(sheetId, cells(
                "A1", "2", "B1", "=A1*2", "C2", "text", "E5", "=A1+100"));
        Cell outside = cell("E5");
        Cell literal = cell("C2");
        String outsideDisplay = outside.getDisplayValue();
        CellValue outsideValue = outside.getValue();
        String literalRaw = literal.getRawValue();
        CellValue literalValue = literal.getValue();

        RecalculationResult result = sheetService.recalculate(sheetId, "A1:C3");

        assertEquals(1, result.getResults().size());
        assertNotNull(result.getResult(a("B1")));
        assertNull(result.getResult(a("E5")));
        assertNull(result.getResult(a("C2")));
        assertEquals(outsideDisplay, cell("E5").getDisplayValue());
        assertEquals(outsideValue, cell("E5").getValue());
        assertEquals(literalRaw, cell("C2").getRawValue());
        assertEquals(literalValue, cell("C2").getValue());
    }

    @Test
    void testSyntaxErrorKeepsPreviousValue() {
        sheetService.loadSnapshot(sheetId, cells("A1", "=2*3", "B1", "=A1+1"));
        assertEquals(CellValue.number(7), cell("B1").getValue());

        sheetService.setCellContent(sheetId, "A1", "=2*");
        Cell broken = cell("A1");
        assertEquals(ErrorKind.NAME, broken.getError().getKind());
        assertNotNull(broken.getError().getDetails().get("position"));
        assertNull(broken.getValue());
        assertEquals(CellValue.number(6), broken.getRetainedValue());
        assertEquals("#NAME?", broken.getDisplayValue());
        assertEquals(ErrorKind.NAME, cell("B1").getError().getKind());

        sheetService.setCellContent(sheetId, "A1", "=2*4");
        assertEquals(CellValue.number(8), cell("A1").getValue());
        assertEquals(CellValue.number(9), cell("B1").getValue());
    }

    @Test
    void testEditUpdatesTransitiveDependents() {
        sheetService.loadSnapshot(sheetId, cells(
                "A1", "1", "B1", "=A1*2", "C1", "=B1+1", "D1", "=SUM(B1:C1)", "J10", "=PI()"));

        RecalculationResult result = sheetService.setCellContent(sheetId, "A1", "5");

        assertEquals(CellValue.number(11), cell("C1").getValue());
        assertEquals(CellValue.number(21), cell("D1").getValue());
        assertEquals(3, result.getResults().size());
        assertNull(result.getResult(a("J10")));
    }

    @Test
    void testAggregateOverRangeSkipsEmptyCells() {
        sheetService.loadSnapshot(sheetId, cells("A1", "1", "A3", "3", "B1", "=AVERAGE(A1:A5)", "B2", "=COUNT(A1:A5)"));
        assertEquals(CellValue.number(2), cell("B1").getValue());
        assertEquals(CellValue.number(2), cell("B2").getValue());

        sheetService.setCellContent(sheetId, "A2", "5");
        assertEquals(CellValue.number(3), cell("B1").getValue());
    }

    @Test
    void testChainDeeperThanCeilingGivesNumError() {
        EngineProperties properties = new EngineProperties();
        properties.setMaxDepth(5);
        SheetService shallow = new SheetService(properties);
        long id = shallow.createSheet(10, 10);

        Map<String, String> chain = cells("A1", "=1");
        for (int row = 2; row <= 8; row++) {
            chain.put("A" + row, "=A" + (row - 1) + "+1");
        }
        shallow.loadSnapshot(id, chain);

        assertEquals(CellValue.number(5), shallow.getCell(id, "A5").getValue());
        assertEquals(ErrorKind.NUM, shallow.getCell(id, "A6").getError().getKind());
        assertEquals(ErrorKind.NUM, shallow.getCell(id, "A8").getError().getKind());
    }

    @Test
    void testChainCeilingDoesNotDependOnEditOrder() {
        EngineProperties properties = new EngineProperties();
        properties.setMaxDepth(5);
        SheetService shallow = new SheetService(properties);
        long forward = shallow.createSheet(10, 10);
        long backward = shallow.createSheet(10, 10);
        long snapshot = shallow.createSheet(10, 10);

        Map<String, String> chain = cells("A1", "=1");
        for (int row = 2; row <= 8; row++) {
            chain.put("A" + row, "=A" + (row - 1) + "+1");
        }
        chain.forEach((address, raw) -> shallow.setCellContent(forward, address, raw));
        for (int row = 8; row >= 1; row--) {
            shallow.setCellContent(backward, "A" + row, chain.get("A" + row));
        }
        shallow.loadSnapshot(snapshot, chain);

        Map<String, String> expected = shallow.getSheetData(snapshot);
        assertEquals("5", expected.get("A5"));
        assertEquals("#NUM!", expected.get("A6"));
        assertEquals("#NUM!", expected.get("A8"));
        assertEquals(expected, shallow.getSheetData(forward));
        assertEquals(expected, shallow.getSheetData(backward));

        shallow.recalculate(forward, null);
        assertEquals(expected, shallow.getSheetData(forward));
    }

    @Test
    void testDisplayIsRoundedButValueIsNot() {
        sheetService.loadSnapshot(sheetId, cells("A1", "=1/3", "A2", "=A1*3"));
        assertEquals("0.33333", cell("A1").getDisplayValue());
        assertEquals(CellValue.number(1.0 / 3), cell("A1").getValue());
        assertEquals(CellValue.number(1.0 / 3 * 3), cell("A2").getValue());
    }

    @Test
    void testBreakingCycleRecovers() {
        sheetService.loadSnapshot(sheetId, cells("A1", "=B1", "B1", "=A1"));
        sheetService.setCellContent(sheetId, "B1", "4");
        assertEquals(CellValue.number(4), cell("A1").getValue());
        assertNull(cell("A1").getError());
    }
}
