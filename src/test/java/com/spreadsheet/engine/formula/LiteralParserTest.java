package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.CellValue;
import com.spreadsheet.engine.models.ValueType;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class LiteralParserTest {

    @Test
    void testNumbers() {
        assertEquals(CellValue.number(42), LiteralParser.parse("42"));
        assertEquals(CellValue.number(-3.5), LiteralParser.parse(" -3.5 "));
        assertEquals(CellValue.number(0.25), LiteralParser.parse(".25"));
        assertEquals(CellValue.number(1200), LiteralParser.parse("1.2e3"));
    }

    @Test
    void testBooleansIgnoreCase() {
        assertEquals(CellValue.bool(true), LiteralParser.parse("TRUE"));
        assertEquals(CellValue.bool(false), LiteralParser.parse("false"));
    }

    @Test
    void testDates() {
        assertEquals(CellValue.date(LocalDate.of(2024, 2, 29)), LiteralParser.parse("2024-02-29"));
        assertEquals(CellValue.date(LocalDate.of(2024, 3, 7)), LiteralParser.parse("2024/3/7"));
        assertEquals(CellValue.date(LocalDate.of(2024, 12, 31)), LiteralParser.parse("12/31/2024"));
    }

    @Test
    void testImpossibleDatesStayText() {
        assertEquals(ValueType.TEXT, LiteralParser.parse("2023-02-29").getType());
        assertEquals(ValueType.TEXT, LiteralParser.parse("13/01/2024").getType());
        assertEquals(ValueType.TEXT, LiteralParser.parse("1-2").getType());
    }

    @Test
    void testBlankIsEmpty() {
        assertTrue(LiteralParser.parse("").isEmpty());
        assertTrue(LiteralParser.parse("   ").isEmpty());
        assertTrue(LiteralParser.parse(null).isEmpty());
    }

    @Test
    void testTextKeepsOriginalSpacing() {
        assertEquals(CellValue.text(" hello "), LiteralParser.parse(" hello "));
        assertEquals(ValueType.TEXT, LiteralParser.parse("12abc").getType());
    }

    @Test
    void testParseNumberRejectsNonNumericText() {
        assertEquals(7.0, LiteralParser.parseNumber("7"));
        assertNull(LiteralParser.parseNumber("7 apples"));
        assertNull(LiteralParser.parseNumber("0x10"));
        assertNull(LiteralParser.parseNumber("1e999"));
    }
}
