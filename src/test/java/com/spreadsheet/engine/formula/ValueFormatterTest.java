package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.CellError;
import com.spreadsheet.engine.models.CellValue;
import com.spreadsheet.engine.models.ErrorKind;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class ValueFormatterTest {

    private final ValueFormatter formatter = new ValueFormatter();

    @Test
    void testDefaultPrecision() {
        assertEquals(ValueFormatter.DEFAULT_PRECISION, formatter.getPrecision());
        assertEquals("0.66667", formatter.formatNumber(2.0 / 3));
        assertEquals("3", formatter.formatNumber(3.0));
        assertEquals("1.5", formatter.formatNumber(1.5));
        assertEquals("-0.00001", formatter.formatNumber(-0.000005));
    }

    @Test
    void testLargeNumbersStayPlain() {
        assertEquals("10000000000000000000", formatter.formatNumber(1e19));
    }

    @Test
    void testCustomPrecision() {
        ValueFormatter twoDigits = new ValueFormatter(2);
        assertEquals(2, twoDigits.getPrecision());
        assertEquals("3.14", twoDigits.formatNumber(Math.PI));
        assertThrows(IllegalArgumentException.class, () -> new ValueFormatter(-1));
    }

    @Test
    void testErrorWinsOverValue() {
        CellError error = new CellError(ErrorKind.VALUE, "bad");
        assertEquals("#VALUE!", formatter.format(CellValue.number(1), error));
    }

    @Test
    void testNonNumericValues() {
        assertEquals("TRUE", formatter.format(CellValue.bool(true), null));
        assertEquals("abc", formatter.format(CellValue.text("abc"), null));
        assertEquals("", formatter.format(CellValue.empty(), null));
        assertEquals("2024-05-01", formatter.format(CellValue.date(LocalDate.of(2024, 5, 1)), null));
    }
}
