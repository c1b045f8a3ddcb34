package com.spreadsheet.engine.models;

import com.spreadsheet.engine.exceptions.InvalidCellAddressException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellAddressTest {

    @Test
    void testParseNormalizesCase() {
        CellAddress address = CellAddress.fromText("b12");
        assertEquals(11, address.getRow());
        assertEquals(1, address.getColumn());
        assertEquals("B12", address.toText());
    }

    @Test
    void testColumnLettersAreBijectiveBase26() {
        assertEquals("A", CellAddress.columnToLetters(0));
        assertEquals("Z", CellAddress.columnToLetters(25));
        assertEquals("AA", CellAddress.columnToLetters(26));
        assertEquals("AZ", CellAddress.columnToLetters(51));
        assertEquals("ZZ", CellAddress.columnToLetters(701));
        assertEquals("AAA", CellAddress.columnToLetters(702));
        assertEquals(702, CellAddress.lettersToColumn("AAA"));
    }

    /**
     * Text -> address -> text and address -> text -> address agree over a 30x800 block.
     */
    @Test
    void testRoundTripOverGrid() {
        for (int row = 0; row < 30; row++) {
            for (int column = 0; column < 800; column++) {
                CellAddress address = CellAddress.of(row, column);
                String text = address.toText();
                assertEquals(address, CellAddress.fromText(text));
                assertEquals(text, CellAddress.fromText(text).toText());
            }
        }
    }

    @Test
    void testRejectsMalformedText() {
        assertThrows(InvalidCellAddressException.class, () -> CellAddress.fromText("A0"));
        assertThrows(InvalidCellAddressException.class, () -> CellAddress.fromText("A01"));
        assertThrows(InvalidCellAddressException.class, () -> CellAddress.fromText("1A"));
        assertThrows(InvalidCellAddressException.class, () -> CellAddress.fromText("A"));
        assertThrows(InvalidCellAddressException.class, () -> CellAddress.fromText(""));
        assertThrows(InvalidCellAddressException.class, () -> CellAddress.fromText(null));
    }

    @Test
    void testRejectsOverflowingAddresses() {
        assertThrows(InvalidCellAddressException.class, () -> CellAddress.fromText("A99999999999"));
        assertThrows(InvalidCellAddressException.class, () -> CellAddress.fromText("ZZZZZZZZZZ1"));
    }

    @Test
    void testOrderingIsRowMajor() {
        assertTrue(CellAddress.fromText("Z1").compareTo(CellAddress.fromText("A2")) < 0);
        assertTrue(CellAddress.fromText("A2").compareTo(CellAddress.fromText("B2")) < 0);
        assertEquals(0, CellAddress.fromText("c3").compareTo(CellAddress.fromText("C3")));
    }

    @Test
    void testIsWithinGrid() {
        assertTrue(CellAddress.fromText("J10").isWithin(10, 10));
        assertFalse(CellAddress.fromText("K10").isWithin(10, 10));
        assertFalse(CellAddress.fromText("J11").isWithin(10, 10));
    }
}
