package com.csvgroupdiff;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

class CellValueTest {

    @Test
    void numbers_compareByValue_notByText() {
        CellValue five = CellValue.number("5");
        CellValue fivePointZero = CellValue.number("5.0");

        assertEquals(five, fivePointZero);
        assertEquals(five.hashCode(), fivePointZero.hashCode());
        assertEquals(0, five.compareTo(fivePointZero));
        assertEquals("5.0", fivePointZero.display());
    }

    @Test
    void missing_equalsMissing_butNotEmptyText() {
        assertEquals(CellValue.missing(), CellValue.of(null));
        assertEquals(CellValue.missing(), CellValue.number((String) null));
        assertNotEquals(CellValue.missing(), CellValue.of(""));
        assertTrue(CellValue.of(null).isMissing());
    }

    @Test
    void numberAndText_withSameDigits_areDifferent() {
        assertNotEquals(CellValue.number("5"), CellValue.of("5"));
    }

    @Test
    void ordering_putsNumbersFirst_andMissingLast() {
        List<CellValue> values = new ArrayList<>(List.of(
                CellValue.missing(), CellValue.of("b"), CellValue.number(10), CellValue.of("a"),
                CellValue.number("2.5")));

        values.sort(null);

        assertEquals(List.of(CellValue.number("2.5"), CellValue.number(10), CellValue.of("a"), CellValue.of("b"),
                CellValue.missing()), values);
    }

    @Test
    void display_rendersMissingAsEmpty() {
        assertEquals("", CellValue.missing().display());
        assertEquals("<missing>", CellValue.missing().toString());
        assertEquals("abc", CellValue.of("abc").display());
    }

    @Test
    void raw_exposesPlainJavaValue() {
        assertEquals(new BigDecimal("1.50"), CellValue.number("1.50").raw());
        assertEquals("x", CellValue.of("x").raw());
        assertNull(CellValue.missing().raw());
    }

    @Test
    void isNumeric_acceptsDecimalsAndExponents() {
        assertTrue(CellValue.isNumeric("42"));
        assertTrue(CellValue.isNumeric("-3.14"));
        assertTrue(CellValue.isNumeric("1e3"));
        assertFalse(CellValue.isNumeric("abc"));
        assertFalse(CellValue.isNumeric("2024-01-05"));
        assertFalse(CellValue.isNumeric(" "));
        assertFalse(CellValue.isNumeric(null));
    }
}
