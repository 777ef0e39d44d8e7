package com.di.warehouse.bronze;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ColumnType Tests")
class ColumnTypeTest {

    @Test
    @DisplayName("Should treat empty fields as NULL for every type")
    void testParse_Empty() {
        for (ColumnType type : ColumnType.values()) {
            assertNull(type.parse(null));
            assertNull(type.parse(""));
        }
    }

    @Test
    @DisplayName("Should keep whitespace-only text but treat it as NULL for typed columns")
    void testParse_Blank() {
        assertEquals("  ", ColumnType.TEXT.parse("  "));
        assertNull(ColumnType.INT.parse("  "));
        assertNull(ColumnType.DATE.parse(" "));
    }

    @Test
    @DisplayName("Should convert typed values")
    void testParse_Typed() {
        assertEquals(42, ColumnType.INT.parse(" 42 "));
        assertEquals(new BigDecimal("12.50"), ColumnType.DECIMAL.parse("12.50"));
        assertEquals(Date.valueOf(LocalDate.of(2025, 10, 6)), ColumnType.DATE.parse("2025-10-06"));
        assertEquals(Timestamp.valueOf(LocalDateTime.of(2003, 7, 1, 0, 0)), ColumnType.TIMESTAMP.parse("2003-07-01"));
        assertEquals(" f", ColumnType.TEXT.parse(" f"));
    }

    @Test
    @DisplayName("Should reject values that do not fit the type")
    void testParse_Invalid() {
        assertThrows(IllegalArgumentException.class, () -> ColumnType.INT.parse("one"));
        assertThrows(IllegalArgumentException.class, () -> ColumnType.DECIMAL.parse("12,5"));
        assertThrows(IllegalArgumentException.class, () -> ColumnType.DATE.parse("06-10"));
    }
}
