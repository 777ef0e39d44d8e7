package com.di.warehouse.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DateFormatUtils Tests")
class DateFormatUtilsTest {

    // ============================================================================
    // Compact integer dates
    // ============================================================================

    @Test
    @DisplayName("Should parse a valid yyyyMMdd integer")
    void testParseCompactDate_Valid() {
        assertEquals(LocalDate.of(2010, 12, 29), DateFormatUtils.parseCompactDate(20101229));
    }

    @Test
    @DisplayName("Should return null for null and zero")
    void testParseCompactDate_NullAndZero() {
        assertNull(DateFormatUtils.parseCompactDate(null));
        assertNull(DateFormatUtils.parseCompactDate(0));
    }

    @ParameterizedTest
    @ValueSource(ints = {2011010, 201101051, 5, 1999})
    @DisplayName("Should return null when the value is not exactly 8 digits long")
    void testParseCompactDate_WrongLength(int value) {
        assertNull(DateFormatUtils.parseCompactDate(value));
    }

    @ParameterizedTest
    @ValueSource(ints = {20101301, 20100230, 20100431, 20100000})
    @DisplayName("Should return null for 8-digit values that are not calendar dates")
    void testParseCompactDate_NotACalendarDate(int value) {
        assertNull(DateFormatUtils.parseCompactDate(value));
    }

    @Test
    @DisplayName("Should accept leap day only in leap years")
    void testParseCompactDate_LeapDay() {
        assertEquals(LocalDate.of(2012, 2, 29), DateFormatUtils.parseCompactDate(20120229));
        assertNull(DateFormatUtils.parseCompactDate(20110229));
    }

    // ============================================================================
    // Flat-file text
    // ============================================================================

    @ParameterizedTest
    @CsvSource({
            "2024-01-15, 2024-01-15",
            "2024/01/15, 2024-01-15",
            "15/01/2024, 2024-01-15",
            "15.01.2024, 2024-01-15",
            "20240115,   2024-01-15",
            "2024-01-15 10:30:00, 2024-01-15"
    })
    @DisplayName("Should parse the known date patterns")
    void testParseDate_KnownPatterns(String input, String expected) {
        assertEquals(LocalDate.parse(expected), DateFormatUtils.parseDate(input));
    }

    @Test
    @DisplayName("Should throw for an unrecognized date")
    void testParseDate_Invalid() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> DateFormatUtils.parseDate("Jan 15th"));
        assertTrue(e.getMessage().contains("Jan 15th"));
    }

    @Test
    @DisplayName("Should reject impossible dates instead of rolling them over")
    void testParseDate_Strict() {
        assertThrows(IllegalArgumentException.class, () -> DateFormatUtils.parseDate("2023-02-29"));
    }

    @Test
    @DisplayName("Should parse timestamps and treat a bare date as midnight")
    void testParseDateTime() {
        assertEquals(LocalDateTime.of(2003, 7, 1, 0, 0), DateFormatUtils.parseDateTime("2003-07-01"));
        assertEquals(LocalDateTime.of(2003, 7, 1, 8, 15, 30), DateFormatUtils.parseDateTime("2003-07-01 08:15:30"));
        assertEquals(LocalDateTime.of(2003, 7, 1, 8, 15, 30), DateFormatUtils.parseDateTime("2003-07-01T08:15:30"));
        assertEquals(LocalDateTime.of(2003, 7, 1, 8, 15, 30, 250_000_000),
                DateFormatUtils.parseDateTime("2003-07-01 08:15:30.250"));
        assertThrows(IllegalArgumentException.class, () -> DateFormatUtils.parseDateTime("yesterday"));
    }

    @Test
    @DisplayName("Should truncate a timestamp to its day")
    void testTruncateToDay() {
        assertEquals(LocalDate.of(2011, 7, 1), DateFormatUtils.truncateToDay(LocalDateTime.of(2011, 7, 1, 23, 59)));
        assertNull(DateFormatUtils.truncateToDay(null));
    }
}
