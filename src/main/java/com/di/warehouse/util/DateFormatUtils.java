package com.di.warehouse.util;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Arrays;
import java.util.List;

@Slf4j
public final class DateFormatUtils {

    private static final DateTimeFormatter COMPACT_DATE =
            DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT);

    private static final List<String> KNOWN_DATE_PATTERNS = Arrays.asList(
            "uuuu-MM-dd",   // ISO standard
            "uuuu/MM/dd",   // Logs
            "dd/MM/uuuu",   // UK / EU
            "dd.MM.uuuu",   // Central Europe
            "uuuuMMdd"
    );

    private static final List<String> KNOWN_DATE_TIME_PATTERNS = Arrays.asList(
            "uuuu-MM-dd HH:mm:ss.SSS",
            "uuuu-MM-dd HH:mm:ss",
            "uuuu-MM-dd'T'HH:mm:ss",
            "uuuu-MM-dd HH:mm"
    );

    private DateFormatUtils() {
    }

    /**
     * Converts an integer date in {@code yyyyMMdd} form to a {@link LocalDate}.
     * Returns null when the value is null, 0, not exactly 8 characters long, or not a real calendar date.
     * Never throws.
     *
     * @param compact the integer date (e.g. 20240115)
     * @return the date, or null if invalid
     */
    public static LocalDate parseCompactDate(Integer compact) {
        if (compact == null || compact == 0) {
            return null;
        }
        String text = String.valueOf(compact);
        if (text.length() != 8) {
            return null;
        }
        try {
            return LocalDate.parse(text, COMPACT_DATE);
        } catch (DateTimeParseException e) {
            log.debug("Invalid compact date {}: {}", compact, e.getMessage());
            return null;
        }
    }

    /**
     * Day precision of a timestamp; null stays null.
     */
    public static LocalDate truncateToDay(LocalDateTime value) {
        return value == null ? null : value.toLocalDate();
    }

    /**
     * Tries known patterns to read a date from flat-file text (e.g. "2024-01-15" or "15/01/2024").
     * A value carrying a time part is accepted and truncated to its date.
     *
     * @throws IllegalArgumentException if no pattern matches
     */
    public static LocalDate parseDate(String inputDate) {
        for (String pattern : KNOWN_DATE_PATTERNS) {
            try {
                return LocalDate.parse(inputDate, strict(pattern));
            } catch (DateTimeParseException ignored) {
                // next pattern
            }
        }
        try {
            return parseDateTime(inputDate).toLocalDate();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unrecognized date format: " + inputDate
                    + ". Supported patterns are: " + String.join(", ", KNOWN_DATE_PATTERNS), e);
        }
    }

    /**
     * Tries known patterns to read a timestamp from flat-file text. A bare date means midnight.
     *
     * @throws IllegalArgumentException if no pattern matches
     */
    public static LocalDateTime parseDateTime(String inputDateTime) {
        for (String pattern : KNOWN_DATE_TIME_PATTERNS) {
            try {
                return LocalDateTime.parse(inputDateTime, strict(pattern));
            } catch (DateTimeParseException ignored) {
                // next pattern
            }
        }
        for (String pattern : KNOWN_DATE_PATTERNS) {
            try {
                return LocalDate.parse(inputDateTime, strict(pattern)).atStartOfDay();
            } catch (DateTimeParseException ignored) {
                // next pattern
            }
        }
        throw new IllegalArgumentException("Unrecognized date/time format: " + inputDateTime
                + ". Supported patterns are: " + String.join(", ", KNOWN_DATE_TIME_PATTERNS));
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }
}
