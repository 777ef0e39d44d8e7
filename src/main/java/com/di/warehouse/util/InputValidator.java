package com.di.warehouse.util;

import lombok.extern.slf4j.Slf4j;

import java.util.regex.Pattern;

/**
 * Validation for identifiers and URLs that end up concatenated into SQL text
 * (schema-qualified table names, JDBC URLs).
 */
@Slf4j
public final class InputValidator {

    private InputValidator() {}

    /**
     * Unquoted identifier: starts with letter or underscore, then letters, digits or underscores.
     * Max 63 characters (PostgreSQL limit).
     */
    private static final Pattern VALID_IDENTIFIER_PATTERN = Pattern.compile(
            "^[a-zA-Z_][a-zA-Z0-9_]{0,62}$"
    );

    /** Statement separators, comments and quotes never belong in a JDBC URL we log or open. */
    private static final Pattern UNSAFE_URL_PATTERN = Pattern.compile("(--|/\\*|\\*/|'|\"|\\s)");

    /**
     * Validates a single identifier (schema, table or column name).
     *
     * @param identifier     the identifier to validate
     * @param identifierType type of identifier for error messages (e.g. "Table name")
     * @return the trimmed identifier
     * @throws IllegalArgumentException if validation fails
     */
    public static String validateIdentifier(String identifier, String identifierType) {
        if (identifier == null) {
            throw new IllegalArgumentException(String.format("%s cannot be null", identifierType));
        }
        String trimmed = identifier.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(String.format("%s cannot be empty", identifierType));
        }
        if (!VALID_IDENTIFIER_PATTERN.matcher(trimmed).matches()) {
            log.warn("Rejected {}: {}", identifierType, trimmed);
            throw new IllegalArgumentException(
                    String.format("Invalid %s format: '%s'. "
                                    + "Must start with a letter or underscore, followed by letters, digits or underscores.",
                            identifierType, trimmed));
        }
        return trimmed;
    }

    /**
     * Validates a table name, optionally schema-qualified ({@code schema.table}).
     *
     * @return the trimmed table name
     * @throws IllegalArgumentException if validation fails
     */
    public static String validateTableName(String tableName) {
        if (tableName == null || tableName.isBlank()) {
            throw new IllegalArgumentException("Table name cannot be null or empty");
        }
        String trimmed = tableName.trim();
        String[] parts = trimmed.split("\\.", 2);
        if (parts.length == 2) {
            validateIdentifier(parts[0], "Schema name");
            validateIdentifier(parts[1], "Table name");
        } else {
            validateIdentifier(trimmed, "Table name");
        }
        return trimmed;
    }

    /**
     * Basic JDBC URL validation.
     *
     * @return the trimmed JDBC URL
     * @throws IllegalArgumentException if validation fails
     */
    public static String validateJdbcUrl(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }
        String trimmed = jdbcUrl.trim();
        if (!trimmed.toLowerCase().startsWith("jdbc:")) {
            throw new IllegalArgumentException("JDBC URL must start with 'jdbc:'");
        }
        if (UNSAFE_URL_PATTERN.matcher(trimmed).find()) {
            log.warn("Rejected JDBC URL containing quotes, comments or whitespace");
            throw new IllegalArgumentException("JDBC URL contains potentially dangerous patterns");
        }
        return trimmed;
    }

    /**
     * Masks passwords embedded in JDBC URLs so the value is safe to log.
     */
    public static String sanitizeForLogging(String input) {
        if (input == null) {
            return "null";
        }
        return input.replaceAll("(?i)password=[^;&]+", "password=***");
    }
}
