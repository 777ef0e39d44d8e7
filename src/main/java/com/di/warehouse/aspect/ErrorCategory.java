package com.di.warehouse.aspect;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories for batch event logging, step diagnostics and REST error bodies.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>Spring wraps driver exceptions, so the cause chain is searched for a {@link SQLException} first.
 * To add a new category: add the enum constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    CONNECTION_ERROR("Database connection error", "Failed to establish or maintain database connection", Severity.FATAL),
    CONSTRAINT_VIOLATION("Database constraint violation", "Database constraint check failed", Severity.ERROR),
    DATA_ERROR("Data error", "Value does not fit the target column (size, type or format)", Severity.ERROR),
    SQL_SYNTAX_ERROR("SQL syntax error", "Invalid SQL, or a table or column that does not exist", Severity.FATAL),
    TRANSACTION_ROLLBACK("Transaction rollback", "Transaction was rolled back", Severity.ERROR),
    PERMISSION_ERROR("Permission denied", "Insufficient permissions to perform operation", Severity.FATAL),
    DATABASE_ERROR("Database error", "General database operation error", Severity.ERROR),
    FILE_ERROR("File error", "Source file missing, unreadable or malformed", Severity.ERROR),
    CANCELLED("Cancelled", "Operation was cancelled on request", Severity.WARNING),
    VALIDATION_ERROR("Validation error", "Input validation or business rule violation", Severity.WARNING),
    CONFIGURATION_ERROR("Configuration error", "Application configuration issue", Severity.FATAL),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit", Severity.ERROR),
    APPLICATION_ERROR("Application error", "General application error", Severity.ERROR),
    UNKNOWN("Unknown error", "Unclassified or unknown error type", Severity.ERROR);

    public enum Severity {
        WARNING, ERROR, FATAL
    }

    private final String name;
    private final String description;
    private final Severity severity;

    ErrorCategory(String name, String description, Severity severity) {
        this.name = name;
        this.description = description;
        this.severity = severity;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Severity getSeverity() {
        return severity;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(ErrorCategory::isCancellation, CANCELLED);
        MATCHERS.put(ErrorCategory::isFileError, FILE_ERROR);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isConnectionError, CONNECTION_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
    }

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", CONNECTION_ERROR,
            "22", DATA_ERROR,
            "23", CONSTRAINT_VIOLATION,
            "28", PERMISSION_ERROR,
            "42", SQL_SYNTAX_ERROR,
            "40", TRANSACTION_ROLLBACK
    );

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        SQLException sqlEx = findSqlException(exception);
        if (sqlEx != null) {
            return categorizeSqlException(sqlEx);
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        if (exception instanceof org.springframework.dao.DataAccessException) {
            return DATABASE_ERROR;
        }
        return APPLICATION_ERROR;
    }

    /** First {@link SQLException} in the cause chain, or null. */
    public static SQLException findSqlException(Throwable exception) {
        Throwable current = exception;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (current instanceof SQLException) {
                return (SQLException) current;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }

    private static ErrorCategory categorizeSqlException(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null) {
            ErrorCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, Math.min(2, sqlState.length())));
            if (byState != null) {
                return byState;
            }
        }
        String msg = sqlEx.getMessage();
        if (msg != null) {
            String lower = msg.toLowerCase();
            if (containsAny(lower, "connection", "refused", "closed")) return CONNECTION_ERROR;
            if (containsAny(lower, "permission", "access denied")) return PERMISSION_ERROR;
            if (containsAny(lower, "constraint", "unique", "foreign key", "not null")) return CONSTRAINT_VIOLATION;
            if (containsAny(lower, "syntax", "parse error", "not found")) return SQL_SYNTAX_ERROR;
        }
        return DATABASE_ERROR;
    }

    // --- Matcher helpers ---

    private static boolean isCancellation(Throwable t) {
        return t instanceof java.util.concurrent.CancellationException
                || t instanceof InterruptedException
                || t.getClass().getSimpleName().contains("Cancelled");
    }

    private static boolean isFileError(Throwable t) {
        return t instanceof java.io.FileNotFoundException
                || t instanceof java.nio.file.NoSuchFileException
                || t instanceof java.nio.file.FileSystemException
                || t instanceof java.io.UncheckedIOException
                || t instanceof java.io.IOException;
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || (t.getMessage() != null && t.getMessage().toLowerCase().contains("timeout"));
    }

    private static boolean isConnectionError(Throwable t) {
        return t instanceof org.springframework.jdbc.CannotGetJdbcConnectionException
                || t instanceof java.net.ConnectException;
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.context.ApplicationContextException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof java.time.DateTimeException;
    }

    private static boolean containsAny(String text, String... keywords) {
        if (text == null) return false;
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
