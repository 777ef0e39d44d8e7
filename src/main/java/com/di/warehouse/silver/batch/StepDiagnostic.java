package com.di.warehouse.silver.batch;

import com.di.warehouse.aspect.ErrorCategory;
import lombok.Builder;
import lombok.Value;

import java.sql.SQLException;
import java.util.Set;

/**
 * Structured description of a failed Silver batch: which step, in which phase, what kind of failure,
 * the database error details when there are any, and what state Silver was left in.
 */
@Value
@Builder
public class StepDiagnostic {

    /** SQLStates for "table or view not found" (ANSI, PostgreSQL). */
    private static final Set<String> MISSING_TABLE_STATES = Set.of("42S02", "42P01");
    /** H2 vendor codes for "table not found". */
    private static final Set<Integer> MISSING_TABLE_CODES = Set.of(42102, 42103, 42104);

    String step;
    StepPhase phase;
    FailureKind kind;
    Integer vendorCode;
    String sqlState;
    String message;
    ErrorCategory.Severity severity;
    ErrorCategory category;
    /** Which Silver tables were reloaded, emptied or left untouched. */
    String warning;

    /**
     * Builds the diagnostic for a step failure; {@code warning} is filled in by the orchestrator.
     */
    public static StepDiagnostic of(String step, StepPhase phase, Throwable cause, String warning) {
        SQLException sqlEx = ErrorCategory.findSqlException(cause);
        ErrorCategory category = ErrorCategory.categorize(cause);
        return StepDiagnostic.builder()
                .step(step)
                .phase(phase)
                .kind(classify(phase, sqlEx, category))
                .vendorCode(sqlEx != null ? sqlEx.getErrorCode() : null)
                .sqlState(sqlEx != null ? sqlEx.getSQLState() : null)
                .message(sqlEx != null && sqlEx.getMessage() != null ? sqlEx.getMessage() : messageOf(cause))
                .severity(category.getSeverity())
                .category(category)
                .warning(warning)
                .build();
    }

    public static StepDiagnostic cancelled(String step, String warning) {
        return StepDiagnostic.builder()
                .step(step)
                .kind(FailureKind.CANCELLED)
                .message("Silver batch cancelled before step " + step)
                .severity(ErrorCategory.CANCELLED.getSeverity())
                .category(ErrorCategory.CANCELLED)
                .warning(warning)
                .build();
    }

    static FailureKind classify(StepPhase phase, SQLException sqlEx, ErrorCategory category) {
        if (phase == StepPhase.READ
                && (category == ErrorCategory.CONNECTION_ERROR || isMissingTable(sqlEx))) {
            return FailureKind.SOURCE_UNAVAILABLE;
        }
        if (category == ErrorCategory.CONSTRAINT_VIOLATION || category == ErrorCategory.DATA_ERROR) {
            return FailureKind.CONSTRAINT_VIOLATION;
        }
        return FailureKind.UNEXPECTED;
    }

    private static boolean isMissingTable(SQLException sqlEx) {
        return sqlEx != null
                && (MISSING_TABLE_STATES.contains(sqlEx.getSQLState()) || MISSING_TABLE_CODES.contains(sqlEx.getErrorCode()));
    }

    private static String messageOf(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
