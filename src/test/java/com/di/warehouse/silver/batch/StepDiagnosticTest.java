package com.di.warehouse.silver.batch;

import com.di.warehouse.aspect.ErrorCategory;
import com.di.warehouse.silver.jdbc.BronzeReader;
import com.di.warehouse.silver.jdbc.WriteMode;
import com.di.warehouse.support.SqlQueries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.SQLException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StepDiagnostic Tests")
class StepDiagnosticTest {

    // ============================================================================
    // Failure classification
    // ============================================================================

    @Test
    @DisplayName("Should classify a missing Bronze table during READ as an unavailable source")
    void testOf_MissingTable() {
        BadSqlGrammarException e = new BadSqlGrammarException("read", "SELECT * FROM bronze.crm_prd_info",
                new SQLException("Table \"CRM_PRD_INFO\" not found", "42S02", 42102));

        StepDiagnostic d = StepDiagnostic.of("crm_prd_info", StepPhase.READ, e, "warn");

        assertEquals(FailureKind.SOURCE_UNAVAILABLE, d.getKind());
        assertEquals("42S02", d.getSqlState());
        assertEquals(42102, d.getVendorCode());
        assertEquals(ErrorCategory.SQL_SYNTAX_ERROR, d.getCategory());
        assertEquals("warn", d.getWarning());
        assertTrue(d.getMessage().contains("CRM_PRD_INFO"));
    }

    @Test
    @DisplayName("Should classify a PostgreSQL undefined table during READ as an unavailable source")
    void testOf_MissingTablePostgres() {
        SQLException e = new SQLException("relation \"bronze.crm_prd_info\" does not exist", "42P01", 0);
        assertEquals(FailureKind.SOURCE_UNAVAILABLE, StepDiagnostic.of("crm_prd_info", StepPhase.READ, e, null).getKind());
    }

    @Test
    @DisplayName("Should classify a lost connection during READ as an unavailable source")
    void testOf_ConnectionLost() {
        StepDiagnostic d = StepDiagnostic.of("crm_cust_info", StepPhase.READ,
                new CannotGetJdbcConnectionException("Failed to obtain JDBC Connection"), null);
        assertEquals(FailureKind.SOURCE_UNAVAILABLE, d.getKind());
        assertEquals(ErrorCategory.Severity.FATAL, d.getSeverity());
        assertNull(d.getSqlState());
    }

    @Test
    @DisplayName("Should classify NOT NULL and data errors during WRITE as constraint violations")
    void testOf_ConstraintViolation() {
        DataIntegrityViolationException notNull = new DataIntegrityViolationException("insert",
                new SQLException("NULL not allowed for column \"CST_KEY\"", "23502", 23502));
        assertEquals(FailureKind.CONSTRAINT_VIOLATION,
                StepDiagnostic.of("crm_cust_info", StepPhase.WRITE, notNull, null).getKind());

        SQLException tooLong = new SQLException("Value too long for column", "22001", 22001);
        assertEquals(FailureKind.CONSTRAINT_VIOLATION,
                StepDiagnostic.of("crm_cust_info", StepPhase.WRITE, tooLong, null).getKind());
    }

    @Test
    @DisplayName("Should not treat a missing table during WRITE as an unavailable source")
    void testOf_MissingTargetIsUnexpected() {
        SQLException e = new SQLException("Table not found", "42S02", 42102);
        assertEquals(FailureKind.UNEXPECTED, StepDiagnostic.of("crm_cust_info", StepPhase.WRITE, e, null).getKind());
    }

    @Test
    @DisplayName("Should classify anything else as unexpected and keep its message")
    void testOf_Unexpected() {
        StepDiagnostic d = StepDiagnostic.of("crm_sales_details", StepPhase.TRANSFORM, new NullPointerException(), null);
        assertEquals(FailureKind.UNEXPECTED, d.getKind());
        assertEquals("NullPointerException", d.getMessage());
        assertNull(d.getVendorCode());
    }

    @Test
    @DisplayName("Should describe a cancellation without a phase")
    void testCancelled() {
        StepDiagnostic d = StepDiagnostic.cancelled("crm_prd_info", "warn");
        assertEquals(FailureKind.CANCELLED, d.getKind());
        assertNull(d.getPhase());
        assertEquals(ErrorCategory.Severity.WARNING, d.getSeverity());

        BatchCancelledException e = new BatchCancelledException(d);
        assertEquals("Silver batch failed at step crm_prd_info: CANCELLED - Silver batch cancelled before step crm_prd_info",
                e.getMessage());
    }

    // ============================================================================
    // Outcome warnings
    // ============================================================================

    private static List<SilverLoadStep<?, ?>> steps() {
        BronzeReader reader = new BronzeReader(new JdbcTemplate(), SqlQueries.load());
        return new SilverLoadOrchestrator(reader, null, new com.di.warehouse.config.WarehouseProperties(), null).steps();
    }

    @Test
    @DisplayName("Should list the six steps in batch order")
    void testSteps_Order() {
        assertEquals(List.of("crm_cust_info", "crm_prd_info", "crm_sales_details", "erp_px_cat_g1v2", "erp_cust_az12", "erp_loc_a101"),
                steps().stream().map(SilverLoadStep::getName).toList());
    }

    @Test
    @DisplayName("Should state that Silver is unchanged in STAGED_SWAP mode")
    void testOutcomeWarning_Staged() {
        assertEquals("Silver unchanged: nothing was published from this run",
                SilverLoadOrchestrator.outcomeWarning(steps(), Set.of("crm_cust_info"), Set.of("crm_prd_info"), WriteMode.STAGED_SWAP));
    }

    @Test
    @DisplayName("Should list reloaded, emptied and untouched tables in TRUNCATE_RELOAD mode")
    void testOutcomeWarning_TruncateReload() {
        Set<String> completed = new LinkedHashSet<>(List.of("crm_cust_info", "crm_prd_info", "crm_sales_details", "erp_px_cat_g1v2"));
        String warning = SilverLoadOrchestrator.outcomeWarning(steps(), completed, Set.of("erp_cust_az12"), WriteMode.TRUNCATE_RELOAD);
        assertEquals("Silver is not consistent across tables. Reloaded: [crm_cust_info, crm_prd_info, crm_sales_details,"
                + " erp_px_cat_g1v2]. Empty or partially loaded: [erp_cust_az12]."
                + " Still holding the previous run: [erp_loc_a101].", warning);
    }

    @Test
    @DisplayName("Should treat every table as untouched when the first step fails before writing")
    void testOutcomeWarning_NothingTouched() {
        String warning = SilverLoadOrchestrator.outcomeWarning(steps(), Set.of(), Set.of(), WriteMode.TRUNCATE_RELOAD);
        assertTrue(warning.contains("Reloaded: []"));
        assertTrue(warning.contains("Still holding the previous run: [crm_cust_info, crm_prd_info, crm_sales_details,"
                + " erp_px_cat_g1v2, erp_cust_az12, erp_loc_a101]"));
    }
}
