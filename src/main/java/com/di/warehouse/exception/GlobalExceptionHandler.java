package com.di.warehouse.exception;

import com.di.warehouse.aspect.ErrorCategory;
import com.di.warehouse.silver.batch.BatchAlreadyRunningException;
import com.di.warehouse.silver.batch.BatchCancelledException;
import com.di.warehouse.silver.batch.SilverLoadException;
import com.di.warehouse.silver.batch.StepDiagnostic;
import com.di.warehouse.util.BatchEventLogger;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions escaping the REST endpoints to a structured {@link ErrorResponse}.
 * <p>A failed Silver batch returns its {@link StepDiagnostic} in {@code details}.
 */
@Slf4j
@ControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final BatchEventLogger eventLogger;

    @ExceptionHandler(BatchCancelledException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(BatchCancelledException e) {
        return silverFailure(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(SilverLoadException.class)
    public ResponseEntity<ErrorResponse> handleSilverLoad(SilverLoadException e) {
        HttpStatus status;
        switch (e.getDiagnostic().getKind()) {
            case SOURCE_UNAVAILABLE:
                status = HttpStatus.SERVICE_UNAVAILABLE;
                break;
            case CONSTRAINT_VIOLATION:
                status = HttpStatus.UNPROCESSABLE_ENTITY;
                break;
            case CANCELLED:
                status = HttpStatus.CONFLICT;
                break;
            default:
                status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return silverFailure(status, e);
    }

    @ExceptionHandler(BatchAlreadyRunningException.class)
    public ResponseEntity<ErrorResponse> handleAlreadyRunning(BatchAlreadyRunningException e) {
        ErrorCategory category = ErrorCategory.VALIDATION_ERROR;
        logError("BATCH_REJECTED", category, e);
        return ResponseEntity.status(HttpStatus.CONFLICT).body(buildErrorResponse(category, e, HttpStatus.CONFLICT));
    }

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<ErrorResponse> handleValidationException(RuntimeException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("VALIDATION_EXCEPTION", category, e);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(buildErrorResponse(category, e, HttpStatus.BAD_REQUEST));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("DATABASE_EXCEPTION", category, e);
        HttpStatus status = category == ErrorCategory.CONNECTION_ERROR
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.INTERNAL_SERVER_ERROR;
        ErrorResponse body = buildErrorResponse(category, e, status);
        SQLException sqlEx = ErrorCategory.findSqlException(e);
        if (sqlEx != null) {
            body.addDetail("sqlState", sqlEx.getSQLState());
            body.addDetail("errorCode", sqlEx.getErrorCode());
        }
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("UNHANDLED_EXCEPTION", category, e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildErrorResponse(category, e, HttpStatus.INTERNAL_SERVER_ERROR));
    }

    private ResponseEntity<ErrorResponse> silverFailure(HttpStatus status, SilverLoadException e) {
        StepDiagnostic d = e.getDiagnostic();
        logError("SILVER_LOAD_EXCEPTION", d.getCategory(), e);
        ErrorResponse body = buildErrorResponse(d.getCategory(), e, status);
        body.addDetail("step", d.getStep());
        body.addDetail("phase", d.getPhase());
        body.addDetail("kind", d.getKind());
        body.addDetail("severity", d.getSeverity());
        body.addDetail("sqlState", d.getSqlState());
        body.addDetail("errorCode", d.getVendorCode());
        body.addDetail("warning", d.getWarning());
        return ResponseEntity.status(status).body(body);
    }

    private void logError(String eventType, ErrorCategory category, Throwable exception) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("errorMessage", messageOf(exception));
        context.put("errorType", exception.getClass().getName());
        context.put("errorCategory", category.name());
        context.put("severity", category.getSeverity().name());
        context.put("handler", "GlobalExceptionHandler");
        eventLogger.logEvent(eventType, context, MDC.get("runId"), "global_exception_handler", exception);
        log.error("GlobalExceptionHandler caught exception: {} [{}]",
                exception.getClass().getSimpleName(), category.getName());
    }

    private static ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(messageOf(exception));
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.addDetail("exceptionType", exception.getClass().getName());
        return response;
    }

    private static String messageOf(Throwable exception) {
        return exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName();
    }

    /**
     * Structured error body for API endpoints.
     */
    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private Map<String, Object> details = new LinkedHashMap<>();

        public void addDetail(String key, Object value) {
            if (value != null) {
                details.put(key, value);
            }
        }
    }
}
