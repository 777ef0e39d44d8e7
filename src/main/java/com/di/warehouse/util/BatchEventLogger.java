package com.di.warehouse.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Logs structured batch events (Bronze load, Silver batch) as one JSON line each.
 * <p>Every event carries the application instance id, the run id from MDC and the emitting thread.
 */
@Slf4j
@Component
public class BatchEventLogger {

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;
    private static final int STACK_TRACE_LINES = 5;

    private final String applicationId;
    private final ObjectMapper mapper;

    public BatchEventLogger(@Value("${spring.application.name:medallion-warehouse}") String applicationName) {
        this.applicationId = applicationName + "-" + UUID.randomUUID().toString().substring(0, 8);
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        log.info("[BATCH] BatchEventLogger initialized with applicationId: {}", applicationId);
    }

    public String getApplicationId() {
        return applicationId;
    }

    public void logEvent(String eventType, Map<String, Object> context, String runId, String transactionContext) {
        logEvent(eventType, context, runId, transactionContext, null);
    }

    /**
     * @param eventType e.g. SILVER_LOAD_FAILED
     * @param context   event details; may be null
     * @param runId     correlation id, "unknown" when null
     * @param exception failure, adds a short stack trace summary
     */
    public void logEvent(String eventType, Map<String, Object> context, String runId,
                         String transactionContext, Throwable exception) {
        Thread thread = Thread.currentThread();
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("eventType", eventType);
        event.put("timestamp", ISO_FORMATTER.format(Instant.now()));
        event.put("applicationId", applicationId);
        event.put("runId", runId != null ? runId : "unknown");
        event.put("threadName", thread.getName());

        Map<String, Object> details = context == null ? new LinkedHashMap<>() : new LinkedHashMap<>(context);
        if (transactionContext != null && !transactionContext.isEmpty()) {
            details.put("transactionContext", transactionContext);
        }
        if (exception != null) {
            details.put("stackTraceSummary", stackTraceSummary(exception));
        }
        if (!details.isEmpty()) {
            event.put("context", details);
        }
        log.info("[BATCH] EVENT: {}", toJson(event));
    }

    String toJson(Map<String, Object> event) {
        try {
            return mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.warn("[BATCH] Event not serializable ({}), logging as text", e.getOriginalMessage());
            return String.valueOf(event);
        }
    }

    private static String stackTraceSummary(Throwable exception) {
        StringWriter sw = new StringWriter();
        exception.printStackTrace(new PrintWriter(sw));
        String[] lines = sw.toString().split("\n");
        int include = Math.min(STACK_TRACE_LINES, lines.length);
        StringBuilder summary = new StringBuilder();
        for (int i = 0; i < include; i++) {
            if (i > 0) summary.append(" | ");
            summary.append(lines[i].trim());
        }
        if (lines.length > STACK_TRACE_LINES) {
            summary.append(" | ... (").append(lines.length - STACK_TRACE_LINES).append(" more lines)");
        }
        return summary.toString();
    }
}
