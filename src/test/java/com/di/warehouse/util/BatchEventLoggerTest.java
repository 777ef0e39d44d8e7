package com.di.warehouse.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BatchEventLogger Tests")
class BatchEventLoggerTest {

    private final BatchEventLogger logger = new BatchEventLogger("medallion-warehouse");

    @Test
    @DisplayName("Should derive a unique application id from the application name")
    void testApplicationId() {
        assertTrue(logger.getApplicationId().startsWith("medallion-warehouse-"));
        assertNotEquals(logger.getApplicationId(), new BatchEventLogger("medallion-warehouse").getApplicationId());
    }

    @Test
    @DisplayName("Should serialize events with java.time values as ISO text")
    void testToJson() {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("eventType", "SILVER_LOAD_COMPLETED");
        event.put("startedAt", Instant.parse("2026-10-19T08:00:00Z"));
        String json = logger.toJson(event);
        assertEquals("{\"eventType\":\"SILVER_LOAD_COMPLETED\",\"startedAt\":\"2026-10-19T08:00:00Z\"}", json);
    }

    @Test
    @DisplayName("Should log events with and without an exception")
    void testLogEvent() {
        assertDoesNotThrow(() -> logger.logEvent("BRONZE_LOAD_STARTED", null, null, "bronze_load"));
        assertDoesNotThrow(() -> logger.logEvent("BRONZE_LOAD_FAILED", Map.of("table", "crm_cust_info"), "run-1",
                "bronze_load", new IllegalStateException("boom")));
    }
}
