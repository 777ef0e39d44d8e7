package com.di.warehouse.controller;

import com.di.warehouse.bronze.BronzeLoadReport;
import com.di.warehouse.bronze.BronzeLoader;
import com.di.warehouse.silver.batch.SilverLoadOrchestrator;
import com.di.warehouse.silver.batch.SilverLoadReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Batch triggers for the warehouse.
 *
 * <table border="1">
 * <tr><th>Method</th><th>Path</th><th>Description</th></tr>
 * <tr><td>POST</td><td>/api/warehouse/bronze/load</td><td>Reload all Bronze tables from CSV (synchronous)</td></tr>
 * <tr><td>POST</td><td>/api/warehouse/silver/load</td><td>Run the Silver batch (synchronous)</td></tr>
 * <tr><td>POST</td><td>/api/warehouse/silver/cancel</td><td>Cancel the running Silver batch before its next step</td></tr>
 * </table>
 *
 * <p>Failures are rendered by {@link com.di.warehouse.exception.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/warehouse")
@Slf4j
@RequiredArgsConstructor
public class WarehouseBatchController {

    private final BronzeLoader bronzeLoader;
    private final SilverLoadOrchestrator silverOrchestrator;

    /**
     * Always 200: per-table failures are reported inside the body.
     */
    @PostMapping("/bronze/load")
    public ResponseEntity<BronzeLoadReport> loadBronze() {
        log.info("[CONTROLLER] POST /api/warehouse/bronze/load");
        return ResponseEntity.ok(bronzeLoader.loadAll());
    }

    @PostMapping("/silver/load")
    public ResponseEntity<SilverLoadReport> loadSilver() {
        log.info("[CONTROLLER] POST /api/warehouse/silver/load");
        return ResponseEntity.ok(silverOrchestrator.runBatch());
    }

    @PostMapping("/silver/cancel")
    public ResponseEntity<Map<String, Object>> cancelSilver() {
        boolean wasRunning = silverOrchestrator.isRunning();
        boolean cancelled = silverOrchestrator.cancel();
        log.info("[CONTROLLER] POST /api/warehouse/silver/cancel running={} cancelled={}", wasRunning, cancelled);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("running", wasRunning);
        body.put("cancelled", cancelled);
        return ResponseEntity.ok(body);
    }
}
