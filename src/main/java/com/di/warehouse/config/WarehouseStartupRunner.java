package com.di.warehouse.config;

import com.di.warehouse.bronze.BronzeLoadReport;
import com.di.warehouse.bronze.BronzeLoader;
import com.di.warehouse.silver.batch.SilverLoadOrchestrator;
import com.di.warehouse.silver.batch.SilverLoadReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Optional Bronze then Silver load at startup ({@code warehouse.bronze.load-on-startup},
 * {@code warehouse.silver.load-on-startup}). A Silver failure propagates and stops the application.
 */
@Slf4j
@Component
@Order(2)
@RequiredArgsConstructor
public class WarehouseStartupRunner implements ApplicationRunner {

    private final WarehouseProperties properties;
    private final BronzeLoader bronzeLoader;
    private final SilverLoadOrchestrator silverOrchestrator;

    @Override
    public void run(ApplicationArguments args) {
        if (properties.getBronze().isLoadOnStartup()) {
            BronzeLoadReport bronze = bronzeLoader.loadAll();
            if (!bronze.isSuccessful()) {
                log.warn("[BATCH] Bronze tables failed to load at startup: {}", bronze.getFailedTables());
            }
        }
        if (properties.getSilver().isLoadOnStartup()) {
            SilverLoadReport silver = silverOrchestrator.runBatch();
            log.info("[BATCH] Startup Silver batch {} finished: rows={}", silver.getRunId(), silver.getTotalRowsWritten());
        }
    }
}
