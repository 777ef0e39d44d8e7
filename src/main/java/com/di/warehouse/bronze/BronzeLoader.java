package com.di.warehouse.bronze;

import com.di.warehouse.aspect.ErrorCategory;
import com.di.warehouse.aspect.LogTransaction;
import com.di.warehouse.config.WarehouseProperties;
import com.di.warehouse.util.InputValidator;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.MDC;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Bulk-loads the six Bronze tables from CSV files.
 * <p>Each table is truncated and then loaded from its file (first row is the header, comma separated).
 * A failing table is logged and reported; the loader moves on to the next one.
 */
@Service
@Slf4j
public class BronzeLoader {

    private static final CSVFormat CSV = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .build();

    private final JdbcTemplate jdbc;
    private final WarehouseProperties.Bronze settings;
    private final Clock clock;

    public BronzeLoader(JdbcTemplate jdbc, WarehouseProperties properties, Clock clock) {
        this.jdbc = jdbc;
        this.settings = properties.getBronze();
        this.clock = clock;
    }

    /**
     * Loads every Bronze table in order. Never throws for a single table's failure.
     */
    @LogTransaction(eventType = "BRONZE_LOAD", transactionContext = "bronze_load", includeResult = true)
    public BronzeLoadReport loadAll() {
        Instant startedAt = clock.instant();
        long start = System.currentTimeMillis();
        log.info("[BRONZE] Starting Bronze load: tables={} sourceDir={}", BronzeTable.values().length, settings.getSourceDir());

        List<BronzeTableResult> results = new ArrayList<>();
        for (BronzeTable table : BronzeTable.values()) {
            results.add(loadTable(table));
        }

        BronzeLoadReport report = BronzeLoadReport.builder()
                .startedAt(startedAt)
                .durationMs(System.currentTimeMillis() - start)
                .tables(results)
                .build();
        if (report.isSuccessful()) {
            log.info("[BRONZE] Bronze load completed: rows={} duration={} ms",
                    report.getTotalRowsLoaded(), report.getDurationMs());
        } else {
            log.warn("[BRONZE] Bronze load completed with failures: failed={} rows={} duration={} ms",
                    report.getFailedTables(), report.getTotalRowsLoaded(), report.getDurationMs());
        }
        return report;
    }

    BronzeTableResult loadTable(BronzeTable table) {
        Path file = settings.resolveFile(table.getTableName());
        long start = System.currentTimeMillis();
        MDC.put("step", table.getTableName());
        log.info("[BRONZE] Processing table {} from {}", table.qualifiedName(), file);
        try {
            long rows = truncateAndLoad(table, file);
            long durationMs = System.currentTimeMillis() - start;
            log.info("[BRONZE] {} OK: rows={} duration={} ms", table.qualifiedName(), rows, durationMs);
            return BronzeTableResult.builder()
                    .table(table.getTableName())
                    .file(file.toString())
                    .rowsLoaded(rows)
                    .durationMs(durationMs)
                    .build();
        } catch (Exception e) {
            ErrorCategory category = ErrorCategory.categorize(e);
            SQLException sqlEx = ErrorCategory.findSqlException(e);
            Integer code = sqlEx != null ? sqlEx.getErrorCode() : null;
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("[BRONZE] *** ERROR loading table {} *** message={} code={} category={}",
                    table.qualifiedName(), message, code, category, e);
            return BronzeTableResult.builder()
                    .table(table.getTableName())
                    .file(file.toString())
                    .durationMs(System.currentTimeMillis() - start)
                    .error(message)
                    .errorCode(code)
                    .errorCategory(category.name())
                    .build();
        } finally {
            MDC.remove("step");
        }
    }

    private long truncateAndLoad(BronzeTable table, Path file) throws IOException {
        String target = InputValidator.validateTableName(table.qualifiedName());
        jdbc.execute("TRUNCATE TABLE " + target);

        String sql = table.insertSql();
        int[] argTypes = table.getColumns().stream().mapToInt(c -> c.type().getSqlType()).toArray();
        int batchSize = settings.getBatchSize();
        long total = 0;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = CSV.parse(reader)) {
            List<Object[]> batch = new ArrayList<>(batchSize);
            for (CSVRecord record : parser) {
                batch.add(toRow(table, record));
                if (batch.size() >= batchSize) {
                    jdbc.batchUpdate(sql, batch, argTypes);
                    total += batch.size();
                    batch.clear();
                }
            }
            if (!batch.isEmpty()) {
                jdbc.batchUpdate(sql, batch, argTypes);
                total += batch.size();
            }
        }
        return total;
    }

    static Object[] toRow(BronzeTable table, CSVRecord record) {
        List<BronzeTable.Column> columns = table.getColumns();
        if (record.size() != columns.size()) {
            throw new IllegalArgumentException(String.format("%s record %d: expected %d fields, found %d",
                    table.getTableName(), record.getRecordNumber(), columns.size(), record.size()));
        }
        Object[] row = new Object[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            BronzeTable.Column column = columns.get(i);
            try {
                row[i] = column.type().parse(record.get(i));
            } catch (RuntimeException e) {
                throw new IllegalArgumentException(String.format("%s record %d: invalid %s value '%s' for column %s",
                        table.getTableName(), record.getRecordNumber(), column.type(), record.get(i), column.name()), e);
            }
        }
        return row;
    }
}
