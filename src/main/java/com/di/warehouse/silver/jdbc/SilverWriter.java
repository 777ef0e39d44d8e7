package com.di.warehouse.silver.jdbc;

import com.di.warehouse.util.InputValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ParameterizedPreparedStatementSetter;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Writes transformed rows into {@code silver} or {@code silver_staging}, and publishes staging into Silver.
 * Registered as a bean by {@link com.di.warehouse.config.SilverBatchConfig}.
 */
@Slf4j
public class SilverWriter {

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final int batchSize;

    public SilverWriter(JdbcTemplate jdbc, TransactionTemplate transactionTemplate, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, got " + batchSize);
        }
        this.jdbc = jdbc;
        this.transactionTemplate = transactionTemplate;
        this.batchSize = batchSize;
    }

    /**
     * Empties the table, then inserts every row in JDBC batches. The two statements are not atomic:
     * a failed insert leaves the table empty or partially filled.
     *
     * @return rows written
     */
    public <T> int replace(String schema, SilverTable table, List<T> rows,
                           ParameterizedPreparedStatementSetter<T> binder) {
        String target = InputValidator.validateTableName(table.qualifiedName(schema));
        jdbc.execute("TRUNCATE TABLE " + target);
        if (!rows.isEmpty()) {
            jdbc.batchUpdate(table.insertSql(schema), rows, batchSize, binder);
        }
        log.debug("[SILVER] {} <- {} rows", target, rows.size());
        return rows.size();
    }

    /**
     * Replaces every listed Silver table with its staging copy in one transaction.
     * On failure the transaction rolls back and Silver keeps its previous contents.
     */
    public void publish(List<SilverTable> tables) {
        transactionTemplate.executeWithoutResult(status -> {
            for (SilverTable table : tables) {
                jdbc.update("DELETE FROM " + table.qualifiedName(SilverTable.SILVER_SCHEMA));
                int rows = jdbc.update(table.publishSql());
                log.info("[SILVER] Published {} rows into {}", rows, table.qualifiedName(SilverTable.SILVER_SCHEMA));
            }
        });
    }

    public long count(String schema, SilverTable table) {
        Long rows = jdbc.queryForObject("SELECT COUNT(*) FROM " + table.qualifiedName(schema), Long.class);
        return rows == null ? 0L : rows;
    }
}
