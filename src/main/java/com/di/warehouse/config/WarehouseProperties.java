package com.di.warehouse.config;

import com.di.warehouse.silver.jdbc.WriteMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Warehouse settings bound from application.yml ({@code warehouse.*}).
 */
@Data
@Validated
@ConfigurationProperties(prefix = "warehouse")
public class WarehouseProperties {

    @Valid
    private Datasource datasource = new Datasource();

    private Schema schema = new Schema();

    @Valid
    private Bronze bronze = new Bronze();

    @Valid
    private Silver silver = new Silver();

    @Data
    public static class Datasource {
        @NotBlank
        private String jdbcUrl = "jdbc:postgresql://localhost:5432/warehouse";
        private String username = "warehouse";
        private String password = "";
        @NotBlank
        private String driverClassName = "org.postgresql.Driver";
        @Min(1)
        private int maximumPoolSize = 8;
        @Min(0)
        private int minimumIdle = 1;
        private long idleTimeoutMs = 600_000L;
        private long connectionTimeoutMs = 30_000L;
        private long maxLifetimeMs = 1_800_000L;

        public DbConfigSnapshot toDbConfigSnapshot() {
            return new DbConfigSnapshot(jdbcUrl, username, password, driverClassName,
                    maximumPoolSize, minimumIdle, idleTimeoutMs, connectionTimeoutMs, maxLifetimeMs);
        }
    }

    @Data
    public static class Schema {
        /** Run schema/warehouse-ddl.sql and schema/gold-views.sql at startup. */
        private boolean initialize = false;
    }

    @Data
    public static class Bronze {
        /** Directory holding one CSV per Bronze table. */
        @NotBlank
        private String sourceDir = "./data/bronze";
        /** Optional per-table override: bronze table name (e.g. crm_cust_info) to file path. */
        private Map<String, String> files = new HashMap<>();
        private boolean loadOnStartup = false;
        @Min(1)
        private int batchSize = 1_000;

        /** Explicit file from {@link #files} if configured, else {@code <sourceDir>/bronze.<table>.csv}. */
        public Path resolveFile(String tableName) {
            String explicit = files != null ? files.get(tableName) : null;
            if (explicit != null && !explicit.isBlank()) {
                return Paths.get(explicit.trim());
            }
            return Paths.get(sourceDir, "bronze." + tableName + ".csv");
        }
    }

    @Data
    public static class Silver {
        @NotNull
        private WriteMode writeMode = WriteMode.STAGED_SWAP;
        @Min(1)
        @Max(6)
        private int parallelism = 1;
        @Min(1)
        private int batchSize = 1_000;
        private boolean loadOnStartup = false;
    }
}
