package com.di.warehouse.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;

/**
 * Creates the warehouse schemas, tables and Gold views at startup when {@code warehouse.schema.initialize=true}.
 * Runs before {@link WarehouseStartupRunner}.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class SchemaInitializer implements ApplicationRunner {

    public static final String DDL_SCRIPT = "schema/warehouse-ddl.sql";
    public static final String GOLD_VIEWS_SCRIPT = "schema/gold-views.sql";

    private final DataSource dataSource;
    private final WarehouseProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getSchema().isInitialize()) {
            log.debug("[SCHEMA] warehouse.schema.initialize=false, skipping DDL");
            return;
        }
        apply(dataSource);
    }

    /**
     * Runs the DDL and view scripts against the given database.
     */
    public static void apply(DataSource dataSource) {
        log.info("[SCHEMA] Applying {} and {}", DDL_SCRIPT, GOLD_VIEWS_SCRIPT);
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(
                new ClassPathResource(DDL_SCRIPT),
                new ClassPathResource(GOLD_VIEWS_SCRIPT));
        populator.setSqlScriptEncoding("UTF-8");
        populator.execute(dataSource);
        log.info("[SCHEMA] Warehouse schema ready");
    }
}
