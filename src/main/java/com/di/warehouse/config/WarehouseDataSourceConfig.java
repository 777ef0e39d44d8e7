package com.di.warehouse.config;

import com.di.warehouse.util.InputValidator;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * Builds the single HikariCP pool for the warehouse target from {@code warehouse.datasource.*}.
 * Spring's DataSource auto-configuration is excluded in {@link com.di.warehouse.WarehouseApplication}.
 */
@Slf4j
@Configuration
public class WarehouseDataSourceConfig {

    @Bean(destroyMethod = "close")
    public HikariDataSource warehouseDataSource(WarehouseProperties properties) {
        return createPool(properties.getDatasource().toDbConfigSnapshot());
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource warehouseDataSource) {
        return new JdbcTemplate(warehouseDataSource);
    }

    @Bean
    public PlatformTransactionManager transactionManager(DataSource warehouseDataSource) {
        return new DataSourceTransactionManager(warehouseDataSource);
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    /**
     * Creates a pool for the given snapshot. Also used directly by tests against an in-memory database.
     */
    public static HikariDataSource createPool(DbConfigSnapshot snapshot) {
        String jdbcUrl = InputValidator.validateJdbcUrl(snapshot.jdbcUrl());
        int effectiveMinIdle = Math.min(snapshot.minimumIdle(), snapshot.maximumPoolSize());

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setUsername(snapshot.username());
        hikariConfig.setPassword(snapshot.password());
        hikariConfig.setDriverClassName(snapshot.driverClassName());
        hikariConfig.setMaximumPoolSize(snapshot.maximumPoolSize());
        hikariConfig.setMinimumIdle(effectiveMinIdle);
        hikariConfig.setIdleTimeout(snapshot.idleTimeoutMs());
        hikariConfig.setConnectionTimeout(snapshot.connectionTimeoutMs());
        hikariConfig.setMaxLifetime(snapshot.maxLifetimeMs());
        // Pool may start before the database is reachable; failures surface on first use
        hikariConfig.setInitializationFailTimeout(-1);
        if (jdbcUrl.contains("postgresql")) {
            hikariConfig.addDataSourceProperty("tcpKeepAlive", "true");
            hikariConfig.addDataSourceProperty("reWriteBatchedInserts", "true");
        }
        hikariConfig.setPoolName("warehouse-pool");

        log.info("[POOL] Creating | jdbcUrl={} | user={} | maxPoolSize={}, minIdle={}",
                InputValidator.sanitizeForLogging(jdbcUrl), snapshot.username(),
                snapshot.maximumPoolSize(), effectiveMinIdle);
        return new HikariDataSource(hikariConfig);
    }
}
