package com.di.warehouse.config;

import com.di.warehouse.silver.jdbc.SilverWriter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

@Configuration
public class SilverBatchConfig {

    /** Processing time for the batch ("now" in future-birthdate checks). */
    @Bean
    public Clock warehouseClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public SilverWriter silverWriter(JdbcTemplate jdbcTemplate,
                                     TransactionTemplate transactionTemplate,
                                     WarehouseProperties properties) {
        return new SilverWriter(jdbcTemplate, transactionTemplate, properties.getSilver().getBatchSize());
    }
}
