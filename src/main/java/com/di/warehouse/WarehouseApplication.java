package com.di.warehouse;

import com.di.warehouse.config.WarehouseProperties;
import com.di.warehouse.sql.SqlQueriesProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

@SpringBootApplication(exclude = {
		DataSourceAutoConfiguration.class,
		DataSourceTransactionManagerAutoConfiguration.class
})
@EnableAspectJAutoProxy(proxyTargetClass = true)
@EnableConfigurationProperties({ WarehouseProperties.class, SqlQueriesProperties.class })
public class WarehouseApplication {

	public static void main(String[] args) {
		// Bronze and Silver loads on startup are driven by WarehouseStartupRunner (warehouse.*.load-on-startup)
		SpringApplication.run(WarehouseApplication.class, args);
	}
}
