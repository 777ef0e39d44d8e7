package com.di.warehouse.support;

import com.di.warehouse.sql.SqlQueriesProperties;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Binds the bundled sql-queries.yml the way the application does, for tests that run without a Spring context.
 */
public final class SqlQueries {

    public static final String RESOURCE = "sql-queries.yml";

    private SqlQueries() {
    }

    public static SqlQueriesProperties load() {
        try {
            List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                    .load(RESOURCE, new ClassPathResource(RESOURCE));
            return new Binder(ConfigurationPropertySources.from(sources))
                    .bind("warehouse.sql", SqlQueriesProperties.class)
                    .orElseThrow(() -> new IllegalStateException("No warehouse.sql queries in " + RESOURCE));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
