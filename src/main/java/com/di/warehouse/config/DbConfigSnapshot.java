package com.di.warehouse.config;

import java.io.Serializable;

/**
 * Immutable connection settings for the warehouse database (the single load target).
 * {@link #toString()} masks the password so the snapshot can be logged.
 */
public record DbConfigSnapshot(String jdbcUrl, String username, String password, String driverClassName,
                               int maximumPoolSize, int minimumIdle, long idleTimeoutMs, long connectionTimeoutMs,
                               long maxLifetimeMs) implements Serializable {

    @Override
    public String toString() {
        return "DbConfigSnapshot[jdbcUrl=" + jdbcUrl
                + ", username=" + username
                + ", password=***"
                + ", driverClassName=" + driverClassName
                + ", maximumPoolSize=" + maximumPoolSize
                + ", minimumIdle=" + minimumIdle + "]";
    }
}
