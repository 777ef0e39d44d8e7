package com.di.warehouse.silver.jdbc;

/**
 * How a Silver batch replaces table contents.
 */
public enum WriteMode {

    /**
     * Each step truncates and reloads its {@code silver} table in place.
     * A failed batch leaves earlier tables reloaded, the failing table empty and later tables untouched.
     */
    TRUNCATE_RELOAD,

    /**
     * Each step loads into {@code silver_staging}; after all steps succeed a single transaction
     * replaces every {@code silver} table from staging. A failed batch leaves Silver unchanged.
     */
    STAGED_SWAP
}
