package com.di.warehouse.bronze;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of loading one Bronze table. {@code error} is null on success.
 */
@Value
@Builder
public class BronzeTableResult {
    String table;
    String file;
    long rowsLoaded;
    long durationMs;
    String error;
    Integer errorCode;
    String errorCategory;

    public boolean isSuccessful() {
        return error == null;
    }
}
