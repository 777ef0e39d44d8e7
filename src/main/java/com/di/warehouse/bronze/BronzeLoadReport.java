package com.di.warehouse.bronze;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Value
@Builder
public class BronzeLoadReport {
    Instant startedAt;
    long durationMs;
    List<BronzeTableResult> tables;

    public boolean isSuccessful() {
        return tables.stream().allMatch(BronzeTableResult::isSuccessful);
    }

    public List<String> getFailedTables() {
        return tables.stream()
                .filter(t -> !t.isSuccessful())
                .map(BronzeTableResult::getTable)
                .collect(Collectors.toList());
    }

    public long getTotalRowsLoaded() {
        return tables.stream().mapToLong(BronzeTableResult::getRowsLoaded).sum();
    }
}
