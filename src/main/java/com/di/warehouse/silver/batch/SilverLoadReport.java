package com.di.warehouse.silver.batch;

import com.di.warehouse.silver.jdbc.WriteMode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a successful Silver batch.
 */
@Value
@Builder
public class SilverLoadReport {
    String runId;
    WriteMode writeMode;
    Instant startedAt;
    long durationMs;
    List<StepResult> steps;
    /** True when staging was published into Silver. */
    boolean published;

    public long getTotalRowsWritten() {
        return steps.stream().mapToLong(StepResult::getRowsWritten).sum();
    }
}
