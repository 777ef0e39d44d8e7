package com.di.warehouse.silver.batch;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StepResult {
    String step;
    /** Table written, schema-qualified. */
    String target;
    int rowsRead;
    int rowsWritten;
    long durationMs;
}
