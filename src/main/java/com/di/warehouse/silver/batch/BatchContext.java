package com.di.warehouse.silver.batch;

import lombok.Getter;

import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State shared by the steps of one Silver batch: run id, the processing time used for
 * "future date" checks and the cancellation flag.
 */
@Getter
public class BatchContext {

    private final String runId;
    private final LocalDateTime processingTime;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public BatchContext(String runId, LocalDateTime processingTime) {
        this.runId = runId;
        this.processingTime = processingTime;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** @return true if this call raised the flag */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }
}
