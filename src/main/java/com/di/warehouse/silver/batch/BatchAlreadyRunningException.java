package com.di.warehouse.silver.batch;

/**
 * Rejects a Silver batch request while another batch is running.
 */
public class BatchAlreadyRunningException extends IllegalStateException {

    public BatchAlreadyRunningException(String runningRunId) {
        super("A Silver batch is already running (runId=" + runningRunId + ")");
    }
}
