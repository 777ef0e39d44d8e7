package com.di.warehouse.silver.batch;

/**
 * The cancellation flag was observed before a step started.
 */
public class BatchCancelledException extends SilverLoadException {

    public BatchCancelledException(StepDiagnostic diagnostic) {
        super(diagnostic, null);
    }
}
