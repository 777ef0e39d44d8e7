package com.di.warehouse.silver.batch;

/**
 * Batch-level failure taxonomy. Row-level data problems are never failures; the transformers repair them.
 */
public enum FailureKind {
    /** A Bronze table is missing or unreadable. */
    SOURCE_UNAVAILABLE,
    /** A Silver value broke a constraint or did not fit its column. */
    CONSTRAINT_VIOLATION,
    /** The batch was cancelled between steps. */
    CANCELLED,
    UNEXPECTED
}
