package com.di.warehouse.silver.batch;

/** Where inside a step (or the final publish) a failure happened. */
public enum StepPhase {
    READ,
    TRANSFORM,
    WRITE,
    PUBLISH
}
