package com.di.warehouse.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a batch operation for automatic event logging by {@link TransactionEventAspect}.
 * <p>The aspect logs {@code <eventType>_STARTED} before the call, then {@code _COMPLETED} with the duration
 * or {@code _FAILED} with the error category, and rethrows any exception unchanged.
 *
 * <pre>
 * {@code
 * @LogTransaction(eventType = "SILVER_LOAD", transactionContext = "silver_load")
 * public SilverLoadReport runBatch() { ... }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface LogTransaction {

    /**
     * Event type prefix, e.g. "BRONZE_LOAD" yields BRONZE_LOAD_STARTED / _COMPLETED / _FAILED.
     */
    String eventType();

    /**
     * What the operation is doing (e.g. "bronze_load", "silver_load").
     */
    String transactionContext() default "";

    /**
     * Whether the completed event carries a summary of the returned value ({@code toString()}).
     */
    boolean includeResult() default false;

    /**
     * MDC key holding the correlation id.
     */
    String transactionIdKey() default "runId";
}
