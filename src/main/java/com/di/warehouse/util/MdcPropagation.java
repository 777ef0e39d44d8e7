package com.di.warehouse.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Propagates SLF4J MDC (e.g. {@code runId}) to worker threads so that logs from parallel Silver steps
 * are correlated with the batch that submitted them.
 * <p>Usage: {@code executor.submit(MdcPropagation.wrapCallable(() -> runStep()));}
 */
public final class MdcPropagation {

    private MdcPropagation() {
    }

    /**
     * Captures the current thread's MDC and returns a Callable that sets it for the duration of the task
     * and removes those keys in {@code finally}.
     */
    public static <T> Callable<T> wrapCallable(Callable<T> task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                return task.call();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Copy of the current thread's MDC; never null.
     */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static void setMdc(Map<String, String> contextMap) {
        if (!contextMap.isEmpty()) {
            contextMap.forEach(MDC::put);
        }
    }

    private static void clearMdc(Map<String, String> contextMap) {
        if (!contextMap.isEmpty()) {
            contextMap.keySet().forEach(MDC::remove);
        }
    }
}
