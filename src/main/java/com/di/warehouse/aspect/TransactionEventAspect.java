package com.di.warehouse.aspect;

import com.di.warehouse.util.BatchEventLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Logs STARTED / COMPLETED / FAILED events around methods annotated with {@link LogTransaction}.
 * <p>When MDC has no correlation id yet, one is generated and set for the duration of the call,
 * so the annotated method and everything it logs share the same run id.
 */
@Slf4j
@Aspect
@Component
@RequiredArgsConstructor
public class TransactionEventAspect {

    private final BatchEventLogger eventLogger;

    @Around("@annotation(com.di.warehouse.aspect.LogTransaction)")
    public Object logTransaction(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        LogTransaction annotation = method.getAnnotation(LogTransaction.class);

        String eventType = annotation.eventType();
        String transactionContext = annotation.transactionContext();
        String idKey = annotation.transactionIdKey();

        boolean ownsRunId = MDC.get(idKey) == null;
        if (ownsRunId) {
            MDC.put(idKey, UUID.randomUUID().toString());
        }
        String runId = MDC.get(idKey);
        long startTime = System.currentTimeMillis();

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("method", method.getName());
        context.put("className", method.getDeclaringClass().getSimpleName());

        try {
            eventLogger.logEvent(eventType + "_STARTED", context, runId, transactionContext);
            Object result = joinPoint.proceed();

            long durationMs = System.currentTimeMillis() - startTime;
            if (result != null && annotation.includeResult()) {
                context.put("result", result.toString());
            }
            context.put("durationMs", durationMs);
            eventLogger.logEvent(eventType + "_COMPLETED", context, runId, transactionContext);
            return result;
        } catch (Throwable e) {
            long durationMs = System.currentTimeMillis() - startTime;
            ErrorCategory category = ErrorCategory.categorize(e);
            context.put("errorMessage", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            context.put("errorType", e.getClass().getSimpleName());
            context.put("errorCategory", category.name());
            context.put("errorCategoryName", category.getName());
            context.put("severity", category.getSeverity().name());
            context.put("durationMs", durationMs);

            Throwable rootCause = getRootCause(e);
            if (rootCause != e) {
                context.put("rootCauseType", rootCause.getClass().getSimpleName());
                context.put("rootCauseMessage", rootCause.getMessage());
            }
            SQLException sqlEx = ErrorCategory.findSqlException(e);
            if (sqlEx != null) {
                context.put("sqlState", sqlEx.getSQLState());
                context.put("errorCode", sqlEx.getErrorCode());
            }
            eventLogger.logEvent(eventType + "_FAILED", context, runId, transactionContext, e);
            throw e;
        } finally {
            if (ownsRunId) {
                MDC.remove(idKey);
            }
        }
    }

    private static Throwable getRootCause(Throwable exception) {
        Throwable current = exception;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }
}
