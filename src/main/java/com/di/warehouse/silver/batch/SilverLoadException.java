package com.di.warehouse.silver.batch;

import lombok.Getter;

/**
 * A Silver batch aborted. Carries the {@link StepDiagnostic} for the caller.
 */
@Getter
public class SilverLoadException extends RuntimeException {

    private final transient StepDiagnostic diagnostic;

    public SilverLoadException(StepDiagnostic diagnostic, Throwable cause) {
        super(format(diagnostic), cause);
        this.diagnostic = diagnostic;
    }

    private static String format(StepDiagnostic d) {
        StringBuilder sb = new StringBuilder("Silver batch failed at step ").append(d.getStep());
        if (d.getPhase() != null) {
            sb.append(" [").append(d.getPhase()).append(']');
        }
        sb.append(": ").append(d.getKind()).append(" - ").append(d.getMessage());
        return sb.toString();
    }
}
