package com.di.warehouse.silver.batch;

import com.di.warehouse.silver.jdbc.SilverTable;
import com.di.warehouse.silver.jdbc.SilverWriter;
import com.di.warehouse.silver.transform.SilverTransformer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.ParameterizedPreparedStatementSetter;

import java.util.List;
import java.util.function.Supplier;

/**
 * One table of the Silver batch: read Bronze, transform, replace the target table.
 *
 * @param <I> Bronze row type
 * @param <O> Silver row type
 */
@Slf4j
@Getter
public class SilverLoadStep<I, O> {

    private final SilverTable table;
    private final Supplier<List<I>> reader;
    private final SilverTransformer<I, O> transformer;
    private final ParameterizedPreparedStatementSetter<O> binder;

    public SilverLoadStep(SilverTable table, Supplier<List<I>> reader,
                          SilverTransformer<I, O> transformer,
                          ParameterizedPreparedStatementSetter<O> binder) {
        this.table = table;
        this.reader = reader;
        this.transformer = transformer;
        this.binder = binder;
    }

    public String getName() {
        return table.getTableName();
    }

    /**
     * @throws StepFailedException wrapping any failure, tagged with the phase it happened in
     */
    StepResult execute(BatchContext context, SilverWriter writer, String schema) {
        long start = System.currentTimeMillis();
        StepPhase phase = StepPhase.READ;
        try {
            List<I> bronze = reader.get();
            phase = StepPhase.TRANSFORM;
            List<O> silver = transformer.transform(bronze, context);
            phase = StepPhase.WRITE;
            int written = writer.replace(schema, table, silver, binder);
            long durationMs = System.currentTimeMillis() - start;
            log.info("[STEP] {} -> {}: read={} written={} in {} ms",
                    getName(), table.qualifiedName(schema), bronze.size(), written, durationMs);
            return StepResult.builder()
                    .step(getName())
                    .target(table.qualifiedName(schema))
                    .rowsRead(bronze.size())
                    .rowsWritten(written)
                    .durationMs(durationMs)
                    .build();
        } catch (RuntimeException e) {
            throw new StepFailedException(getName(), phase, e);
        }
    }

    /** Internal carrier from a step to the orchestrator. */
    static class StepFailedException extends RuntimeException {
        private final String step;
        private final StepPhase phase;

        StepFailedException(String step, StepPhase phase, Throwable cause) {
            super(cause);
            this.step = step;
            this.phase = phase;
        }

        String getStep() {
            return step;
        }

        StepPhase getPhase() {
            return phase;
        }
    }
}
