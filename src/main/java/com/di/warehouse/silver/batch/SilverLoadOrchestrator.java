package com.di.warehouse.silver.batch;

import com.di.warehouse.aspect.LogTransaction;
import com.di.warehouse.config.WarehouseProperties;
import com.di.warehouse.silver.batch.SilverLoadStep.StepFailedException;
import com.di.warehouse.silver.jdbc.BronzeReader;
import com.di.warehouse.silver.jdbc.SilverRowBinders;
import com.di.warehouse.silver.jdbc.SilverTable;
import com.di.warehouse.silver.jdbc.SilverWriter;
import com.di.warehouse.silver.jdbc.WriteMode;
import com.di.warehouse.silver.transform.CategoryTransformer;
import com.di.warehouse.silver.transform.CustomerInfoTransformer;
import com.di.warehouse.silver.transform.ErpCustomerTransformer;
import com.di.warehouse.silver.transform.ErpLocationTransformer;
import com.di.warehouse.silver.transform.ProductInfoTransformer;
import com.di.warehouse.silver.transform.SalesDetailTransformer;
import com.di.warehouse.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Runs the Silver batch: six table steps, then (in {@link WriteMode#STAGED_SWAP}) one publish transaction.
 *
 * <pre>
 *  crm_cust_info -> crm_prd_info -> crm_sales_details -> erp_px_cat_g1v2 -> erp_cust_az12 -> erp_loc_a101
 *        each step: READ bronze -> TRANSFORM -> WRITE (silver or silver_staging)
 *  STAGED_SWAP only: PUBLISH silver_staging -> silver in a single transaction
 * </pre>
 *
 * <p>The first failing step aborts the batch with a {@link SilverLoadException}; nothing is retried.
 * Cancellation is checked before each step. Only one batch runs at a time.
 */
@Service
@Slf4j
public class SilverLoadOrchestrator {

    static final String MDC_RUN_ID = "runId";
    static final String MDC_STEP = "step";
    static final String PUBLISH_STEP = "publish";

    private final BronzeReader bronzeReader;
    private final SilverWriter silverWriter;
    private final WarehouseProperties.Silver settings;
    private final Clock clock;

    private final AtomicReference<BatchContext> running = new AtomicReference<>();

    public SilverLoadOrchestrator(BronzeReader bronzeReader,
                                  SilverWriter silverWriter,
                                  WarehouseProperties properties,
                                  Clock clock) {
        this.bronzeReader = bronzeReader;
        this.silverWriter = silverWriter;
        this.settings = properties.getSilver();
        this.clock = clock;
    }

    /* ==================================================================== */
    /* Entry points                                                          */
    /* ==================================================================== */

    /**
     * Rebuilds all six Silver tables from Bronze.
     *
     * @throws BatchAlreadyRunningException if another batch is running
     * @throws BatchCancelledException      if {@link #cancel()} was called before a step started
     * @throws SilverLoadException          on the first failing step or a failed publish
     */
    @LogTransaction(eventType = "SILVER_LOAD", transactionContext = "silver_load", includeResult = true)
    public SilverLoadReport runBatch() {
        String inheritedRunId = MDC.get(MDC_RUN_ID);
        String runId = inheritedRunId != null ? inheritedRunId : UUID.randomUUID().toString();
        BatchContext context = new BatchContext(runId, LocalDateTime.now(clock));

        if (!running.compareAndSet(null, context)) {
            BatchContext other = running.get();
            throw new BatchAlreadyRunningException(other != null ? other.getRunId() : "unknown");
        }
        if (inheritedRunId == null) {
            MDC.put(MDC_RUN_ID, runId);
        }
        try {
            return doRun(context);
        } finally {
            running.compareAndSet(context, null);
            if (inheritedRunId == null) {
                MDC.remove(MDC_RUN_ID);
            }
        }
    }

    /**
     * Flags the running batch; it stops before its next step.
     *
     * @return false when no batch is running or it was already cancelled
     */
    public boolean cancel() {
        BatchContext context = running.get();
        if (context == null) {
            return false;
        }
        boolean raised = context.cancel();
        if (raised) {
            log.warn("[SILVER] runId={} cancellation requested", context.getRunId());
        }
        return raised;
    }

    public boolean isRunning() {
        return running.get() != null;
    }

    /** The six steps, in batch order. */
    List<SilverLoadStep<?, ?>> steps() {
        List<SilverLoadStep<?, ?>> steps = new ArrayList<>();
        steps.add(new SilverLoadStep<>(SilverTable.CRM_CUST_INFO, bronzeReader::readCustomerInfo,
                new CustomerInfoTransformer(), SilverRowBinders.CUSTOMER_INFO));
        steps.add(new SilverLoadStep<>(SilverTable.CRM_PRD_INFO, bronzeReader::readProductInfo,
                new ProductInfoTransformer(), SilverRowBinders.PRODUCT_INFO));
        steps.add(new SilverLoadStep<>(SilverTable.CRM_SALES_DETAILS, bronzeReader::readSalesDetails,
                new SalesDetailTransformer(), SilverRowBinders.SALES_DETAIL));
        steps.add(new SilverLoadStep<>(SilverTable.ERP_PX_CAT_G1V2, bronzeReader::readCategories,
                new CategoryTransformer(), SilverRowBinders.CATEGORY));
        steps.add(new SilverLoadStep<>(SilverTable.ERP_CUST_AZ12, bronzeReader::readErpCustomers,
                new ErpCustomerTransformer(), SilverRowBinders.ERP_CUSTOMER));
        steps.add(new SilverLoadStep<>(SilverTable.ERP_LOC_A101, bronzeReader::readErpLocations,
                new ErpLocationTransformer(), SilverRowBinders.ERP_LOCATION));
        return steps;
    }

    /* ==================================================================== */
    /* Internal pipeline                                                     */
    /* ==================================================================== */

    private SilverLoadReport doRun(BatchContext context) {
        WriteMode mode = settings.getWriteMode();
        String targetSchema = mode == WriteMode.STAGED_SWAP ? SilverTable.STAGING_SCHEMA : SilverTable.SILVER_SCHEMA;
        List<SilverLoadStep<?, ?>> steps = steps();
        Instant startedAt = clock.instant();
        long start = System.currentTimeMillis();

        log.info("[SILVER] runId={} starting: steps={} mode={} target={} parallelism={}",
                context.getRunId(), steps.size(), mode, targetSchema, settings.getParallelism());

        List<StepResult> results = settings.getParallelism() > 1
                ? runParallel(context, steps, targetSchema, mode)
                : runSequential(context, steps, targetSchema, mode);

        boolean published = false;
        if (mode == WriteMode.STAGED_SWAP) {
            publish(context, steps);
            published = true;
        }

        SilverLoadReport report = SilverLoadReport.builder()
                .runId(context.getRunId())
                .writeMode(mode)
                .startedAt(startedAt)
                .durationMs(System.currentTimeMillis() - start)
                .steps(results)
                .published(published)
                .build();
        log.info("[SILVER] runId={} completed: rows={} duration={} ms",
                context.getRunId(), report.getTotalRowsWritten(), report.getDurationMs());
        return report;
    }

    private List<StepResult> runSequential(BatchContext context, List<SilverLoadStep<?, ?>> steps,
                                           String schema, WriteMode mode) {
        List<StepResult> results = new ArrayList<>(steps.size());
        Set<String> completed = new LinkedHashSet<>();
        for (SilverLoadStep<?, ?> step : steps) {
            if (context.isCancelled()) {
                throw cancelled(context, step.getName(), steps, completed, mode);
            }
            try {
                StepResult result = runStep(step, context, schema);
                results.add(result);
                completed.add(step.getName());
            } catch (StepFailedException e) {
                throw failed(context, e, steps, completed, truncatedBy(List.of(e)), mode);
            }
        }
        return results;
    }

    private List<StepResult> runParallel(BatchContext context, List<SilverLoadStep<?, ?>> steps,
                                         String schema, WriteMode mode) {
        int poolSize = Math.min(settings.getParallelism(), steps.size());
        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "silver-step-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        AtomicBoolean aborted = new AtomicBoolean(false);
        try {
            Map<SilverLoadStep<?, ?>, Future<StepResult>> futures = new LinkedHashMap<>();
            for (SilverLoadStep<?, ?> step : steps) {
                futures.put(step, pool.submit(MdcPropagation.wrapCallable(() -> {
                    if (context.isCancelled() || aborted.get()) {
                        return null;
                    }
                    try {
                        return runStep(step, context, schema);
                    } catch (StepFailedException e) {
                        aborted.set(true);
                        throw e;
                    }
                })));
            }

            List<StepResult> results = new ArrayList<>(steps.size());
            Set<String> completed = new LinkedHashSet<>();
            List<StepFailedException> failures = new ArrayList<>();
            String firstSkipped = null;
            for (Map.Entry<SilverLoadStep<?, ?>, Future<StepResult>> entry : futures.entrySet()) {
                String name = entry.getKey().getName();
                try {
                    StepResult result = entry.getValue().get();
                    if (result == null) {
                        firstSkipped = firstSkipped == null ? name : firstSkipped;
                    } else {
                        results.add(result);
                        completed.add(name);
                    }
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof Error) {
                        throw (Error) cause;
                    }
                    StepFailedException failure = cause instanceof StepFailedException
                            ? (StepFailedException) cause
                            : new StepFailedException(name, StepPhase.READ, cause);
                    failures.add(failure);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    context.cancel();
                    throw cancelled(context, name, steps, completed, mode);
                }
            }
            if (!failures.isEmpty()) {
                throw failed(context, failures.get(0), steps, completed, truncatedBy(failures), mode);
            }
            if (firstSkipped != null) {
                throw cancelled(context, firstSkipped, steps, completed, mode);
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private StepResult runStep(SilverLoadStep<?, ?> step, BatchContext context, String schema) {
        MDC.put(MDC_STEP, step.getName());
        try {
            return step.execute(context, silverWriter, schema);
        } finally {
            MDC.remove(MDC_STEP);
        }
    }

    private void publish(BatchContext context, List<SilverLoadStep<?, ?>> steps) {
        if (context.isCancelled()) {
            StepDiagnostic diagnostic = StepDiagnostic.cancelled(PUBLISH_STEP,
                    "Silver unchanged: the batch was cancelled before publish");
            log.warn("[SILVER] runId={} cancelled before publish", context.getRunId());
            throw new BatchCancelledException(diagnostic);
        }
        List<SilverTable> tables = steps.stream().map(SilverLoadStep::getTable).collect(Collectors.toList());
        MDC.put(MDC_STEP, PUBLISH_STEP);
        try {
            silverWriter.publish(tables);
        } catch (RuntimeException e) {
            StepDiagnostic diagnostic = StepDiagnostic.of(PUBLISH_STEP, StepPhase.PUBLISH, e,
                    "Publish rolled back: Silver keeps the contents of the previous run");
            log.error("[SILVER] runId={} publish FAILED: {}", context.getRunId(), diagnostic.getMessage(), e);
            throw new SilverLoadException(diagnostic, e);
        } finally {
            MDC.remove(MDC_STEP);
        }
    }

    /* ==================================================================== */
    /* Diagnostics                                                           */
    /* ==================================================================== */

    // the target is only truncated in the WRITE phase
    private static Set<String> truncatedBy(List<StepFailedException> failures) {
        Set<String> emptied = new LinkedHashSet<>();
        for (StepFailedException failure : failures) {
            if (failure.getPhase() == StepPhase.WRITE) {
                emptied.add(failure.getStep());
            }
        }
        return emptied;
    }

    private SilverLoadException failed(BatchContext context, StepFailedException failure,
                                       List<SilverLoadStep<?, ?>> steps, Set<String> completed,
                                       Set<String> emptied, WriteMode mode) {
        String warning = outcomeWarning(steps, completed, emptied, mode);
        StepDiagnostic diagnostic = StepDiagnostic.of(failure.getStep(), failure.getPhase(), failure.getCause(), warning);
        log.error("[SILVER] runId={} FAILED at step {} [{}] kind={} sqlState={} code={}: {}",
                context.getRunId(), diagnostic.getStep(), diagnostic.getPhase(), diagnostic.getKind(),
                diagnostic.getSqlState(), diagnostic.getVendorCode(), diagnostic.getMessage(), failure.getCause());
        log.warn("[SILVER] runId={} {}", context.getRunId(), warning);
        return new SilverLoadException(diagnostic, failure.getCause());
    }

    private BatchCancelledException cancelled(BatchContext context, String nextStep,
                                              List<SilverLoadStep<?, ?>> steps, Set<String> completed, WriteMode mode) {
        String warning = outcomeWarning(steps, completed, Set.of(), mode);
        log.warn("[SILVER] runId={} cancelled before step {}. {}", context.getRunId(), nextStep, warning);
        return new BatchCancelledException(StepDiagnostic.cancelled(nextStep, warning));
    }

    static String outcomeWarning(List<SilverLoadStep<?, ?>> steps, Set<String> completed,
                                 Set<String> emptied, WriteMode mode) {
        if (mode == WriteMode.STAGED_SWAP) {
            return "Silver unchanged: nothing was published from this run";
        }
        List<String> untouched = steps.stream()
                .map(SilverLoadStep::getName)
                .filter(name -> !completed.contains(name) && !emptied.contains(name))
                .collect(Collectors.toList());
        return "Silver is not consistent across tables. Reloaded: " + completed
                + ". Empty or partially loaded: " + emptied
                + ". Still holding the previous run: " + untouched + ".";
    }
}
