package com.fincraft.etl.runner;

import com.fincraft.core.PassTelemetry;
import com.fincraft.etl.config.ExtractionSettings;
import com.fincraft.etl.model.FailureReason;
import com.fincraft.etl.model.FetchOutcome;
import com.fincraft.etl.model.RunRow;
import com.fincraft.etl.pipeline.EntityProcessor;
import com.fincraft.etl.pipeline.EntityResult;
import com.fincraft.etl.pipeline.PassContext;
import com.fincraft.etl.scheduler.PriorityScheduler;
import com.fincraft.etl.scheduler.ScheduleResult;
import com.fincraft.etl.scheduler.ScheduledEntity;
import com.fincraft.etl.store.RunRepository;
import com.fincraft.etl.table.TableDescriptor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 模块说明：ExtractionRunner（class）。
 * 主要职责：执行一次调度批次：登记 run、排程、以 K 个 worker 并发处理实体、汇总结果。
 * 使用建议：单实体失败只计数，不中断批次；存储层异常视为基础设施故障，批次标记 FAILED 后抛出。
 */
public final class ExtractionRunner {
    private static final Logger LOG = LogManager.getLogger(ExtractionRunner.class);

    private final PriorityScheduler scheduler;
    private final EntityProcessor processor;
    private final RunRepository runs;
    private final Clock clock;
    private final AtomicBoolean abortRequested = new AtomicBoolean(false);

    public ExtractionRunner(PriorityScheduler scheduler, EntityProcessor processor, RunRepository runs, Clock clock) {
        this.scheduler = scheduler;
        this.processor = processor;
        this.runs = runs;
        this.clock = clock;
    }

    /**
     * Stops the running pass between entities. Entities already in flight finish normally. A request
     * made before a pass starts skips that whole pass; the flag clears once the pass ends.
     */
    public void abort() {
        if (abortRequested.compareAndSet(false, true)) {
            LOG.warn("abort requested; remaining entities will be skipped");
        }
    }

    public boolean isAbortRequested() {
        return abortRequested.get();
    }

    public PassReport run(TableDescriptor descriptor, ExtractionSettings settings) throws SQLException, InterruptedException {
        return run(descriptor, settings, settings.batchSize, null);
    }

    public PassReport run(TableDescriptor descriptor, ExtractionSettings settings, int batchSize, Instant asOfOverride)
            throws SQLException, InterruptedException {
        try {
            return runPass(descriptor, settings, batchSize, asOfOverride);
        } finally {
            abortRequested.set(false);
        }
    }

    private PassReport runPass(TableDescriptor descriptor, ExtractionSettings settings, int batchSize, Instant asOfOverride)
            throws SQLException, InterruptedException {
        String table = descriptor.getTableName();
        String runId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        Instant asOf = asOfOverride == null ? startedAt : asOfOverride;
        PassTelemetry telemetry = new PassTelemetry(runId, table, startedAt);

        runs.startRun(runId, table, startedAt, "batch_size=" + batchSize + " as_of=" + asOf);
        LOG.info("pass start run_id={} table={} batch_size={} workers={} as_of={}",
                runId, table, batchSize, settings.workers, asOf);

        ScheduleResult schedule;
        long scheduleStarted = System.nanoTime();
        try {
            schedule = scheduler.schedule(descriptor, settings, batchSize, asOf);
        } catch (SQLException | RuntimeException e) {
            failRun(runId, table, startedAt, 0, "schedule_failed: " + e.getMessage(), e);
            throw e;
        }
        telemetry.recordStep(PassTelemetry.STEP_SCHEDULE, (System.nanoTime() - scheduleStarted) / 1_000_000L,
                schedule.size(), 0);
        telemetry.setScheduled(schedule.size(), schedule.degraded);

        List<EntityResult> results;
        try {
            results = processAll(runId, descriptor, settings, telemetry, schedule.entities);
        } catch (SQLException e) {
            failRun(runId, table, startedAt, schedule.size(), "store_failure: " + e.getMessage(), e);
            throw e;
        } catch (InterruptedException e) {
            finishQuietly(new RunRow(runId, table, startedAt, clock.instant(), PassStatus.ABORTED.name(),
                    schedule.size(), 0, 0, 0, 0, 0, 0, "interrupted"));
            throw e;
        }

        PassStatus status = resolveStatus(results);
        Instant finishedAt = clock.instant();
        telemetry.finish(finishedAt);
        PassReport report = new PassReport(runId, table, status, schedule.dueCount, schedule.size(),
                schedule.degraded, results, telemetry.getSummary());
        runs.finishRun(new RunRow(
                runId,
                table,
                startedAt,
                finishedAt,
                status.name(),
                schedule.size(),
                report.count(FetchOutcome.INSERTED),
                report.count(FetchOutcome.UPDATED),
                report.count(FetchOutcome.UNCHANGED),
                report.count(FetchOutcome.EMPTY),
                report.count(FetchOutcome.ERROR),
                report.count(FetchOutcome.SUSPENDED),
                schedule.degraded ? "order=staleness_only" : ""
        ));
        LOG.info("pass done run_id={} table={} status={} {} errors[{}]",
                runId, table, status, report.countsLine(), report.errorClassLine());
        return report;
    }

    private List<EntityResult> processAll(
            String runId,
            TableDescriptor descriptor,
            ExtractionSettings settings,
            PassTelemetry telemetry,
            List<ScheduledEntity> entities
    ) throws SQLException, InterruptedException {
        int total = entities.size();
        List<EntityResult> results = new ArrayList<>(total);
        if (total == 0) {
            return results;
        }
        int threads = Math.max(1, Math.min(settings.workers, total));
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        ExecutorService fetchPool = Executors.newFixedThreadPool(threads);
        PassContext ctx = new PassContext(runId, descriptor, settings, fetchPool, telemetry);
        CompletionService<EntityResult> completion = new ExecutorCompletionService<>(pool);
        Map<Future<EntityResult>, String> submitted = new HashMap<>();
        long startedNanos = System.nanoTime();
        try {
            for (ScheduledEntity entity : entities) {
                Future<EntityResult> future = completion.submit(() -> {
                    if (abortRequested.get()) {
                        return EntityResult.skipped(entity.entityId());
                    }
                    return processor.process(ctx, entity);
                });
                submitted.put(future, entity.entityId());
            }
            for (int i = 0; i < total; i++) {
                Future<EntityResult> future = completion.take();
                EntityResult result;
                try {
                    result = future.get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof SQLException) {
                        abortRequested.set(true);
                        throw (SQLException) cause;
                    }
                    String entityId = submitted.get(future);
                    if (cause instanceof InterruptedException) {
                        result = EntityResult.skipped(entityId);
                    } else {
                        LOG.error("entity task crashed table={} entity={}", ctx.tableName(), entityId, cause);
                        result = EntityResult.failed(entityId, FailureReason.OTHER,
                                cause == null ? "unknown" : String.valueOf(cause.getMessage()), false);
                    }
                }
                results.add(result);
                telemetry.recordOutcome(result.outcome);

                int completed = i + 1;
                if (shouldLogProgress(completed, total, settings.progressLogEvery)) {
                    LOG.info(String.format(
                            Locale.US,
                            "progress table=%s %d/%d elapsed=%.1fs failed=%d",
                            ctx.tableName(),
                            completed,
                            total,
                            (System.nanoTime() - startedNanos) / 1_000_000_000.0,
                            countFailures(results)
                    ));
                }
            }
        } finally {
            pool.shutdownNow();
            fetchPool.shutdownNow();
        }
        return results;
    }

    private PassStatus resolveStatus(List<EntityResult> results) {
        boolean skipped = false;
        boolean failed = false;
        for (EntityResult r : results) {
            if (r.outcome == FetchOutcome.SKIPPED) {
                skipped = true;
            } else if (r.outcome.isFailure()) {
                failed = true;
            }
        }
        if (skipped) {
            return PassStatus.ABORTED;
        }
        return failed ? PassStatus.PARTIAL : PassStatus.SUCCESS;
    }

    private void failRun(String runId, String table, Instant startedAt, int scheduled, String note, Exception cause) {
        LOG.error("pass failed run_id={} table={} {}", runId, table, note, cause);
        finishQuietly(new RunRow(runId, table, startedAt, clock.instant(), PassStatus.FAILED.name(),
                scheduled, 0, 0, 0, 0, 0, 0, note));
    }

    private void finishQuietly(RunRow row) {
        try {
            runs.finishRun(row);
        } catch (SQLException e) {
            LOG.warn("could not close run_id={} status={}: {}", row.runId, row.status, e.getMessage());
        }
    }

    private static int countFailures(List<EntityResult> results) {
        int n = 0;
        for (EntityResult r : results) {
            if (r.outcome.isFailure()) {
                n++;
            }
        }
        return n;
    }

    private static boolean shouldLogProgress(int completed, int total, int logEvery) {
        if (completed >= total) {
            return true;
        }
        if (logEvery <= 0) {
            return false;
        }
        return completed % logEvery == 0;
    }
}
