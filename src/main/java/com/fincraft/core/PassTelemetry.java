package com.fincraft.core;

import com.fincraft.etl.model.FetchOutcome;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Captures a single scheduling pass's outcome counts and per-step timings.
 * Workers report elapsed time directly since steps of different entities overlap.
 */
public final class PassTelemetry {
    public static final String STEP_SCHEDULE = "SCHEDULE";
    public static final String STEP_FETCH = "FETCH";
    public static final String STEP_TRANSFORM = "TRANSFORM";
    public static final String STEP_LANDING = "LANDING";
    public static final String STEP_UPSERT = "UPSERT";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String runId;
    private final String tableName;
    private final Instant startedAt;
    private Instant finishedAt;
    private int scheduled;
    private boolean degraded;

    private final Map<FetchOutcome, Integer> outcomes = new EnumMap<>(FetchOutcome.class);
    private final Map<String, StepStat> steps = new LinkedHashMap<>();

    public PassTelemetry(String runId, String tableName, Instant startedAt) {
        this.runId = runId;
        this.tableName = tableName;
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
        for (FetchOutcome outcome : FetchOutcome.values()) {
            outcomes.put(outcome, 0);
        }
    }

    public synchronized String runId() {
        return runId;
    }

    public synchronized void setScheduled(int count, boolean degradedOrder) {
        this.scheduled = Math.max(0, count);
        this.degraded = degradedOrder;
    }

    public synchronized void recordOutcome(FetchOutcome outcome) {
        if (outcome == null) {
            return;
        }
        outcomes.merge(outcome, 1, Integer::sum);
    }

    public synchronized int count(FetchOutcome outcome) {
        return outcomes.getOrDefault(outcome, 0);
    }

    public synchronized void recordStep(String name, long elapsedMs, long itemsOut, long errorCount) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        stat.calls++;
        stat.elapsedMs += Math.max(0L, elapsedMs);
        stat.itemsOut += Math.max(0L, itemsOut);
        stat.errorCount += Math.max(0L, errorCount);
    }

    public synchronized void finish(Instant at) {
        if (finishedAt == null) {
            finishedAt = at == null ? Instant.now() : at;
        }
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(stat.name, stat.calls, stat.elapsedMs, stat.itemsOut, stat.errorCount));
        }
        return out;
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("run_id=").append(runId).append('\n');
        sb.append("table=").append(tableName).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis())).append('\n');
        sb.append("scheduled=").append(scheduled);
        if (degraded) {
            sb.append(" order=staleness_only");
        }
        sb.append('\n');
        sb.append("outcomes:");
        for (Map.Entry<FetchOutcome, Integer> e : outcomes.entrySet()) {
            sb.append(' ').append(e.getKey().label()).append('=').append(e.getValue());
        }
        sb.append('\n');
        sb.append("steps:\n");
        for (StepStat stat : steps.values()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s calls=%d elapsed_ms=%d out=%d err=%d",
                    stat.name,
                    stat.calls,
                    stat.elapsedMs,
                    stat.itemsOut,
                    stat.errorCount
            ));
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    private String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private static final class StepStat {
        private final String name;
        private long calls;
        private long elapsedMs;
        private long itemsOut;
        private long errorCount;

        private StepStat(String name) {
            this.name = name;
        }
    }

    public record StepRecord(String name, long calls, long elapsedMs, long itemsOut, long errorCount) {
    }
}
