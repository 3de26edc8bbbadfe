package com.fincraft.etl.runner;

import com.fincraft.etl.model.ErrorClass;
import com.fincraft.etl.model.FetchOutcome;
import com.fincraft.etl.pipeline.EntityResult;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Outcome of one scheduling pass: per-entity results plus the counts reported to the operator.
 */
public final class PassReport {
    public final String runId;
    public final String tableName;
    public final PassStatus status;
    public final int dueCount;
    public final int scheduled;
    public final boolean degraded;
    public final List<EntityResult> results;
    public final String summary;
    private final Map<FetchOutcome, Integer> counts;
    private final Map<ErrorClass, Integer> errorCounts;

    public PassReport(
            String runId,
            String tableName,
            PassStatus status,
            int dueCount,
            int scheduled,
            boolean degraded,
            List<EntityResult> results,
            String summary
    ) {
        this.runId = runId;
        this.tableName = tableName;
        this.status = status;
        this.dueCount = dueCount;
        this.scheduled = scheduled;
        this.degraded = degraded;
        this.results = List.copyOf(results);
        this.summary = summary == null ? "" : summary;
        this.counts = new EnumMap<>(FetchOutcome.class);
        for (FetchOutcome outcome : FetchOutcome.values()) {
            counts.put(outcome, 0);
        }
        this.errorCounts = new EnumMap<>(ErrorClass.class);
        for (EntityResult r : this.results) {
            counts.merge(r.outcome, 1, Integer::sum);
            ErrorClass errorClass = r.errorClass();
            if (errorClass != null) {
                errorCounts.merge(errorClass, 1, Integer::sum);
            }
        }
    }

    public int count(FetchOutcome outcome) {
        return counts.getOrDefault(outcome, 0);
    }

    public int count(ErrorClass errorClass) {
        return errorCounts.getOrDefault(errorClass, 0);
    }

    /** Entities that reached the upstream in this pass. */
    public int processed() {
        return results.size() - count(FetchOutcome.SKIPPED);
    }

    public int failed() {
        return count(FetchOutcome.ERROR) + count(FetchOutcome.SUSPENDED);
    }

    public boolean allFailed() {
        return processed() > 0 && failed() == processed();
    }

    public String countsLine() {
        StringBuilder sb = new StringBuilder();
        for (FetchOutcome outcome : FetchOutcome.values()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(outcome.label()).append('=').append(count(outcome));
        }
        return sb.toString();
    }

    public String errorClassLine() {
        StringBuilder sb = new StringBuilder();
        for (ErrorClass errorClass : ErrorClass.values()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(errorClass.name().toLowerCase(Locale.ROOT)).append('=').append(count(errorClass));
        }
        return sb.toString();
    }
}
