package com.fincraft.etl.pipeline;

import com.fincraft.etl.model.ErrorClass;
import com.fincraft.etl.model.FailureReason;
import com.fincraft.etl.model.FetchOutcome;

import java.time.LocalDate;

public final class EntityResult {
    public final String entityId;
    public final FetchOutcome outcome;
    public final FailureReason failureReason;
    public final String message;
    public final int recordsWritten;
    public final LocalDate period;

    private EntityResult(
            String entityId,
            FetchOutcome outcome,
            FailureReason failureReason,
            String message,
            int recordsWritten,
            LocalDate period
    ) {
        this.entityId = entityId;
        this.outcome = outcome;
        this.failureReason = failureReason == null ? FailureReason.NONE : failureReason;
        this.message = message == null ? "" : message;
        this.recordsWritten = Math.max(0, recordsWritten);
        this.period = period;
    }

    /** Operator-facing class of this result, or null for a clean or skipped entity. */
    public ErrorClass errorClass() {
        switch (outcome) {
            case EMPTY:
                return ErrorClass.EMPTY_UPSTREAM;
            case SUSPENDED:
                return ErrorClass.CIRCUIT_OPEN;
            case ERROR:
                return failureReason.errorClass();
            default:
                return null;
        }
    }

    public static EntityResult applied(String entityId, ApplyReport report) {
        return new EntityResult(entityId, report.outcome(), FailureReason.NONE, "", report.written(), report.maxPeriod);
    }

    public static EntityResult unchanged(String entityId, LocalDate period) {
        return new EntityResult(entityId, FetchOutcome.UNCHANGED, FailureReason.NONE, "", 0, period);
    }

    public static EntityResult empty(String entityId) {
        return new EntityResult(entityId, FetchOutcome.EMPTY, FailureReason.NONE, "", 0, null);
    }

    public static EntityResult failed(String entityId, FailureReason reason, String message, boolean suspended) {
        return new EntityResult(entityId, suspended ? FetchOutcome.SUSPENDED : FetchOutcome.ERROR, reason, message, 0, null);
    }

    public static EntityResult skipped(String entityId) {
        return new EntityResult(entityId, FetchOutcome.SKIPPED, FailureReason.NONE, "pass aborted", 0, null);
    }
}
