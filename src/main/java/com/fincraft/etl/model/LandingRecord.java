package com.fincraft.etl.model;

import java.time.Instant;

/**
 * Append-only audit row for one fetch attempt.
 */
public final class LandingRecord {
    public final long id;
    public final String tableName;
    public final String entityId;
    public final String runId;
    public final FetchStatus status;
    public final String contentFingerprint;
    public final String failureReason;
    public final String message;
    public final String payload;
    public final Instant fetchedAt;

    public LandingRecord(
            long id,
            String tableName,
            String entityId,
            String runId,
            FetchStatus status,
            String contentFingerprint,
            String failureReason,
            String message,
            String payload,
            Instant fetchedAt
    ) {
        this.id = id;
        this.tableName = tableName;
        this.entityId = entityId;
        this.runId = runId;
        this.status = status;
        this.contentFingerprint = contentFingerprint;
        this.failureReason = failureReason;
        this.message = message;
        this.payload = payload;
        this.fetchedAt = fetchedAt;
    }

    public static LandingRecord success(String table, String entityId, String runId, String fingerprint, String payload, Instant at) {
        return new LandingRecord(0L, table, entityId, runId, FetchStatus.SUCCESS, fingerprint, null, null, payload, at);
    }

    public static LandingRecord empty(String table, String entityId, String runId, String payload, Instant at) {
        return new LandingRecord(0L, table, entityId, runId, FetchStatus.EMPTY, null, null, null, payload, at);
    }

    public static LandingRecord error(
            String table,
            String entityId,
            String runId,
            FailureReason reason,
            String message,
            String payload,
            Instant at
    ) {
        String label = reason == null ? FailureReason.OTHER.label() : reason.label();
        return new LandingRecord(0L, table, entityId, runId, FetchStatus.ERROR, null, label, message, payload, at);
    }
}
