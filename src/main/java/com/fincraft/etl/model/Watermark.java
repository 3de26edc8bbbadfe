package com.fincraft.etl.model;

import java.time.Instant;
import java.time.LocalDate;

/**
 * 模块说明：Watermark（class）。
 * 主要职责：记录单个 (entity, table) 的抽取进度、最近成功时间与连续失败次数。
 * 使用建议：状态迁移统一走 with* 方法，持久层的 SQL 必须与这里的语义保持一致。
 */
public final class Watermark {
    public final String tableName;
    public final String entityId;
    public final LocalDate lastPeriodCovered;
    public final Instant lastSuccessTime;
    public final String lastFingerprint;
    public final FetchStatus lastStatus;
    public final int consecutiveFailures;
    public final String lastFailureReason;
    public final Instant lastFailureTime;
    public final Instant updatedAt;

    public Watermark(
            String tableName,
            String entityId,
            LocalDate lastPeriodCovered,
            Instant lastSuccessTime,
            String lastFingerprint,
            FetchStatus lastStatus,
            int consecutiveFailures,
            String lastFailureReason,
            Instant lastFailureTime,
            Instant updatedAt
    ) {
        if (consecutiveFailures < 0) {
            throw new IllegalArgumentException("consecutive_failures must not be negative");
        }
        this.tableName = tableName;
        this.entityId = entityId;
        this.lastPeriodCovered = lastPeriodCovered;
        this.lastSuccessTime = lastSuccessTime;
        this.lastFingerprint = lastFingerprint;
        this.lastStatus = lastStatus;
        this.consecutiveFailures = consecutiveFailures;
        this.lastFailureReason = lastFailureReason;
        this.lastFailureTime = lastFailureTime;
        this.updatedAt = updatedAt;
    }

    public static Watermark initial(String tableName, String entityId, Instant at) {
        return new Watermark(tableName, entityId, null, null, null, null, 0, null, null, at);
    }

    /**
     * Success keeps the covered period monotonic and clears the failure streak.
     * A null fingerprint keeps the previously stored one.
     */
    public Watermark withSuccess(LocalDate period, String fingerprint, Instant at) {
        return new Watermark(
                tableName,
                entityId,
                laterOf(lastPeriodCovered, period),
                at,
                fingerprint == null ? lastFingerprint : fingerprint,
                FetchStatus.SUCCESS,
                0,
                lastFailureReason,
                lastFailureTime,
                at
        );
    }

    public Watermark withEmpty(Instant at) {
        return new Watermark(
                tableName,
                entityId,
                lastPeriodCovered,
                at,
                lastFingerprint,
                FetchStatus.EMPTY,
                0,
                lastFailureReason,
                lastFailureTime,
                at
        );
    }

    public Watermark withFailure(FailureReason reason, Instant at) {
        return new Watermark(
                tableName,
                entityId,
                lastPeriodCovered,
                lastSuccessTime,
                lastFingerprint,
                FetchStatus.ERROR,
                consecutiveFailures + 1,
                reason == null ? FailureReason.OTHER.label() : reason.label(),
                at,
                at
        );
    }

    public Watermark withReset(Instant at) {
        return new Watermark(
                tableName,
                entityId,
                lastPeriodCovered,
                lastSuccessTime,
                lastFingerprint,
                lastStatus,
                0,
                lastFailureReason,
                lastFailureTime,
                at
        );
    }

    public boolean isSuspended(int failureCeiling) {
        return failureCeiling > 0 && consecutiveFailures >= failureCeiling;
    }

    public boolean neverSucceeded() {
        return lastSuccessTime == null;
    }

    public static LocalDate laterOf(LocalDate a, LocalDate b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }
}
