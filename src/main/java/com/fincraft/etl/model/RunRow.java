package com.fincraft.etl.model;

import java.time.Instant;

/**
 * 模块说明：RunRow（class）。
 * 主要职责：承载一次调度批次（extraction pass）的落库摘要。
 */
public final class RunRow {
    public final String runId;
    public final String tableName;
    public final Instant startedAt;
    public final Instant finishedAt;
    public final String status;
    public final int scheduledCount;
    public final int insertedCount;
    public final int updatedCount;
    public final int unchangedCount;
    public final int emptyCount;
    public final int errorCount;
    public final int suspendedCount;
    public final String notes;

    public RunRow(
            String runId,
            String tableName,
            Instant startedAt,
            Instant finishedAt,
            String status,
            int scheduledCount,
            int insertedCount,
            int updatedCount,
            int unchangedCount,
            int emptyCount,
            int errorCount,
            int suspendedCount,
            String notes
    ) {
        this.runId = runId;
        this.tableName = tableName;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.status = status;
        this.scheduledCount = scheduledCount;
        this.insertedCount = insertedCount;
        this.updatedCount = updatedCount;
        this.unchangedCount = unchangedCount;
        this.emptyCount = emptyCount;
        this.errorCount = errorCount;
        this.suspendedCount = suspendedCount;
        this.notes = notes;
    }
}
