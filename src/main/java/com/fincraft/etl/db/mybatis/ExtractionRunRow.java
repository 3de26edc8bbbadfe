package com.fincraft.etl.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionRunRow {
    private String runId;
    private String tableName;
    private OffsetDateTime startedAt;
    private OffsetDateTime finishedAt;
    private String status;
    private int scheduledCount;
    private int insertedCount;
    private int updatedCount;
    private int unchangedCount;
    private int emptyCount;
    private int errorCount;
    private int suspendedCount;
    private String notes;
}
