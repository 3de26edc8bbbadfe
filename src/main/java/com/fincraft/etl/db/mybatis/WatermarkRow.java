package com.fincraft.etl.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WatermarkRow {
    private String tableName;
    private String entityId;
    private LocalDate lastPeriodCovered;
    private OffsetDateTime lastSuccessTime;
    private String lastFingerprint;
    private String lastStatus;
    private int consecutiveFailures;
    private String lastFailureReason;
    private OffsetDateTime lastFailureTime;
    private OffsetDateTime updatedAt;
}
