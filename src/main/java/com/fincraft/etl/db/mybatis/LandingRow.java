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
public class LandingRow {
    private Long id;
    private String tableName;
    private String entityId;
    private String runId;
    private String status;
    private String contentFingerprint;
    private String failureReason;
    private String message;
    private String payload;
    private OffsetDateTime fetchedAt;
}
