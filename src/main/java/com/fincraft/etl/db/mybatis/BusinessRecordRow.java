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
public class BusinessRecordRow {
    private String tableName;
    private String entityId;
    private LocalDate period;
    private String reportType;
    private String fieldsJson;
    private String contentFingerprint;
    private String sourceRunId;
    private OffsetDateTime fetchedAt;
}
