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
public class WatermarkUpdateParam {
    private String tableName;
    private String entityId;
    private LocalDate period;
    private String fingerprint;
    private String status;
    private String failureReason;
    private OffsetDateTime at;
}
