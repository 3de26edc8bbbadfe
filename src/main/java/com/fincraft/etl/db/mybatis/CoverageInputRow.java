package com.fincraft.etl.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoverageInputRow {
    private String entityId;
    private int tablesWithData;
    private LocalDate latestPeriod;
    private int recordCount;
}
