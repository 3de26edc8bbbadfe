package com.fincraft.etl.transform;

import com.fincraft.etl.model.BusinessRecord;

import java.time.LocalDate;
import java.util.List;

public final class TransformResult {
    public final List<BusinessRecord> records;
    public final int duplicatesDropped;

    private TransformResult(List<BusinessRecord> records, int duplicatesDropped) {
        this.records = records == null ? List.of() : List.copyOf(records);
        this.duplicatesDropped = Math.max(0, duplicatesDropped);
    }

    public static TransformResult empty() {
        return new TransformResult(List.of(), 0);
    }

    public static TransformResult of(List<BusinessRecord> records, int duplicatesDropped) {
        return new TransformResult(records, duplicatesDropped);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public LocalDate maxPeriod() {
        LocalDate max = null;
        for (BusinessRecord record : records) {
            if (record.period != null && (max == null || record.period.isAfter(max))) {
                max = record.period;
            }
        }
        return max;
    }
}
