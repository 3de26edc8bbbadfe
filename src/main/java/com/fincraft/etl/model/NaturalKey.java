package com.fincraft.etl.model;

import java.time.LocalDate;

/**
 * Business uniqueness of a stored record within one table.
 */
public record NaturalKey(String entityId, LocalDate period, String reportType) implements Comparable<NaturalKey> {

    public void requireWellFormed() {
        if (entityId == null || entityId.trim().isEmpty()) {
            throw new IllegalArgumentException("natural key requires entity_id");
        }
        if (period == null) {
            throw new IllegalArgumentException("natural key requires period for entity_id=" + entityId);
        }
        if (reportType == null || reportType.trim().isEmpty()) {
            throw new IllegalArgumentException("natural key requires report_type for entity_id=" + entityId);
        }
    }

    @Override
    public int compareTo(NaturalKey other) {
        int cmp = entityId.compareTo(other.entityId);
        if (cmp != 0) {
            return cmp;
        }
        cmp = period.compareTo(other.period);
        if (cmp != 0) {
            return cmp;
        }
        return reportType.compareTo(other.reportType);
    }

    @Override
    public String toString() {
        return entityId + "/" + period + "/" + reportType;
    }
}
