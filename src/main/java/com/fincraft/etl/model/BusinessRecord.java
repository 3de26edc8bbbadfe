package com.fincraft.etl.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Transformed row stored once per natural key. Field values are BigDecimal, String or null.
 */
public final class BusinessRecord {
    public final String entityId;
    public final LocalDate period;
    public final String reportType;
    public final Map<String, Object> fields;
    public final String fingerprint;
    public final String sourceRunId;
    public final Instant fetchedAt;

    public BusinessRecord(
            String entityId,
            LocalDate period,
            String reportType,
            Map<String, Object> fields,
            String fingerprint,
            String sourceRunId,
            Instant fetchedAt
    ) {
        this.entityId = entityId;
        this.period = period;
        this.reportType = reportType;
        this.fields = fields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.fingerprint = fingerprint;
        this.sourceRunId = sourceRunId;
        this.fetchedAt = fetchedAt;
    }

    public NaturalKey naturalKey() {
        return new NaturalKey(entityId, period, reportType);
    }

    public BusinessRecord withFingerprint(String value) {
        return new BusinessRecord(entityId, period, reportType, fields, value, sourceRunId, fetchedAt);
    }
}
