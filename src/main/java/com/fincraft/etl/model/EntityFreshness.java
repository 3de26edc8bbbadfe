package com.fincraft.etl.model;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Read-side view of one entity's progress in one table.
 */
public final class EntityFreshness {
    public final String tableName;
    public final String entityId;
    public final EntityState state;
    public final LocalDate lastPeriodCovered;
    public final LocalDate latestStoredPeriod;
    public final Instant lastSuccessTime;
    public final int consecutiveFailures;
    public final String lastFailureReason;
    public final Long ageHours;

    public EntityFreshness(
            String tableName,
            String entityId,
            EntityState state,
            LocalDate lastPeriodCovered,
            LocalDate latestStoredPeriod,
            Instant lastSuccessTime,
            int consecutiveFailures,
            String lastFailureReason,
            Long ageHours
    ) {
        this.tableName = tableName;
        this.entityId = entityId;
        this.state = state;
        this.lastPeriodCovered = lastPeriodCovered;
        this.latestStoredPeriod = latestStoredPeriod;
        this.lastSuccessTime = lastSuccessTime;
        this.consecutiveFailures = consecutiveFailures;
        this.lastFailureReason = lastFailureReason;
        this.ageHours = ageHours;
    }
}
