package com.fincraft.etl.scheduler;

import com.fincraft.etl.model.Tier;
import com.fincraft.etl.watermark.DueEntity;

/**
 * One slot of a scheduling pass.
 */
public final class ScheduledEntity {
    public final DueEntity due;
    public final Tier tier;
    /** Null when no coverage signal was available. */
    public final Double coverageScore;
    public final boolean belowFloor;

    public ScheduledEntity(DueEntity due, Tier tier, Double coverageScore, boolean belowFloor) {
        this.due = due;
        this.tier = tier;
        this.coverageScore = coverageScore;
        this.belowFloor = belowFloor;
    }

    public String entityId() {
        return due.entityId();
    }
}
