package com.fincraft.etl.scheduler;

import java.util.List;

public final class ScheduleResult {
    public final String tableName;
    public final List<ScheduledEntity> entities;
    public final int dueCount;
    /** True when coverage signals were unavailable and the order is staleness-only. */
    public final boolean degraded;

    public ScheduleResult(String tableName, List<ScheduledEntity> entities, int dueCount, boolean degraded) {
        this.tableName = tableName;
        this.entities = List.copyOf(entities);
        this.dueCount = dueCount;
        this.degraded = degraded;
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }

    public int size() {
        return entities.size();
    }
}
