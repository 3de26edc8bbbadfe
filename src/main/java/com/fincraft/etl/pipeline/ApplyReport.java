package com.fincraft.etl.pipeline;

import com.fincraft.etl.model.FetchOutcome;

import java.time.LocalDate;

/**
 * What one entity's batch of records did to the business table.
 */
public final class ApplyReport {
    public final int inserted;
    public final int updated;
    public final int unchanged;
    public final LocalDate maxPeriod;

    public ApplyReport(int inserted, int updated, int unchanged, LocalDate maxPeriod) {
        this.inserted = inserted;
        this.updated = updated;
        this.unchanged = unchanged;
        this.maxPeriod = maxPeriod;
    }

    /**
     * Entity-level outcome: inserted wins over updated, updated over unchanged.
     */
    public FetchOutcome outcome() {
        if (inserted > 0) {
            return FetchOutcome.INSERTED;
        }
        if (updated > 0) {
            return FetchOutcome.UPDATED;
        }
        return FetchOutcome.UNCHANGED;
    }

    public int written() {
        return inserted + updated;
    }
}
