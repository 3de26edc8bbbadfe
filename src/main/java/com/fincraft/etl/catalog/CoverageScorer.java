package com.fincraft.etl.catalog;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Composite coverage score in [0,1]: 0.5 breadth across tables, 0.3 recency, 0.2 depth.
 */
public final class CoverageScorer {
    private static final double WEIGHT_BREADTH = 0.5;
    private static final double WEIGHT_RECENCY = 0.3;
    private static final double WEIGHT_DEPTH = 0.2;
    private static final long FRESH_DAYS = 120L;
    private static final long STALE_DAYS = 730L;
    private static final int FULL_DEPTH_RECORDS = 40;

    public double score(CoverageInputs inputs, LocalDate asOf) {
        if (inputs == null) {
            return 0.0;
        }
        double breadth = inputs.tablesTracked() <= 0
                ? 0.0
                : Math.min(1.0, (double) Math.max(0, inputs.tablesWithData()) / inputs.tablesTracked());
        double recency = recency(inputs.latestPeriod(), asOf);
        double depth = Math.min(1.0, (double) Math.max(0, inputs.recordCount()) / FULL_DEPTH_RECORDS);
        double score = WEIGHT_BREADTH * breadth + WEIGHT_RECENCY * recency + WEIGHT_DEPTH * depth;
        return Math.max(0.0, Math.min(1.0, score));
    }

    private double recency(LocalDate latest, LocalDate asOf) {
        if (latest == null || asOf == null) {
            return 0.0;
        }
        long age = Math.max(0L, ChronoUnit.DAYS.between(latest, asOf));
        if (age <= FRESH_DAYS) {
            return 1.0;
        }
        if (age >= STALE_DAYS) {
            return 0.0;
        }
        return 1.0 - (double) (age - FRESH_DAYS) / (STALE_DAYS - FRESH_DAYS);
    }
}
