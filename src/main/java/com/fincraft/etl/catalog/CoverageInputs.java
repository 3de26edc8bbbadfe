package com.fincraft.etl.catalog;

import java.time.LocalDate;

/**
 * Snapshot of what is already stored for one entity, used to derive its coverage score.
 */
public record CoverageInputs(String entityId, int tablesWithData, int tablesTracked, LocalDate latestPeriod, int recordCount) {
}
