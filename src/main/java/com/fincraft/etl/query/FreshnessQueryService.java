package com.fincraft.etl.query;

import com.fincraft.etl.model.EntityFreshness;
import com.fincraft.etl.model.EntityState;
import com.fincraft.etl.model.Watermark;
import com.fincraft.etl.store.BusinessRecordRepository;
import com.fincraft.etl.store.WatermarkRepository;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.ToIntFunction;

/**
 * Read-only view over watermarks and stored records for downstream consumers.
 */
public final class FreshnessQueryService {
    private final WatermarkRepository watermarks;
    private final BusinessRecordRepository records;
    private final Clock clock;

    public FreshnessQueryService(WatermarkRepository watermarks, BusinessRecordRepository records, Clock clock) {
        this.watermarks = watermarks;
        this.records = records;
        this.clock = clock;
    }

    public EntityFreshness freshness(String table, String entityId, int failureCeiling) throws SQLException {
        Watermark wm = watermarks.find(table, entityId).orElse(null);
        LocalDate stored = records.latestPeriods(table).get(entityId);
        return toFreshness(table, entityId, wm, stored, failureCeiling, clock.instant());
    }

    /**
     * Every entity with a watermark in {@code table}, stalest first.
     */
    public List<EntityFreshness> freshness(String table, int failureCeiling) throws SQLException {
        Map<String, Watermark> all = watermarks.findAll(table);
        Map<String, LocalDate> stored = records.latestPeriods(table);
        Instant now = clock.instant();
        List<EntityFreshness> out = new ArrayList<>(all.size());
        for (Map.Entry<String, Watermark> e : all.entrySet()) {
            out.add(toFreshness(table, e.getKey(), e.getValue(), stored.get(e.getKey()), failureCeiling, now));
        }
        out.sort(Comparator
                .comparing((EntityFreshness f) -> f.lastSuccessTime, Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparing(f -> f.entityId));
        return out;
    }

    public Optional<LocalDate> latestPeriod(String table, String entityId, String reportType) throws SQLException {
        return records.latestPeriod(table, entityId, reportType);
    }

    public SuspensionReport suspended(List<String> tables, ToIntFunction<String> failureCeilingOf) throws SQLException {
        List<Watermark> entries = new ArrayList<>();
        for (String table : tables) {
            entries.addAll(watermarks.listAtOrAboveFailures(table, failureCeilingOf.applyAsInt(table)));
        }
        entries.sort(Comparator.comparing((Watermark w) -> w.tableName).thenComparing(w -> w.entityId));
        return new SuspensionReport(entries);
    }

    private static EntityFreshness toFreshness(
            String table,
            String entityId,
            Watermark wm,
            LocalDate stored,
            int failureCeiling,
            Instant now
    ) {
        if (wm == null) {
            return new EntityFreshness(table, entityId, EntityState.NEVER_FETCHED, null, stored, null, 0, null, null);
        }
        Long ageHours = wm.lastSuccessTime == null ? null : Math.max(0L, Duration.between(wm.lastSuccessTime, now).toHours());
        return new EntityFreshness(
                table,
                entityId,
                EntityState.of(wm, failureCeiling),
                wm.lastPeriodCovered,
                stored,
                wm.lastSuccessTime,
                wm.consecutiveFailures,
                wm.lastFailureReason,
                ageHours
        );
    }
}
