package com.fincraft.etl.watermark;

import com.fincraft.etl.catalog.EntityCatalog;
import com.fincraft.etl.config.ExtractionSettings;
import com.fincraft.etl.model.CatalogEntity;
import com.fincraft.etl.model.FailureReason;
import com.fincraft.etl.model.Tier;
import com.fincraft.etl.model.Watermark;
import com.fincraft.etl.store.BusinessRecordRepository;
import com.fincraft.etl.store.WatermarkRepository;
import com.fincraft.etl.table.ReportingLagRule;
import com.fincraft.etl.table.TableDescriptor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Per-(entity, table) progress tracking: which entities are due, and the success/failure transitions.
 */
public final class WatermarkStore {
    private static final Logger LOG = LogManager.getLogger(WatermarkStore.class);

    /** Never-processed first, then oldest success, then entity id. */
    public static final Comparator<DueEntity> DUE_ORDER = Comparator
            .comparing((DueEntity d) -> d.neverProcessed() ? 0 : 1)
            .thenComparing(DueEntity::lastSuccessTime, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(DueEntity::entityId);

    private final EntityCatalog catalog;
    private final WatermarkRepository watermarks;
    private final BusinessRecordRepository records;

    public WatermarkStore(EntityCatalog catalog, WatermarkRepository watermarks, BusinessRecordRepository records) {
        this.catalog = catalog;
        this.watermarks = watermarks;
        this.records = records;
    }

    /**
     * Entities of {@code descriptor} that should be fetched on {@code asOf}.
     * Suspended entities and entities already holding the expected reporting period are excluded.
     */
    public List<DueEntity> getDue(
            TableDescriptor descriptor,
            ExtractionSettings settings,
            Instant asOf,
            StalenessPolicy staleness,
            Function<String, Tier> tierOf
    ) throws SQLException {
        String table = descriptor.getTableName();
        List<CatalogEntity> entities = catalog.trackable(descriptor);
        Map<String, Watermark> byEntity = watermarks.findAll(table);
        Map<String, LocalDate> stored = records.latestPeriods(table);
        ReportingLagRule lagRule = descriptor.lagRule(settings.reportingLagDays);
        LocalDate asOfDate = asOf.atZone(ZoneOffset.UTC).toLocalDate();

        int suspended = 0;
        int current = 0;
        int fresh = 0;
        List<DueEntity> due = new ArrayList<>();
        for (CatalogEntity entity : entities) {
            Watermark wm = byEntity.get(entity.entityId);
            Tier tier = tierOf == null ? null : tierOf.apply(entity.entityId);
            LocalDate latest = Watermark.laterOf(wm == null ? null : wm.lastPeriodCovered, stored.get(entity.entityId));
            if (wm != null && wm.isSuspended(settings.failureCeiling)) {
                suspended++;
                continue;
            }
            if (wm == null || wm.neverSucceeded()) {
                due.add(new DueEntity(entity, wm, tier, latest));
                continue;
            }
            if (lagRule.coversExpected(latest, asOfDate)) {
                current++;
                continue;
            }
            Duration threshold = staleness.thresholdFor(tier);
            if (!wm.lastSuccessTime.plus(threshold).isAfter(asOf)) {
                due.add(new DueEntity(entity, wm, tier, latest));
            } else {
                fresh++;
            }
        }
        due.sort(DUE_ORDER);
        LOG.debug("get_due table={} tracked={} due={} suspended={} current_period={} fresh={}",
                table, entities.size(), due.size(), suspended, current, fresh);
        return due;
    }

    public Optional<Watermark> find(String table, String entityId) throws SQLException {
        return watermarks.find(table, entityId);
    }

    public void recordSuccess(String table, String entityId, LocalDate period, String fingerprint, Instant at) throws SQLException {
        requireId(entityId);
        watermarks.markSuccess(table, entityId, period, fingerprint, at);
    }

    /**
     * Upstream answered without business data. Clears the failure streak, keeps the covered period.
     */
    public void recordEmpty(String table, String entityId, Instant at) throws SQLException {
        requireId(entityId);
        watermarks.markEmpty(table, entityId, at);
    }

    /**
     * @return the failure streak after this failure
     */
    public int recordFailure(String table, String entityId, FailureReason reason, Instant at) throws SQLException {
        requireId(entityId);
        return watermarks.markFailure(table, entityId, reason, at);
    }

    /**
     * Operator action that lifts the suspension of one entity, or of the whole table when {@code entityId} is null.
     */
    public int resetFailures(String table, String entityId, Instant at) throws SQLException {
        int count = watermarks.resetFailures(table, entityId, at);
        LOG.info("reset failures table={} entity={} rows={}", table, entityId == null ? "*" : entityId, count);
        return count;
    }

    public List<Watermark> listSuspended(String table, int failureCeiling) throws SQLException {
        return watermarks.listAtOrAboveFailures(table, failureCeiling);
    }

    private void requireId(String entityId) {
        if (entityId == null || entityId.trim().isEmpty()) {
            throw new IllegalArgumentException("entity_id must not be empty");
        }
    }
}
