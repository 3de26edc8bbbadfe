package com.fincraft.etl.scheduler;

import com.fincraft.etl.catalog.TierClassifier;
import com.fincraft.etl.config.ExtractionSettings;
import com.fincraft.etl.model.Tier;
import com.fincraft.etl.store.CoverageSignalProvider;
import com.fincraft.etl.table.TableDescriptor;
import com.fincraft.etl.watermark.DueEntity;
import com.fincraft.etl.watermark.StalenessPolicy;
import com.fincraft.etl.watermark.WatermarkStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 模块说明：PriorityScheduler（class）。
 * 主要职责：合并层级、陈旧度与覆盖度下限三个信号，产出确定性的批次顺序。
 * 使用建议：覆盖度信号不可用时退化为纯陈旧度排序，不阻塞抽取。
 */
public final class PriorityScheduler {
    private static final Logger LOG = LogManager.getLogger(PriorityScheduler.class);

    static final Comparator<ScheduledEntity> PRIORITY_ORDER = Comparator
            .comparing((ScheduledEntity s) -> s.belowFloor ? 1 : 0)
            .thenComparingInt(s -> s.tier.rank())
            .thenComparing(s -> s.due.lastSuccessTime(), Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(ScheduledEntity::entityId);

    static final Comparator<ScheduledEntity> STALENESS_ORDER = Comparator
            .comparing((ScheduledEntity s) -> s.due.lastSuccessTime(), Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(ScheduledEntity::entityId);

    private final WatermarkStore watermarkStore;
    private final CoverageSignalProvider coverage;

    public PriorityScheduler(WatermarkStore watermarkStore, CoverageSignalProvider coverage) {
        this.watermarkStore = watermarkStore;
        this.coverage = coverage;
    }

    public ScheduleResult schedule(TableDescriptor descriptor, ExtractionSettings settings, int batchSize, Instant asOf)
            throws SQLException {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batch_size must be positive: " + batchSize);
        }
        String table = descriptor.getTableName();
        Map<String, Double> scores = loadScores(table, asOf);
        boolean degraded = scores == null;

        TierClassifier classifier = TierClassifier.from(settings);
        StalenessPolicy staleness = degraded
                ? StalenessPolicy.uniform(settings.defaultStaleness)
                : StalenessPolicy.tiered(settings);
        Function<String, Tier> tierOf = degraded
                ? id -> classifier.classify(null)
                : id -> classifier.classify(scores.get(id));

        List<DueEntity> due = watermarkStore.getDue(descriptor, settings, asOf, staleness, tierOf);
        List<ScheduledEntity> candidates = new ArrayList<>(due.size());
        for (DueEntity d : due) {
            Double score = degraded ? null : scores.get(d.entityId());
            boolean belowFloor = score != null && score < settings.coverageFloor;
            candidates.add(new ScheduledEntity(d, d.tier == null ? classifier.classify(score) : d.tier, score, belowFloor));
        }
        candidates.sort(degraded ? STALENESS_ORDER : PRIORITY_ORDER);

        List<ScheduledEntity> batch = candidates.size() > batchSize
                ? new ArrayList<>(candidates.subList(0, batchSize))
                : candidates;
        LOG.info("schedule table={} due={} batch={} degraded={}", table, due.size(), batch.size(), degraded);
        return new ScheduleResult(table, batch, due.size(), degraded);
    }

    /**
     * @return null when the coverage signal cannot be read
     */
    private Map<String, Double> loadScores(String table, Instant asOf) {
        if (coverage == null) {
            return null;
        }
        LocalDate asOfDate = asOf.atZone(ZoneOffset.UTC).toLocalDate();
        try {
            return coverage.coverageScores(table, asOfDate);
        } catch (SQLException | RuntimeException e) {
            LOG.warn("coverage signal unavailable for table={}, falling back to staleness-only order: {}",
                    table, e.getMessage());
            return null;
        }
    }
}
