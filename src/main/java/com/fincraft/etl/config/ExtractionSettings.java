package com.fincraft.etl.config;

import com.fincraft.etl.model.Tier;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Extraction knobs resolved for one table. Each knob reads {@code extract.<table>.<knob>} first,
 * then the global key. The request budget is not here: it belongs to the API key and is shared by
 * every table, see {@code AlphaVantageClient}.
 */
public final class ExtractionSettings {
    public final String tableName;
    public final int failureCeiling;
    /** Null keeps the lag built into the table descriptor. */
    public final Integer reportingLagDays;
    public final int batchSize;
    public final int workers;
    public final Duration fetchTimeout;
    public final int progressLogEvery;
    public final double coreThreshold;
    public final double extendedThreshold;
    public final double neutralScore;
    public final double coverageFloor;
    public final Map<Tier, Duration> stalenessByTier;
    public final Duration defaultStaleness;

    private ExtractionSettings(
            String tableName,
            int failureCeiling,
            Integer reportingLagDays,
            int batchSize,
            int workers,
            Duration fetchTimeout,
            int progressLogEvery,
            double coreThreshold,
            double extendedThreshold,
            double neutralScore,
            double coverageFloor,
            Map<Tier, Duration> stalenessByTier,
            Duration defaultStaleness
    ) {
        this.tableName = tableName;
        this.failureCeiling = failureCeiling;
        this.reportingLagDays = reportingLagDays;
        this.batchSize = batchSize;
        this.workers = workers;
        this.fetchTimeout = fetchTimeout;
        this.progressLogEvery = progressLogEvery;
        this.coreThreshold = coreThreshold;
        this.extendedThreshold = extendedThreshold;
        this.neutralScore = neutralScore;
        this.coverageFloor = coverageFloor;
        this.stalenessByTier = Map.copyOf(stalenessByTier);
        this.defaultStaleness = defaultStaleness;
    }

    public static ExtractionSettings forTable(Config config, String tableName) {
        String table = tableName == null ? "" : tableName.trim().toLowerCase(Locale.ROOT);
        Lookup lookup = new Lookup(config, table);

        Map<Tier, Duration> staleness = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            staleness.put(tier, Duration.ofHours(Math.max(1, lookup.intValue("extract.staleness_hours." + tier.label(), 24))));
        }

        double core = clamp01(lookup.doubleValue("tier.core_threshold", 0.70));
        double extended = Math.min(core, clamp01(lookup.doubleValue("tier.extended_threshold", 0.40)));

        return new ExtractionSettings(
                table,
                Math.max(1, lookup.intValue("extract.max_failures", 3)),
                lookup.optionalInt("extract.reporting_lag_days"),
                Math.max(1, lookup.intValue("extract.batch_size", 50)),
                Math.max(1, lookup.intValue("fetch.concurrent", 4)),
                Duration.ofSeconds(Math.max(1, lookup.intValue("fetch.timeout_sec", 30))),
                Math.max(0, lookup.intValue("extract.progress.log_every", 25)),
                core,
                extended,
                clamp01(lookup.doubleValue("tier.neutral_score", 0.50)),
                clamp01(lookup.doubleValue("tier.coverage_floor", 0.20)),
                staleness,
                Duration.ofHours(Math.max(1, lookup.intValue("extract.staleness_hours.default", 24)))
        );
    }

    public Duration stalenessFor(Tier tier) {
        if (tier == null) {
            return defaultStaleness;
        }
        return stalenessByTier.getOrDefault(tier, defaultStaleness);
    }

    private static double clamp01(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static final class Lookup {
        private final Config config;
        private final String table;

        private Lookup(Config config, String table) {
            this.config = config;
            this.table = table;
        }

        private String key(String globalKey) {
            if (table.isEmpty()) {
                return globalKey;
            }
            int dot = globalKey.indexOf('.');
            String scoped = "extract." + table + "." + globalKey.substring(dot + 1);
            return config.has(scoped) ? scoped : globalKey;
        }

        int intValue(String globalKey, int fallback) {
            return config.getInt(key(globalKey), fallback);
        }

        double doubleValue(String globalKey, double fallback) {
            return config.getDouble(key(globalKey), fallback);
        }

        Integer optionalInt(String globalKey) {
            String resolved = key(globalKey);
            if (!config.has(resolved)) {
                return null;
            }
            int value = config.getInt(resolved, -1);
            return value < 0 ? null : value;
        }
    }
}
