package com.fincraft.etl.watermark;

import com.fincraft.etl.config.ExtractionSettings;
import com.fincraft.etl.model.Tier;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * How long a successful fetch stays current, per tier.
 */
public final class StalenessPolicy {
    private final Map<Tier, Duration> byTier;
    private final Duration fallback;

    private StalenessPolicy(Map<Tier, Duration> byTier, Duration fallback) {
        if (fallback == null || fallback.isNegative()) {
            throw new IllegalArgumentException("staleness threshold must be a non-negative duration");
        }
        this.byTier = byTier;
        this.fallback = fallback;
    }

    public static StalenessPolicy uniform(Duration threshold) {
        return new StalenessPolicy(new EnumMap<>(Tier.class), threshold);
    }

    public static StalenessPolicy tiered(Map<Tier, Duration> thresholds, Duration fallback) {
        Map<Tier, Duration> copy = new EnumMap<>(Tier.class);
        if (thresholds != null) {
            copy.putAll(thresholds);
        }
        return new StalenessPolicy(copy, fallback);
    }

    public static StalenessPolicy tiered(ExtractionSettings settings) {
        return tiered(settings.stalenessByTier, settings.defaultStaleness);
    }

    public Duration thresholdFor(Tier tier) {
        if (tier == null) {
            return fallback;
        }
        return byTier.getOrDefault(tier, fallback);
    }
}
