package com.fincraft.etl.catalog;

import com.fincraft.etl.config.ExtractionSettings;
import com.fincraft.etl.model.Tier;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pure score to tier mapping. A missing score uses the neutral value.
 */
public final class TierClassifier {
    private final double coreThreshold;
    private final double extendedThreshold;
    private final double neutralScore;

    public TierClassifier(double coreThreshold, double extendedThreshold, double neutralScore) {
        if (extendedThreshold > coreThreshold) {
            throw new IllegalArgumentException("extended threshold must not exceed core threshold");
        }
        this.coreThreshold = coreThreshold;
        this.extendedThreshold = extendedThreshold;
        this.neutralScore = neutralScore;
    }

    public static TierClassifier from(ExtractionSettings settings) {
        return new TierClassifier(settings.coreThreshold, settings.extendedThreshold, settings.neutralScore);
    }

    public Tier classify(Double score) {
        double value = effectiveScore(score);
        if (value >= coreThreshold) {
            return Tier.CORE;
        }
        if (value >= extendedThreshold) {
            return Tier.EXTENDED;
        }
        return Tier.LONG_TAIL;
    }

    public double effectiveScore(Double score) {
        if (score == null || !Double.isFinite(score)) {
            return neutralScore;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    public Map<String, Tier> classifyAll(Collection<String> entityIds, Map<String, Double> scores) {
        Map<String, Tier> out = new LinkedHashMap<>();
        for (String id : entityIds) {
            out.put(id, classify(scores == null ? null : scores.get(id)));
        }
        return out;
    }
}
