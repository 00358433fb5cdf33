package com.record.linkage.similarity;

import com.record.linkage.core.model.StrictnessTier;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Minimum mean score per strictness tier. Thresholds must not increase from
 * strict to review, so a pair in a stricter tier is always in the looser ones.
 */
public final class TierThresholds {

    private final Map<StrictnessTier, Double> minimums;

    private TierThresholds(Map<StrictnessTier, Double> minimums) {
        this.minimums = minimums;
    }

    /**
     * strict 0.95, moderate 0.90, relaxed 0.85, review 0.75.
     */
    public static TierThresholds defaults() {
        return of(0.95, 0.90, 0.85, 0.75);
    }

    public static TierThresholds of(double strict, double moderate, double relaxed, double review) {
        double[] values = {strict, moderate, relaxed, review};
        for (int i = 0; i < values.length; i++) {
            if (values[i] < 0.0 || values[i] > 1.0) {
                throw new IllegalArgumentException("Thresholds must be between 0.0 and 1.0");
            }
            if (i > 0 && values[i] > values[i - 1]) {
                throw new IllegalArgumentException("Thresholds must not increase from strict to review");
            }
        }
        Map<StrictnessTier, Double> minimums = new EnumMap<>(StrictnessTier.class);
        minimums.put(StrictnessTier.STRICT, strict);
        minimums.put(StrictnessTier.MODERATE, moderate);
        minimums.put(StrictnessTier.RELAXED, relaxed);
        minimums.put(StrictnessTier.REVIEW, review);
        return new TierThresholds(minimums);
    }

    public double minimum(StrictnessTier tier) {
        return minimums.get(tier);
    }

    public Set<StrictnessTier> tiersFor(double score) {
        Set<StrictnessTier> tiers = EnumSet.noneOf(StrictnessTier.class);
        minimums.forEach((tier, minimum) -> {
            if (score >= minimum) {
                tiers.add(tier);
            }
        });
        return tiers;
    }
}
