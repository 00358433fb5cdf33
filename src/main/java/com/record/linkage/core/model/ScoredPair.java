package com.record.linkage.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Comparer output for one candidate pair: per-comparer similarity scores and
 * the strictness tiers the pair satisfies.
 */
public record ScoredPair(CandidatePair pair, Map<String, Double> scores, Set<StrictnessTier> tiers) {

    public ScoredPair {
        Objects.requireNonNull(pair, "pair is required");
        scores = scores != null ? Map.copyOf(scores) : Map.of();
        tiers = immutableTiers(tiers);
    }

    static Set<StrictnessTier> immutableTiers(Set<StrictnessTier> tiers) {
        if (tiers == null || tiers.isEmpty()) {
            return Collections.unmodifiableSet(EnumSet.noneOf(StrictnessTier.class));
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(tiers));
    }
}
