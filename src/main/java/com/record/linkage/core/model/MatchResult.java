package com.record.linkage.core.model;

import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A scored candidate pair with its owning pass and priority weight.
 * Immutable once produced by the weighting stage.
 */
public record MatchResult(
        CandidatePair pair,
        String passName,
        Map<String, Double> scores,
        Set<StrictnessTier> tiers,
        double weight
) {
    public MatchResult {
        Objects.requireNonNull(pair, "pair is required");
        Objects.requireNonNull(passName, "passName is required");
        if (!Double.isFinite(weight) || weight < 0.0) {
            throw new IllegalArgumentException("weight must be finite and >= 0, got " + weight);
        }
        scores = scores != null ? Map.copyOf(scores) : Map.of();
        tiers = ScoredPair.immutableTiers(tiers);
    }

    /**
     * Attaches pass and weight to a comparer result.
     */
    public static MatchResult of(ScoredPair scored, String passName, double weight) {
        return new MatchResult(scored.pair(), passName, scored.scores(), scored.tiers(), weight);
    }

    /**
     * Creates a result for a pair that shares a ground-truth identifier.
     * Such pairs are not scored and count as a match in every tier.
     */
    public static MatchResult groundTruth(CandidatePair pair, String passName, double weight) {
        return new MatchResult(pair, passName, Map.of(), EnumSet.allOf(StrictnessTier.class), weight);
    }

    public boolean isMatch(StrictnessTier tier) {
        return tiers.contains(tier);
    }
}
