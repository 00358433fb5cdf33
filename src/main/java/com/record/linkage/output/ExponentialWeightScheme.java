package com.record.linkage.output;

import com.record.linkage.blocking.BlockingPlan;
import com.record.linkage.blocking.PassDefinition;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Powers of ten by pass rank. With K numbered passes, ground truth weighs
 * {@code 10^(K+1)} and the numbered pass at 0-based rank r weighs {@code 10^(K-r)}.
 * Plans with more than {@link #MAX_NUMBERED_PASSES} numbered passes are rejected because
 * the ground-truth weight would no longer be a finite double.
 */
public class ExponentialWeightScheme implements WeightScheme {

    /** Largest K for which {@code 10^(K+1)} stays finite. */
    public static final int MAX_NUMBERED_PASSES = 307;

    private final Map<String, Double> weights = new HashMap<>();

    public ExponentialWeightScheme(BlockingPlan plan) {
        List<PassDefinition> numbered = plan.getNumberedPasses();
        int k = numbered.size();
        if (k > MAX_NUMBERED_PASSES) {
            throw new IllegalArgumentException("Plan has " + k + " numbered passes, at most " +
                    MAX_NUMBERED_PASSES + " can be weighted");
        }
        for (PassDefinition pass : plan.getGroundTruthPasses()) {
            weights.put(pass.name(), Math.pow(10, k + 1));
        }
        for (int rank = 0; rank < k; rank++) {
            weights.put(numbered.get(rank).name(), Math.pow(10, k - rank));
        }
    }

    @Override
    public double weightFor(String passName) {
        Double weight = weights.get(passName);
        if (weight == null) {
            throw new IllegalArgumentException("Unknown pass: " + passName);
        }
        return weight;
    }
}
