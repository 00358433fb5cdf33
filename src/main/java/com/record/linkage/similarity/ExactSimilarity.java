package com.record.linkage.similarity;

/**
 * 1.0 for equal non-null values, 0.0 otherwise.
 */
public class ExactSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String left, String right) {
        return left != null && left.equals(right) ? 1.0 : 0.0;
    }

    @Override
    public String getName() {
        return "exact";
    }
}
