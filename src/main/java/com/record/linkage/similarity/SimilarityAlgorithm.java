package com.record.linkage.similarity;

/**
 * String similarity used to score one comparer variable.
 * Scores range from 0.0 (nothing in common) to 1.0 (identical).
 */
public interface SimilarityAlgorithm {

    /**
     * Scores two field values. Either value may be null.
     */
    double compute(String left, String right);

    /**
     * Short name used in configuration, e.g. {@code jaro_winkler}.
     */
    String getName();
}
