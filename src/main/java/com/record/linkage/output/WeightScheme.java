package com.record.linkage.output;

/**
 * Assigns a priority weight to the results of a pass.
 * Ground-truth passes must weigh more than any numbered pass, and an earlier
 * numbered pass more than a later one.
 */
public interface WeightScheme {

    /**
     * @throws IllegalArgumentException if the pass is not part of the plan
     */
    double weightFor(String passName);
}
