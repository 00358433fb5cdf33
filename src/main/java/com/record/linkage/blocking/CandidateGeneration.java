package com.record.linkage.blocking;

/**
 * Result of generating one pass's candidates.
 *
 * @param candidateSetName name of the materialized candidate set
 * @param rowCount         number of candidate pairs materialized
 * @param nextExclusion    exclusion state to commit once generation succeeded
 */
public record CandidateGeneration(String candidateSetName, long rowCount, ExclusionState nextExclusion) {
}
