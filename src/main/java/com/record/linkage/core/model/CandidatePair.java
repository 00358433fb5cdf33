package com.record.linkage.core.model;

import java.util.Objects;

/**
 * A pair selected by blocking for similarity scoring. Each pair is produced by exactly one pass.
 */
public record CandidatePair(String identifierA, String identifierB, long ordinalA, long ordinalB) {

    public CandidatePair {
        Objects.requireNonNull(identifierA, "identifierA is required");
        Objects.requireNonNull(identifierB, "identifierB is required");
    }

    public static CandidatePair of(SourceRecord a, SourceRecord b) {
        return new CandidatePair(a.identifier(), b.identifier(), a.ordinal(), b.ordinal());
    }
}
