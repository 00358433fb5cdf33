package com.record.linkage.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A bounded slice of one pass's candidate stream, tagged with the pass that produced it.
 *
 * @param passName owning pass
 * @param sequence position of the chunk within its pass, starting at 0
 * @param pairs    candidate pairs in stream order
 */
public record CandidateChunk(String passName, int sequence, List<CandidatePair> pairs) {

    public CandidateChunk {
        Objects.requireNonNull(passName, "passName is required");
        pairs = List.copyOf(pairs);
    }

    public int size() {
        return pairs.size();
    }
}
