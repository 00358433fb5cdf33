package com.record.linkage.dispatch;

import com.record.linkage.core.model.ScoredPair;

import java.util.List;
import java.util.Objects;

/**
 * Comparer output for one candidate chunk.
 */
public record ScoredChunk(String passName, int sequence, List<ScoredPair> pairs) {

    public ScoredChunk {
        Objects.requireNonNull(passName, "passName is required");
        pairs = pairs != null ? List.copyOf(pairs) : List.of();
    }
}
