package com.record.linkage.api;

import com.record.linkage.core.model.CandidateChunk;
import com.record.linkage.core.model.RecordSet;
import com.record.linkage.core.model.ScoredPair;

import java.util.List;

/**
 * Scores the pairs of a candidate chunk.
 *
 * <p>Implementations are called concurrently from worker threads and must not keep
 * mutable state between calls. Record sets are shared and read-only.</p>
 */
@FunctionalInterface
public interface PairComparer {

    /**
     * Scores every pair of the chunk.
     *
     * @param chunk    candidate pairs of one pass
     * @param recordsA side A records, addressed by {@code ordinalA}
     * @param recordsB side B records, addressed by {@code ordinalB} (side A when deduplicating)
     * @return one scored pair per input pair, in chunk order
     */
    List<ScoredPair> compare(CandidateChunk chunk, RecordSet recordsA, RecordSet recordsB);
}
