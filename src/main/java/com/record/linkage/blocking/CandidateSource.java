package com.record.linkage.blocking;

import com.record.linkage.core.model.CandidatePair;

import java.util.List;

/**
 * Streams a materialized candidate set in bounded chunks. Closing it discards the set.
 */
public interface CandidateSource extends AutoCloseable {

    /**
     * Returns the next chunk in stream order, or an empty list once exhausted.
     */
    List<CandidatePair> nextChunk();

    @Override
    void close();
}
