package com.record.linkage.blocking;

import com.record.linkage.core.model.CandidateChunk;

/**
 * Receives candidate chunks from the orchestrator, in stream order within a pass.
 */
@FunctionalInterface
public interface ChunkSink {

    void accept(CandidateChunk chunk);
}
