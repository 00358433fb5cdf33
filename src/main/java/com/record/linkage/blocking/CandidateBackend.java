package com.record.linkage.blocking;

import java.util.Optional;

/**
 * Generates a pass's candidate pairs and streams them back.
 *
 * <p>Implementations must be interchangeable: for identical record sets and pass plan
 * they produce the same multiset of {@code (identifier_a, identifier_b)} pairs.
 * Backends are driven by the coordinator thread only.</p>
 */
public interface CandidateBackend extends AutoCloseable {

    /**
     * Materializes the candidate set for one pass, replacing any set of the same name.
     *
     * @param request the pass, its key, the committed exclusion state and dedup flag
     * @return row count and the exclusion state to commit
     * @throws CandidateGenerationException if the backing store fails
     */
    CandidateGeneration generateCandidates(CandidateRequest request);

    /**
     * Opens a materialized candidate set for streaming.
     *
     * @param candidateSetName name returned by {@link #generateCandidates(CandidateRequest)}
     * @param chunkSize        maximum pairs per chunk
     * @return the source, or empty if no such candidate set exists
     */
    Optional<CandidateSource> openCandidates(String candidateSetName, int chunkSize);

    /**
     * Short backend name used in logs.
     */
    String getName();

    @Override
    default void close() {
    }
}
