package com.record.linkage.blocking;

import com.record.linkage.core.model.MatchType;
import com.record.linkage.core.model.RecordSet;

import java.util.Objects;

/**
 * Explicit state of one matching run: the record sets, the candidate backend and
 * the running exclusion state.
 *
 * <p>The exclusion state only moves forward, one version per committed pass, and
 * is never rolled back.</p>
 */
public class MatchContext {

    private final String runId;
    private final MatchType matchType;
    private final RecordSet recordsA;
    private final RecordSet recordsB;
    private final CandidateBackend backend;
    private ExclusionState exclusion = ExclusionState.initial();

    /**
     * @param recordsB side B; ignored (side A is used) when {@code matchType} is dedup
     */
    public MatchContext(String runId, MatchType matchType, RecordSet recordsA, RecordSet recordsB,
                        CandidateBackend backend) {
        this.runId = Objects.requireNonNull(runId, "runId is required");
        this.matchType = Objects.requireNonNull(matchType, "matchType is required");
        this.recordsA = Objects.requireNonNull(recordsA, "recordsA is required");
        if (!matchType.isDedup()) {
            Objects.requireNonNull(recordsB, "recordsB is required unless deduplicating");
        }
        this.recordsB = matchType.isDedup() ? recordsA : recordsB;
        this.backend = Objects.requireNonNull(backend, "backend is required");
    }

    public String getRunId() {
        return runId;
    }

    public MatchType getMatchType() {
        return matchType;
    }

    public boolean isDedup() {
        return matchType.isDedup();
    }

    public RecordSet getRecordsA() {
        return recordsA;
    }

    public RecordSet getRecordsB() {
        return recordsB;
    }

    public CandidateBackend getBackend() {
        return backend;
    }

    /**
     * Name of this match, {@code <nameA>_<nameB>} or {@code <nameA>_dedup}.
     */
    public String matchName() {
        return recordsA.getName() + "_" + (isDedup() ? "dedup" : recordsB.getName());
    }

    public PassResolution resolve(PassDefinition pass) {
        return PassResolution.resolve(pass, recordsA.getFieldMap(), recordsB.getFieldMap());
    }

    public String candidateSetName(PassDefinition pass) {
        return pass.candidateSetName(matchName());
    }

    public ExclusionState getExclusion() {
        return exclusion;
    }

    /**
     * Commits the exclusion state produced by a successful generation.
     *
     * @throws IllegalStateException if {@code next} is not the direct successor of the current state
     */
    public void commitExclusion(ExclusionState next) {
        Objects.requireNonNull(next, "next is required");
        if (next.version() != exclusion.version() + 1) {
            throw new IllegalStateException("Exclusion state version " + next.version() +
                    " does not follow committed version " + exclusion.version());
        }
        exclusion = next;
    }
}
