package com.record.linkage.blocking;

import com.record.linkage.blocking.predicate.Conjunction;
import com.record.linkage.blocking.predicate.JoinPredicate;
import com.record.linkage.blocking.predicate.Predicates;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Everything a backend needs to generate one pass's candidates.
 *
 * @param pass             the pass being generated
 * @param key              its resolved blocking key
 * @param exclusion        exclusion state as committed before this pass (read-only)
 * @param dedup            whether side B is side A
 * @param candidateSetName name of the pass-scoped candidate set to materialize
 */
public record CandidateRequest(
        PassDefinition pass,
        BlockingKey key,
        ExclusionState exclusion,
        boolean dedup,
        String candidateSetName
) {
    public CandidateRequest {
        Objects.requireNonNull(pass, "pass is required");
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(exclusion, "exclusion is required");
        Objects.requireNonNull(candidateSetName, "candidateSetName is required");
    }

    /**
     * The full join predicate of the pass:
     * {@code key AND NOT (prior keys) [AND a.idx < b.idx AND a.id <> b.id]}.
     */
    public JoinPredicate joinPredicate() {
        List<JoinPredicate> terms = new ArrayList<>(3);
        terms.add(key.predicate());
        if (!exclusion.isEmpty()) {
            terms.add(Predicates.not(exclusion.asPredicate()));
        }
        if (dedup) {
            terms.add(Predicates.dedupRestriction());
        }
        return new Conjunction(terms);
    }
}
