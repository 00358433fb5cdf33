package com.record.linkage.blocking.predicate;

import com.record.linkage.core.model.SourceRecord;

import java.util.List;

/**
 * Logical OR of its terms. An empty disjunction is always false.
 */
public record Disjunction(List<JoinPredicate> terms) implements JoinPredicate {

    public Disjunction {
        terms = List.copyOf(terms);
    }

    @Override
    public boolean test(SourceRecord a, SourceRecord b) {
        for (JoinPredicate term : terms) {
            if (term.test(a, b)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitDisjunction(this);
    }
}
