package com.record.linkage.blocking.predicate;

import com.record.linkage.core.model.SourceRecord;

import java.util.List;

/**
 * Logical AND of its terms. An empty conjunction is always true.
 */
public record Conjunction(List<JoinPredicate> terms) implements JoinPredicate {

    public Conjunction {
        terms = List.copyOf(terms);
    }

    @Override
    public boolean test(SourceRecord a, SourceRecord b) {
        for (JoinPredicate term : terms) {
            if (!term.test(a, b)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitConjunction(this);
    }
}
