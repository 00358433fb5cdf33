package com.record.linkage.blocking.predicate;

import com.record.linkage.core.model.SourceRecord;

/**
 * Requires the two records to carry different identifiers.
 */
public record IdentifierInequality() implements JoinPredicate {

    @Override
    public boolean test(SourceRecord a, SourceRecord b) {
        return !a.identifier().equals(b.identifier());
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitIdentifierInequality(this);
    }
}
