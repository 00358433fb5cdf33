package com.record.linkage.blocking.predicate;

import com.record.linkage.core.model.SourceRecord;

/**
 * Requires {@code ordinal_a < ordinal_b}. Used in dedup mode to drop self-pairs
 * and keep only one of each mirrored pair.
 */
public record OrdinalOrder() implements JoinPredicate {

    @Override
    public boolean test(SourceRecord a, SourceRecord b) {
        return a.ordinal() < b.ordinal();
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitOrdinalOrder(this);
    }
}
