package com.record.linkage.blocking.predicate;

import com.record.linkage.core.model.SourceRecord;

import java.util.Objects;

/**
 * Equality of a side-A column and a side-B column, where both values must also be
 * non-null and non-empty. Blank values never match, so records missing a blocking
 * value cannot collapse into one giant block.
 */
public record ColumnEquality(String columnA, String columnB) implements JoinPredicate {

    public ColumnEquality {
        Objects.requireNonNull(columnA, "columnA is required");
        Objects.requireNonNull(columnB, "columnB is required");
    }

    @Override
    public boolean test(SourceRecord a, SourceRecord b) {
        if (a.isEmpty(columnA) || b.isEmpty(columnB)) {
            return false;
        }
        return a.value(columnA).equals(b.value(columnB));
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitColumnEquality(this);
    }
}
