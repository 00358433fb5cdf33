package com.record.linkage.blocking.predicate;

import com.record.linkage.core.model.SourceRecord;

import java.util.Objects;

public record Negation(JoinPredicate term) implements JoinPredicate {

    public Negation {
        Objects.requireNonNull(term, "term is required");
    }

    @Override
    public boolean test(SourceRecord a, SourceRecord b) {
        return !term.test(a, b);
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitNegation(this);
    }
}
