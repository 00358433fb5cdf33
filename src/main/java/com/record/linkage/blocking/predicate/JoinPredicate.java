package com.record.linkage.blocking.predicate;

import com.record.linkage.core.model.SourceRecord;

/**
 * Node of a structured join predicate between a side-A record and a side-B record.
 *
 * <p>Predicates are built once per pass and rendered per backend: the relational
 * backend renders them to SQL with {@link SqlPredicateRenderer}, the in-memory
 * backend evaluates them directly with {@link #test(SourceRecord, SourceRecord)}.
 * Both renderings must agree on every pair.</p>
 */
public interface JoinPredicate {

    /**
     * Evaluates this predicate for a pair of records.
     *
     * @param a record from side A
     * @param b record from side B
     * @return true if the pair satisfies the predicate
     */
    boolean test(SourceRecord a, SourceRecord b);

    <R> R accept(PredicateVisitor<R> visitor);
}
