package com.record.linkage.blocking;

import com.record.linkage.blocking.predicate.JoinPredicate;
import com.record.linkage.blocking.predicate.Predicates;

import java.util.List;

/**
 * A pass's blocking tuple resolved to concrete, side-qualified column names.
 * {@code columnsA.get(i)} is compared with {@code columnsB.get(i)}.
 */
public record BlockingKey(List<String> columnsA, List<String> columnsB) {

    public BlockingKey {
        columnsA = List.copyOf(columnsA);
        columnsB = List.copyOf(columnsB);
        if (columnsA.isEmpty()) {
            throw new IllegalArgumentException("Blocking key must have at least one column");
        }
        if (columnsA.size() != columnsB.size()) {
            throw new IllegalArgumentException("Blocking key sides differ in arity: " + columnsA + " vs " + columnsB);
        }
    }

    /**
     * Returns the equality predicate of this key; blank values never satisfy it.
     */
    public JoinPredicate predicate() {
        return Predicates.blockingEquality(columnsA, columnsB);
    }
}
