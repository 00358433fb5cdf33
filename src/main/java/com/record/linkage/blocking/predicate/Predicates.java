package com.record.linkage.blocking.predicate;

import java.util.ArrayList;
import java.util.List;

/**
 * Factory methods for building join predicates.
 */
public final class Predicates {

    private Predicates() {
        // utility class
    }

    /**
     * Builds the conjunction of column equalities for a blocking tuple.
     * Column lists are positional: {@code columnsA[i]} is compared with {@code columnsB[i]}.
     */
    public static JoinPredicate blockingEquality(List<String> columnsA, List<String> columnsB) {
        if (columnsA.size() != columnsB.size()) {
            throw new IllegalArgumentException("Blocking tuples must have the same arity: "
                    + columnsA + " vs " + columnsB);
        }
        List<JoinPredicate> terms = new ArrayList<>(columnsA.size());
        for (int i = 0; i < columnsA.size(); i++) {
            terms.add(new ColumnEquality(columnsA.get(i), columnsB.get(i)));
        }
        return new Conjunction(terms);
    }

    public static JoinPredicate and(JoinPredicate... terms) {
        return new Conjunction(List.of(terms));
    }

    public static JoinPredicate or(List<JoinPredicate> terms) {
        return new Disjunction(terms);
    }

    public static JoinPredicate not(JoinPredicate term) {
        return new Negation(term);
    }

    /**
     * Self-join restriction used in dedup mode: {@code a.idx < b.idx AND a.id <> b.id}.
     */
    public static JoinPredicate dedupRestriction() {
        return and(new OrdinalOrder(), new IdentifierInequality());
    }
}
