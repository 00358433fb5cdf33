package com.record.linkage.blocking.predicate;

/**
 * Visitor over the predicate node types.
 */
public interface PredicateVisitor<R> {

    R visitColumnEquality(ColumnEquality node);

    R visitConjunction(Conjunction node);

    R visitDisjunction(Disjunction node);

    R visitNegation(Negation node);

    R visitOrdinalOrder(OrdinalOrder node);

    R visitIdentifierInequality(IdentifierInequality node);
}
