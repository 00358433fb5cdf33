package com.record.linkage.blocking.predicate;

import com.record.linkage.relational.SqlIdentifiers;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders a {@link JoinPredicate} as a SQL boolean expression over two table aliases.
 *
 * <p>Only identifiers are written into the SQL text, and each one is validated and
 * quoted through {@link SqlIdentifiers}. Every column equality also checks both sides
 * for {@code IS NOT NULL}, which keeps the rendered expression two-valued: a
 * negated prior pass never evaluates to {@code NULL} and silently drops a row.</p>
 */
public class SqlPredicateRenderer implements PredicateVisitor<String> {

    private final String aliasA;
    private final String aliasB;
    private final String identifierColumnA;
    private final String identifierColumnB;
    private final String ordinalColumn;

    public SqlPredicateRenderer(String aliasA, String aliasB,
                                String identifierColumnA, String identifierColumnB,
                                String ordinalColumn) {
        this.aliasA = SqlIdentifiers.requireValid(aliasA);
        this.aliasB = SqlIdentifiers.requireValid(aliasB);
        this.identifierColumnA = Objects.requireNonNull(identifierColumnA, "identifierColumnA is required");
        this.identifierColumnB = Objects.requireNonNull(identifierColumnB, "identifierColumnB is required");
        this.ordinalColumn = Objects.requireNonNull(ordinalColumn, "ordinalColumn is required");
    }

    public String render(JoinPredicate predicate) {
        return predicate.accept(this);
    }

    @Override
    public String visitColumnEquality(ColumnEquality node) {
        String left = column(aliasA, node.columnA());
        String right = column(aliasB, node.columnB());
        return "(" + left + " = " + right
                + " AND " + left + " <> ''"
                + " AND " + left + " IS NOT NULL"
                + " AND " + right + " IS NOT NULL)";
    }

    @Override
    public String visitConjunction(Conjunction node) {
        if (node.terms().isEmpty()) {
            return "(1 = 1)";
        }
        if (node.terms().size() == 1) {
            return node.terms().get(0).accept(this);
        }
        return node.terms().stream()
                .map(term -> term.accept(this))
                .collect(Collectors.joining(" AND ", "(", ")"));
    }

    @Override
    public String visitDisjunction(Disjunction node) {
        if (node.terms().isEmpty()) {
            return "(1 = 0)";
        }
        if (node.terms().size() == 1) {
            return node.terms().get(0).accept(this);
        }
        return node.terms().stream()
                .map(term -> term.accept(this))
                .collect(Collectors.joining(" OR ", "(", ")"));
    }

    @Override
    public String visitNegation(Negation node) {
        return "NOT (" + node.term().accept(this) + ")";
    }

    @Override
    public String visitOrdinalOrder(OrdinalOrder node) {
        return column(aliasA, ordinalColumn) + " < " + column(aliasB, ordinalColumn);
    }

    @Override
    public String visitIdentifierInequality(IdentifierInequality node) {
        return column(aliasA, identifierColumnA) + " <> " + column(aliasB, identifierColumnB);
    }

    private String column(String alias, String column) {
        return alias + "." + SqlIdentifiers.quote(column);
    }
}
