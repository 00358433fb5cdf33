package com.record.linkage.blocking.predicate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SqlPredicateRenderer Tests")
class SqlPredicateRendererTest {

    private final SqlPredicateRenderer renderer = new SqlPredicateRenderer("a", "b", "id", "pid", "idx");

    private static final String SSN_EQUALITY =
            "(a.\"ssn\" = b.\"soc_sec\" AND a.\"ssn\" <> '' AND a.\"ssn\" IS NOT NULL AND b.\"soc_sec\" IS NOT NULL)";

    @Test
    @DisplayName("Column equality excludes blank values on both sides")
    void columnEquality() {
        assertEquals(SSN_EQUALITY, renderer.render(new ColumnEquality("ssn", "soc_sec")));
    }

    @Test
    @DisplayName("Single-term blocking tuple renders without extra parentheses")
    void singleTermConjunction() {
        assertEquals(SSN_EQUALITY, renderer.render(Predicates.blockingEquality(List.of("ssn"), List.of("soc_sec"))));
    }

    @Test
    @DisplayName("Multi-column blocking tuple renders as AND")
    void multiColumnTuple() {
        String sql = renderer.render(Predicates.blockingEquality(List.of("fname", "dob"), List.of("first", "dob")));

        assertTrue(sql.startsWith("((a.\"fname\" = b.\"first\""));
        assertTrue(sql.contains(") AND (a.\"dob\" = b.\"dob\""));
    }

    @Test
    @DisplayName("Empty conjunction and disjunction are constants")
    void emptyComposites() {
        assertEquals("(1 = 1)", renderer.render(Predicates.and()));
        assertEquals("(1 = 0)", renderer.render(Predicates.or(List.of())));
    }

    @Test
    @DisplayName("Negated prior keys render as NOT over an OR")
    void negatedDisjunction() {
        JoinPredicate prior = Predicates.or(List.of(
                new ColumnEquality("ssn", "soc_sec"),
                new ColumnEquality("dob", "dob")));

        String sql = renderer.render(Predicates.not(prior));

        assertTrue(sql.startsWith("NOT (("));
        assertTrue(sql.contains(" OR "));
        assertTrue(sql.endsWith("))"));
    }

    @Test
    @DisplayName("Dedup restriction orders ordinals and separates identifiers")
    void dedupRestriction() {
        assertEquals("(a.\"idx\" < b.\"idx\" AND a.\"id\" <> b.\"pid\")",
                renderer.render(Predicates.dedupRestriction()));
    }

    @Test
    @DisplayName("Should reject column names that are not plain identifiers")
    void rejectsInjection() {
        JoinPredicate malicious = new ColumnEquality("ssn\" OR 1=1 --", "ssn");
        assertThrows(IllegalArgumentException.class, () -> renderer.render(malicious));
    }
}
