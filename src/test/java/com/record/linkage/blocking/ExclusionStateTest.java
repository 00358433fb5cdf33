package com.record.linkage.blocking;

import com.record.linkage.core.model.SourceRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExclusionState Tests")
class ExclusionStateTest {

    @Test
    @DisplayName("Initial state is empty at version 0 and excludes nothing")
    void initialState() {
        ExclusionState initial = ExclusionState.initial();
        SourceRecord r = new SourceRecord(0, "A", Map.of("ssn", "1"));

        assertEquals(0, initial.version());
        assertTrue(initial.isEmpty());
        assertFalse(initial.asPredicate().test(r, r));
    }

    @Test
    @DisplayName("Combining appends the key and bumps the version without mutating")
    void combine() {
        ExclusionState initial = ExclusionState.initial();
        BlockingKey ssn = new BlockingKey(List.of("ssn"), List.of("soc_sec"));
        BlockingKey dob = new BlockingKey(List.of("fname", "dob"), List.of("first", "dob"));

        ExclusionState next = initial.combine(ssn).combine(dob);

        assertEquals(0, initial.version());
        assertEquals(2, next.version());
        assertEquals(List.of(ssn, dob), next.priorKeys());
        assertEquals(List.of(List.of("ssn"), List.of("fname", "dob")), next.priorColumnsA());
        assertEquals(List.of(List.of("soc_sec"), List.of("first", "dob")), next.priorColumnsB());
    }

    @Test
    @DisplayName("Predicate matches a pair agreeing on any prior key")
    void predicate() {
        ExclusionState state = ExclusionState.initial()
                .combine(new BlockingKey(List.of("ssn"), List.of("ssn")))
                .combine(new BlockingKey(List.of("dob"), List.of("dob")));
        SourceRecord a = new SourceRecord(0, "A", Map.of("ssn", "1", "dob", "2000"));
        SourceRecord sameDob = new SourceRecord(0, "B", Map.of("ssn", "2", "dob", "2000"));
        SourceRecord neither = new SourceRecord(1, "C", Map.of("ssn", "3", "dob", "1999"));

        assertTrue(state.asPredicate().test(a, sameDob));
        assertFalse(state.asPredicate().test(a, neither));
    }

    @Test
    @DisplayName("States with the same keys and version are equal")
    void equality() {
        BlockingKey key = new BlockingKey(List.of("ssn"), List.of("ssn"));
        assertEquals(ExclusionState.initial().combine(key), ExclusionState.initial().combine(key));
        assertNotEquals(ExclusionState.initial(), ExclusionState.initial().combine(key));
    }
}
