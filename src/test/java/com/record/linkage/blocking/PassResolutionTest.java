package com.record.linkage.blocking;

import com.record.linkage.core.model.FieldMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PassResolution Tests")
class PassResolutionTest {

    private final FieldMap fieldsA = FieldMap.of(Map.of(
            "indv_id", "id", "first_name", "fname", "last_name", "lname", "dob", "dob"));
    private final FieldMap fieldsB = FieldMap.of(Map.of(
            "indv_id", "pid", "first_name", "first", "last_name", "last", "ssn", "ssn"));

    @Test
    @DisplayName("Maps logical variables to each side's columns")
    void resolvesColumns() {
        PassResolution resolution = PassResolution.resolve(
                PassDefinition.numbered("1", List.of("first_name", "last_name"), 10), fieldsA, fieldsB);

        assertTrue(resolution.isResolved());
        assertEquals(List.of("fname", "lname"), resolution.key().columnsA());
        assertEquals(List.of("first", "last"), resolution.key().columnsB());
    }

    @Test
    @DisplayName("Inverted pass reverses side B's tuple")
    void inverted() {
        PassResolution resolution = PassResolution.resolve(
                PassDefinition.numbered("2", List.of("first_name_inv", "last_name_inv"), 10), fieldsA, fieldsB);

        assertEquals(List.of("fname", "lname"), resolution.key().columnsA());
        assertEquals(List.of("last", "first"), resolution.key().columnsB());
    }

    @Test
    @DisplayName("Variables missing on either side leave the pass unresolved")
    void missingVariables() {
        PassResolution resolution = PassResolution.resolve(
                PassDefinition.numbered("3", List.of("dob", "ssn", "first_name"), 10), fieldsA, fieldsB);

        assertFalse(resolution.isResolved());
        assertFalse(resolution.hasNoVariables());
        assertEquals(Set.of("dob", "ssn"), resolution.missingFields());
    }

    @Test
    @DisplayName("A pass without variables has nothing to resolve")
    void noVariables() {
        PassResolution resolution = PassResolution.resolve(
                PassDefinition.numbered("4", List.of(), 10), fieldsA, fieldsB);

        assertTrue(resolution.hasNoVariables());
        assertFalse(resolution.isResolved());
    }
}
