package com.record.linkage.core.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single input row of a record set.
 *
 * @param ordinal    stable, run-unique position of the row in its record set
 * @param identifier caller-supplied identifier (not required to be unique)
 * @param values     concrete column name to value; null values are dropped and read as missing
 */
public record SourceRecord(long ordinal, String identifier, Map<String, String> values) {

    public SourceRecord {
        if (ordinal < 0) {
            throw new IllegalArgumentException("ordinal must be >= 0");
        }
        Objects.requireNonNull(identifier, "identifier is required");
        values = values != null ? nonNullValues(values) : Map.of();
    }

    private static Map<String, String> nonNullValues(Map<String, String> values) {
        Map<String, String> copy = new HashMap<>();
        values.forEach((column, value) -> {
            if (column != null && value != null) {
                copy.put(column, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the value of a concrete column, or {@code null} when the record has none.
     */
    public String value(String column) {
        return values.get(column);
    }

    /**
     * Returns true if the column is missing, null or the empty string.
     * Blank values never take part in a blocking join.
     */
    public boolean isEmpty(String column) {
        String value = values.get(column);
        return value == null || value.isEmpty();
    }
}
