package com.record.linkage.core.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps logical field names (shared by both sides of a match) to the concrete
 * column names of one record set. The logical field {@value #IDENTIFIER_FIELD}
 * names the identifier column.
 */
public final class FieldMap {

    public static final String IDENTIFIER_FIELD = "indv_id";

    /** Column holding the ordinal index once a record set is staged in a table. */
    public static final String ORDINAL_COLUMN = "idx";

    private final Map<String, String> columnsByField;

    private FieldMap(Map<String, String> columnsByField) {
        this.columnsByField = columnsByField;
    }

    /**
     * Creates a field map from logical name to column name.
     *
     * @throws IllegalArgumentException if the identifier field is missing or a
     *                                  column collides with the ordinal column
     */
    public static FieldMap of(Map<String, String> columnsByField) {
        if (columnsByField == null || !columnsByField.containsKey(IDENTIFIER_FIELD)) {
            throw new IllegalArgumentException("Field map must define '" + IDENTIFIER_FIELD + "'");
        }
        Map<String, String> copy = new LinkedHashMap<>();
        columnsByField.forEach((field, column) -> {
            if (column == null || column.isBlank()) {
                throw new IllegalArgumentException("Column for field '" + field + "' must not be blank");
            }
            if (ORDINAL_COLUMN.equalsIgnoreCase(column)) {
                throw new IllegalArgumentException("Column name '" + column + "' is reserved");
            }
            copy.put(field, column);
        });
        return new FieldMap(Map.copyOf(copy));
    }

    public Optional<String> column(String field) {
        return Optional.ofNullable(columnsByField.get(field));
    }

    public boolean contains(String field) {
        return columnsByField.containsKey(field);
    }

    public String identifierColumn() {
        return columnsByField.get(IDENTIFIER_FIELD);
    }

    public Collection<String> columns() {
        return columnsByField.values();
    }

    public Map<String, String> asMap() {
        return columnsByField;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldMap other)) return false;
        return columnsByField.equals(other.columnsByField);
    }

    @Override
    public int hashCode() {
        return columnsByField.hashCode();
    }

    @Override
    public String toString() {
        return "FieldMap" + columnsByField;
    }
}
