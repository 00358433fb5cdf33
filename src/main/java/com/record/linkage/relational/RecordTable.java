package com.record.linkage.relational;

import com.record.linkage.core.model.FieldMap;

import java.util.Objects;

/**
 * A record set staged as a relational table: one {@value FieldMap#ORDINAL_COLUMN}
 * column plus one text column per mapped field.
 *
 * @param schema           schema, or {@code null} for the connection default
 * @param table            table name
 * @param identifierColumn column holding the record identifier
 */
public record RecordTable(String schema, String table, String identifierColumn) {

    public RecordTable {
        SqlIdentifiers.requireValid(table);
        Objects.requireNonNull(identifierColumn, "identifierColumn is required");
    }

    public String qualifiedName() {
        return SqlIdentifiers.qualify(schema, table);
    }
}
