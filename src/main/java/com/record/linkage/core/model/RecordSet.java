package com.record.linkage.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An ordered, read-only set of records from one source, together with its field map.
 * Shared between the coordinator and every worker, so it is never mutated after creation.
 */
public final class RecordSet {

    private final String name;
    private final FieldMap fieldMap;
    private final List<SourceRecord> records;
    private final Map<Long, SourceRecord> recordsByOrdinal;

    public RecordSet(String name, FieldMap fieldMap, List<SourceRecord> records) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Record set name must not be null or blank");
        }
        this.name = name;
        this.fieldMap = Objects.requireNonNull(fieldMap, "fieldMap is required");
        Objects.requireNonNull(records, "records is required");

        Map<Long, SourceRecord> index = new HashMap<>(records.size() * 2);
        for (SourceRecord record : records) {
            if (index.putIfAbsent(record.ordinal(), record) != null) {
                throw new IllegalArgumentException(
                        "Duplicate ordinal " + record.ordinal() + " in record set '" + name + "'");
            }
        }
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.recordsByOrdinal = Collections.unmodifiableMap(index);
    }

    public String getName() {
        return name;
    }

    public FieldMap getFieldMap() {
        return fieldMap;
    }

    public List<SourceRecord> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    /**
     * Looks up a record by ordinal.
     *
     * @throws IllegalArgumentException if no record has that ordinal
     */
    public SourceRecord byOrdinal(long ordinal) {
        SourceRecord record = recordsByOrdinal.get(ordinal);
        if (record == null) {
            throw new IllegalArgumentException("No record with ordinal " + ordinal + " in '" + name + "'");
        }
        return record;
    }

    @Override
    public String toString() {
        return "RecordSet{name='" + name + "', size=" + records.size() + '}';
    }
}
