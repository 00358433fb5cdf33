package com.record.linkage.bulk;

import com.record.linkage.core.model.FieldMap;
import com.record.linkage.core.model.RecordSet;
import com.record.linkage.core.model.SourceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a preprocessed CSV file into a {@link RecordSet}.
 *
 * <p>The first line is the header. If it has an {@code idx} column that column is the
 * record ordinal; otherwise ordinals follow row order starting at 0. Every column named
 * by the field map must be present. Rows with a blank identifier are skipped.</p>
 *
 * <pre>
 * indv_id,first_name,ssn
 * A1,"Smith, Jo",123456789
 * </pre>
 */
public class CsvRecordSetReader {
    private static final Logger log = LoggerFactory.getLogger(CsvRecordSetReader.class);

    public RecordSet read(Path path, String name, FieldMap fieldMap) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, name, fieldMap);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    public RecordSet read(Reader reader, String name, FieldMap fieldMap) {
        List<SourceRecord> records = new ArrayList<>();
        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String headerLine = br.readLine();
            if (headerLine == null) {
                return new RecordSet(name, fieldMap, List.of());
            }
            List<String> header = parseLine(headerLine);
            for (String column : fieldMap.columns()) {
                if (!header.contains(column)) {
                    throw new IllegalArgumentException("Column '" + column + "' not found in header of " + name);
                }
            }
            int ordinalIndex = header.indexOf(FieldMap.ORDINAL_COLUMN);
            int identifierIndex = header.indexOf(fieldMap.identifierColumn());

            String line;
            long lineNumber = 1;
            long row = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                List<String> cells = parseLine(line);
                String identifier = cell(cells, identifierIndex);
                if (identifier.isEmpty()) {
                    log.warn("read.skipped set={} line={} reason=blank-identifier", name, lineNumber);
                    row++;
                    continue;
                }
                long ordinal = ordinalIndex >= 0 ? parseOrdinal(cell(cells, ordinalIndex), name, lineNumber) : row;

                Map<String, String> values = new HashMap<>();
                for (int i = 0; i < header.size(); i++) {
                    if (i != ordinalIndex) {
                        values.put(header.get(i), cell(cells, i));
                    }
                }
                records.add(new SourceRecord(ordinal, identifier, values));
                row++;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read record set " + name, e);
        }
        log.info("read.completed set={} records={}", name, records.size());
        return new RecordSet(name, fieldMap, records);
    }

    private static long parseOrdinal(String value, String name, long lineNumber) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid idx '" + value + "' in " + name + " at line " + lineNumber, e);
        }
    }

    private static String cell(List<String> cells, int index) {
        return index < cells.size() ? cells.get(index) : "";
    }

    /**
     * Splits one CSV line, honouring double-quoted fields and doubled quotes inside them.
     */
    static List<String> parseLine(String line) {
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else if (c == '"') {
                    quoted = false;
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                cells.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        cells.add(current.toString());
        return cells;
    }
}
