package com.record.linkage.relational;

import com.record.linkage.core.model.FieldMap;
import com.record.linkage.core.model.RecordSet;
import com.record.linkage.core.model.SourceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Stages a {@link RecordSet} into a relational table so the relational backend can
 * block on it with server-side joins.
 *
 * <p>The table is named {@code records_<set name>}, hash-shortened when too long, and
 * holds an ordinal column plus one {@code VARCHAR} column per mapped field. An existing
 * table of the same name is replaced.</p>
 */
public class RecordTableLoader {
    private static final Logger log = LoggerFactory.getLogger(RecordTableLoader.class);

    private final DataSource dataSource;
    private final String schema;
    private final int batchSize;

    public RecordTableLoader(DataSource dataSource, String schema, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.dataSource = dataSource;
        this.schema = schema;
        this.batchSize = batchSize;
    }

    /**
     * Creates and fills the table for a record set.
     *
     * @throws RelationalStoreException if the store rejects the load
     */
    public RecordTable load(RecordSet recordSet) {
        FieldMap fieldMap = recordSet.getFieldMap();
        List<String> columns = new ArrayList<>(new LinkedHashSet<>(fieldMap.columns()));
        RecordTable table = new RecordTable(schema,
                SqlIdentifiers.tableName("records_", recordSet.getName()),
                fieldMap.identifierColumn());
        String qualified = table.qualifiedName();

        String create = "CREATE TABLE " + qualified + " (" +
                SqlIdentifiers.quote(FieldMap.ORDINAL_COLUMN) + " BIGINT NOT NULL, " +
                columns.stream().map(c -> SqlIdentifiers.quote(c) + " VARCHAR")
                        .collect(Collectors.joining(", ")) +
                ")";
        String insert = "INSERT INTO " + qualified + " (" +
                SqlIdentifiers.quote(FieldMap.ORDINAL_COLUMN) + ", " +
                columns.stream().map(SqlIdentifiers::quote).collect(Collectors.joining(", ")) +
                ") VALUES (" + "?, ".repeat(columns.size()) + "?)";

        try (Connection connection = dataSource.getConnection()) {
            connection.setAutoCommit(false);
            try (Statement statement = connection.createStatement()) {
                statement.execute("DROP TABLE IF EXISTS " + qualified);
                statement.execute(create);
            }
            int pending = 0;
            try (PreparedStatement statement = connection.prepareStatement(insert)) {
                for (SourceRecord record : recordSet.getRecords()) {
                    statement.setLong(1, record.ordinal());
                    for (int i = 0; i < columns.size(); i++) {
                        String column = columns.get(i);
                        String value = column.equals(table.identifierColumn())
                                ? record.identifier()
                                : record.value(column);
                        statement.setString(i + 2, value);
                    }
                    statement.addBatch();
                    if (++pending == batchSize) {
                        statement.executeBatch();
                        pending = 0;
                    }
                }
                if (pending > 0) {
                    statement.executeBatch();
                }
            }
            connection.commit();
        } catch (SQLException e) {
            throw new RelationalStoreException("Failed to stage record set '" + recordSet.getName() +
                    "' into " + qualified, e);
        }
        log.info("records.staged set={} table={} rows={}", recordSet.getName(), qualified, recordSet.size());
        return table;
    }

    /**
     * Drops a staged table. A failure is logged rather than thrown, since dropping
     * happens during cleanup after the run already produced its shards.
     */
    public void drop(RecordTable table) {
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            statement.execute("DROP TABLE IF EXISTS " + table.qualifiedName());
            if (!connection.getAutoCommit()) {
                connection.commit();
            }
            log.debug("records.dropped table={}", table.qualifiedName());
        } catch (SQLException e) {
            log.warn("records.drop.failed table={} error={}", table.qualifiedName(), e.getMessage());
        }
    }
}
