package com.record.linkage.blocking;

import com.record.linkage.blocking.predicate.SqlPredicateRenderer;
import com.record.linkage.core.model.CandidatePair;
import com.record.linkage.core.model.FieldMap;
import com.record.linkage.relational.RecordTable;
import com.record.linkage.relational.SqlIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Candidate backend that blocks with server-side joins.
 *
 * <p>Each pass materializes a pass-scoped table holding
 * {@code (indv_id_a, indv_id_b, idx_a, idx_b)} from an inner join whose {@code ON}
 * clause is the pass's rendered join predicate. The table is streamed with a JDBC
 * fetch size equal to the chunk size and dropped when its source is closed.</p>
 *
 * <p>All statements, including the schema-mutating ones, run on a single coordinator
 * connection opened on first use. Workers never touch it.</p>
 */
public class RelationalCandidateBackend implements CandidateBackend {
    private static final Logger log = LoggerFactory.getLogger(RelationalCandidateBackend.class);

    private static final String ALIAS_A = "a";
    private static final String ALIAS_B = "b";

    private final DataSource dataSource;
    private final String schema;
    private final RecordTable tableA;
    private final RecordTable tableB;
    private final SqlPredicateRenderer renderer;
    private Connection connection;

    /**
     * @param dataSource source of the coordinator connection
     * @param schema     schema for candidate tables, or {@code null} for the default
     * @param tableA     staged side A
     * @param tableB     staged side B; pass {@code tableA} again for dedup
     */
    public RelationalCandidateBackend(DataSource dataSource, String schema,
                                      RecordTable tableA, RecordTable tableB) {
        this.dataSource = dataSource;
        this.schema = schema;
        this.tableA = tableA;
        this.tableB = tableB;
        this.renderer = new SqlPredicateRenderer(ALIAS_A, ALIAS_B,
                tableA.identifierColumn(), tableB.identifierColumn(), FieldMap.ORDINAL_COLUMN);
    }

    @Override
    public CandidateGeneration generateCandidates(CandidateRequest request) {
        String target = SqlIdentifiers.qualify(schema, request.candidateSetName());
        String sql = buildCandidateTableSql(target, renderer.render(request.joinPredicate()));
        log.debug("candidates.sql set={} sql={}", request.candidateSetName(), sql);

        try {
            Connection c = connection();
            long rows;
            try (Statement statement = c.createStatement()) {
                statement.execute("DROP TABLE IF EXISTS " + target);
                statement.execute(sql);
                try (ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM " + target)) {
                    rs.next();
                    rows = rs.getLong(1);
                }
            }
            c.commit();
            return new CandidateGeneration(request.candidateSetName(), rows,
                    request.exclusion().combine(request.key()));
        } catch (SQLException e) {
            rollback();
            throw new CandidateGenerationException("Failed to generate candidates for pass '" +
                    request.pass().name() + "' into " + target, e);
        }
    }

    @Override
    public Optional<CandidateSource> openCandidates(String candidateSetName, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        try {
            Connection c = connection();
            if (!tableExists(c, candidateSetName)) {
                return Optional.empty();
            }
            String target = SqlIdentifiers.qualify(schema, candidateSetName);
            PreparedStatement statement = c.prepareStatement(
                    "SELECT indv_id_a, indv_id_b, idx_a, idx_b FROM " + target + " ORDER BY idx_a, idx_b");
            statement.setFetchSize(chunkSize);
            ResultSet rs;
            try {
                rs = statement.executeQuery();
            } catch (SQLException e) {
                statement.close();
                throw e;
            }
            return Optional.of(new TableCandidateSource(target, statement, rs, chunkSize));
        } catch (SQLException e) {
            throw new CandidateGenerationException("Failed to open candidate table '" + candidateSetName + "'", e);
        }
    }

    @Override
    public String getName() {
        return "relational";
    }

    @Override
    public void close() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("connection.close.failed error={}", e.getMessage());
        } finally {
            connection = null;
        }
    }

    private String buildCandidateTableSql(String target, String joinCondition) {
        return """
                CREATE TABLE %s AS
                SELECT
                    a.%s AS indv_id_a,
                    b.%s AS indv_id_b,
                    a.%s AS idx_a,
                    b.%s AS idx_b
                FROM %s a
                INNER JOIN %s b
                ON %s
                """.formatted(
                target,
                SqlIdentifiers.quote(tableA.identifierColumn()),
                SqlIdentifiers.quote(tableB.identifierColumn()),
                SqlIdentifiers.quote(FieldMap.ORDINAL_COLUMN),
                SqlIdentifiers.quote(FieldMap.ORDINAL_COLUMN),
                tableA.qualifiedName(),
                tableB.qualifiedName(),
                joinCondition);
    }

    /**
     * Looks the table up in the configured schema, or in the connection's current schema
     * when none is configured. Names are passed as escaped patterns so {@code _} and
     * {@code %} match literally.
     */
    private boolean tableExists(Connection c, String table) throws SQLException {
        DatabaseMetaData metaData = c.getMetaData();
        String escape = metaData.getSearchStringEscape();
        String lookupSchema = schema != null && !schema.isBlank() ? schema : c.getSchema();
        try (ResultSet rs = metaData.getTables(null, escapePattern(lookupSchema, escape),
                escapePattern(table, escape), null)) {
            while (rs.next()) {
                if (table.equals(rs.getString("TABLE_NAME"))) {
                    return true;
                }
            }
            return false;
        }
    }

    static String escapePattern(String name, String escape) {
        if (name == null || escape == null || escape.isEmpty()) {
            return name;
        }
        return name.replace(escape, escape + escape)
                .replace("_", escape + "_")
                .replace("%", escape + "%");
    }

    private Connection connection() throws SQLException {
        if (connection == null) {
            connection = dataSource.getConnection();
            connection.setAutoCommit(false);
        }
        return connection;
    }

    private void rollback() {
        if (connection == null) {
            return;
        }
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.warn("connection.rollback.failed error={}", e.getMessage());
        }
    }

    private final class TableCandidateSource implements CandidateSource {
        private final String target;
        private final PreparedStatement statement;
        private final ResultSet resultSet;
        private final int chunkSize;
        private boolean exhausted;
        private boolean closed;

        private TableCandidateSource(String target, PreparedStatement statement,
                                     ResultSet resultSet, int chunkSize) {
            this.target = target;
            this.statement = statement;
            this.resultSet = resultSet;
            this.chunkSize = chunkSize;
        }

        @Override
        public List<CandidatePair> nextChunk() {
            if (exhausted || closed) {
                return List.of();
            }
            List<CandidatePair> chunk = new ArrayList<>(Math.min(chunkSize, 1_024));
            try {
                while (chunk.size() < chunkSize) {
                    if (!resultSet.next()) {
                        exhausted = true;
                        break;
                    }
                    chunk.add(new CandidatePair(
                            resultSet.getString(1),
                            resultSet.getString(2),
                            resultSet.getLong(3),
                            resultSet.getLong(4)));
                }
            } catch (SQLException e) {
                throw new CandidateGenerationException("Failed to read candidates from " + target, e);
            }
            return chunk;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            try {
                resultSet.close();
                statement.close();
                try (Statement drop = connection().createStatement()) {
                    drop.execute("DROP TABLE IF EXISTS " + target);
                }
                connection().commit();
                log.debug("candidates.dropped table={}", target);
            } catch (SQLException e) {
                rollback();
                throw new CandidateGenerationException("Failed to discard candidate table " + target, e);
            }
        }
    }
}
