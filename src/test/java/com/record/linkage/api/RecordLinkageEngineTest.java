package com.record.linkage.api;

import com.record.linkage.blocking.BlockingPlan;
import com.record.linkage.blocking.PassReport;
import com.record.linkage.blocking.PassState;
import com.record.linkage.core.model.MatchType;
import com.record.linkage.core.model.RecordSet;
import com.record.linkage.core.model.StrictnessTier;
import com.record.linkage.dispatch.MatchExecutionException;
import com.record.linkage.fixtures.H2DataSources;
import com.record.linkage.fixtures.TestRecordSets;
import com.record.linkage.metrics.MicrometerMatchMetrics;
import com.record.linkage.output.ExponentialWeightScheme;
import com.record.linkage.output.OutputAssembler;
import com.record.linkage.relational.RelationalSettings;
import com.record.linkage.similarity.FieldSimilarityComparer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecordLinkageEngine Tests")
class RecordLinkageEngineTest {

    @TempDir
    Path out;

    private final RecordSet census = TestRecordSets.builder("census")
            .field("indv_id", "id").field("ssn", "ssn").field("first_name", "fname")
            .field("last_name", "lname").field("dob", "dob")
            .row("A0", "ssn", "111", "fname", "JOHN", "lname", "SMITH", "dob", "1980-01-01")
            .row("A1", "fname", "MARY", "lname", "JONES", "dob", "1990-02-02")
            .row("A2", "ssn", "333", "fname", "PETER", "lname", "PAN", "dob", "1970-07-07")
            .build();

    private final RecordSet claims = TestRecordSets.builder("claims")
            .field("indv_id", "pid").field("ssn", "soc_sec").field("first_name", "first")
            .field("last_name", "last").field("dob", "birth_date")
            .row("B0", "soc_sec", "111", "first", "JON", "last", "SMITH", "birth_date", "1980-01-01")
            .row("B1", "soc_sec", "999", "first", "MARY", "last", "JONES", "birth_date", "1990-02-02")
            .row("B2", "first", "PAN", "last", "PETER", "birth_date", "1970-07-07")
            .row("B3", "soc_sec", "444", "first", "X", "last", "Y", "birth_date", "1980-01-01")
            .build();

    private final BlockingPlan plan = BlockingPlan.builder()
            .groundTruth("ssn")
            .pass("1", List.of("first_name", "dob"))
            .pass("2", List.of("first_name_inv", "last_name_inv"))
            .pass("3", List.of("dob"))
            .build();

    private MatchOptions.Builder options(MatchType type) {
        return MatchOptions.builder()
                .matchType(type)
                .blockingPlan(plan)
                .parallelism(2)
                .comparerVariables("1", List.of("last_name"))
                .comparerVariables("3", List.of("first_name"))
                .outputDirectory(out);
    }

    private static PairComparer comparerFor(MatchOptions options) {
        return FieldSimilarityComparer.builder()
                .variablesByPass(options.getComparerVariablesByPass())
                .build();
    }

    private static void assertLinkageOutput(MatchRunResult result, Path out) throws IOException {
        assertEquals(List.of("dup_ssn", "1", "2", "3"),
                result.passReports().stream().map(PassReport::passName).toList());
        assertTrue(result.passReports().stream().allMatch(r -> r.state() == PassState.EXHAUSTED));
        assertEquals(0, result.skippedPasses());
        assertEquals(4, result.counts().total());
        assertEquals(4, result.finalExclusion().version());

        assertEquals(List.of(out.resolve(OutputAssembler.GROUND_TRUTH_SHARD), out.resolve("match_0.csv")),
                result.shards());
        assertEquals(List.of(
                        "indv_id_a,indv_id_b,idx_a,idx_b,pass_name,match_strict,match_moderate,match_relaxed,"
                                + "match_review,weight,last_name,first_name",
                        "A0,B0,0,0,dup_ssn,1,1,1,1,10000,,"),
                Files.readAllLines(out.resolve(OutputAssembler.GROUND_TRUTH_SHARD)));
        assertEquals(List.of(
                        "A1,B1,1,1,1,1,1,1,1,1000,1,",
                        "A2,B2,2,2,2,0,0,0,0,100,,",
                        "A0,B3,0,3,3,0,0,0,0,10,,0"),
                Files.readAllLines(out.resolve("match_0.csv")).subList(1, 4));
    }

    @Nested
    @DisplayName("In-memory blocking")
    class InMemoryTests {

        @Test
        @DisplayName("Runs every pass and writes ground-truth and batch shards")
        void linkage() throws IOException {
            MatchOptions options = options(MatchType.ONE_TO_ONE).build();
            try (RecordLinkageEngine engine = RecordLinkageEngine.builder()
                    .options(options).comparer(comparerFor(options)).build()) {

                assertFalse(engine.isRelational());
                assertLinkageOutput(engine.run(census, claims), out);
            }
        }

        @Test
        @DisplayName("Dedup pairs each record with later records only")
        void dedup() throws IOException {
            RecordSet people = TestRecordSets.builder("people")
                    .field("indv_id", "id").field("dob", "dob")
                    .row("P0", "dob", "2000-01-01")
                    .row("P1", "dob", "2000-01-01")
                    .row("P2", "dob", "1999-09-09")
                    .row("P3", "dob", "2000-01-01")
                    .build();
            MatchOptions options = MatchOptions.builder()
                    .matchType(MatchType.DEDUP)
                    .blockingPlan(BlockingPlan.builder().pass(1, "dob").build())
                    .outputDirectory(out)
                    .build();

            try (RecordLinkageEngine engine = RecordLinkageEngine.builder()
                    .options(options).comparer(comparerFor(options)).build()) {
                MatchRunResult result = engine.run(people, null);

                assertEquals(3, result.counts().pairs("1"));
                assertEquals(List.of("P0,P1", "P0,P3", "P1,P3"),
                        Files.readAllLines(out.resolve("match_0.csv")).stream().skip(1)
                                .map(line -> line.substring(0, 5)).sorted().toList());
            }
        }

        @Test
        @DisplayName("Unmapped passes are skipped and reported")
        void skippedPass() {
            BlockingPlan withUnmapped = BlockingPlan.builder()
                    .pass(1, "first_name", "dob")
                    .pass(2, "middle_name")
                    .build();
            MatchOptions options = options(MatchType.ONE_TO_ONE).blockingPlan(withUnmapped).build();
            SimpleMeterRegistry registry = new SimpleMeterRegistry();

            try (RecordLinkageEngine engine = RecordLinkageEngine.builder()
                    .options(options).comparer(comparerFor(options))
                    .metrics(new MicrometerMatchMetrics(registry)).build()) {
                MatchRunResult result = engine.run(census, claims);

                assertEquals(1, result.skippedPasses());
                assertEquals(PassState.SKIPPED, result.passReports().get(1).state());
                assertEquals(1.0, registry.get("linkage.pass.skipped").tag("pass", "2").counter().count());
                assertEquals(1, result.finalExclusion().version());
            }
        }

        @Test
        @DisplayName("A comparer failure aborts the run")
        void comparerFailure() {
            MatchOptions options = options(MatchType.ONE_TO_ONE).build();
            PairComparer failing = (chunk, a, b) -> {
                throw new IllegalStateException("scoring failed");
            };

            try (RecordLinkageEngine engine = RecordLinkageEngine.builder()
                    .options(options).comparer(failing).build()) {
                assertThrows(MatchExecutionException.class, () -> engine.run(census, claims));
                assertFalse(Files.exists(out.resolve("match_0.csv")));
            }
        }

        @Test
        @DisplayName("Side B is required unless deduplicating")
        void missingSideB() {
            MatchOptions options = options(MatchType.ONE_TO_ONE).build();
            try (RecordLinkageEngine engine = RecordLinkageEngine.builder()
                    .options(options).comparer(comparerFor(options)).build()) {
                assertThrows(IllegalArgumentException.class, () -> engine.run(census, null));
            }
        }

        @Test
        @DisplayName("Builder requires options and comparer")
        void builderValidation() {
            assertThrows(IllegalArgumentException.class,
                    () -> RecordLinkageEngine.builder().comparer((chunk, a, b) -> List.of()).build());
            assertThrows(IllegalArgumentException.class,
                    () -> RecordLinkageEngine.builder().options(options(MatchType.DEDUP).build()).build());
        }
    }

    @Nested
    @DisplayName("Relational blocking")
    class RelationalTests {

        private JdbcDataSource dataSource;
        private Connection keepAlive;

        @BeforeEach
        void setUp() throws SQLException {
            dataSource = H2DataSources.create();
            keepAlive = dataSource.getConnection();
        }

        @AfterEach
        void tearDown() throws SQLException {
            keepAlive.close();
        }

        private long tableCount() throws SQLException {
            try (Statement statement = keepAlive.createStatement();
                 ResultSet rs = statement.executeQuery(
                         "SELECT COUNT(*) FROM information_schema.tables WHERE table_schema = 'public'")) {
                rs.next();
                return rs.getLong(1);
            }
        }

        @Test
        @DisplayName("Produces the same shards as in-memory blocking and cleans up its tables")
        void linkage() throws IOException, SQLException {
            MatchOptions options = options(MatchType.ONE_TO_ONE).build();
            try (RecordLinkageEngine engine = RecordLinkageEngine.builder()
                    .options(options).comparer(comparerFor(options)).dataSource(dataSource).build()) {

                assertTrue(engine.isRelational());
                assertLinkageOutput(engine.run(census, claims), out);
            }
            assertEquals(0, tableCount());
        }

        @Test
        @DisplayName("Staged tables are dropped when the run fails")
        void cleanupOnFailure() throws SQLException {
            MatchOptions options = options(MatchType.ONE_TO_ONE).build();
            PairComparer failing = (chunk, a, b) -> {
                throw new IllegalStateException("scoring failed");
            };
            try (RecordLinkageEngine engine = RecordLinkageEngine.builder()
                    .options(options).comparer(failing).dataSource(dataSource).build()) {
                assertThrows(MatchExecutionException.class, () -> engine.run(census, claims));
            }
            assertEquals(0, tableCount());
        }

        @Test
        @DisplayName("A plan too large to weight fails before any table is staged")
        void oversizedPlan() throws SQLException {
            BlockingPlan.Builder builder = BlockingPlan.builder();
            for (int i = 1; i <= ExponentialWeightScheme.MAX_NUMBERED_PASSES + 1; i++) {
                builder.pass(Integer.toString(i), List.of("dob"));
            }
            MatchOptions options = options(MatchType.ONE_TO_ONE).blockingPlan(builder.build()).build();

            try (RecordLinkageEngine engine = RecordLinkageEngine.builder()
                    .options(options).comparer(comparerFor(options)).dataSource(dataSource).build()) {
                assertThrows(IllegalArgumentException.class, () -> engine.run(census, claims));
            }
            assertEquals(0, tableCount());
        }

        @Test
        @DisplayName("Relational settings without a data source create an owned pool")
        void ownedPool() {
            RelationalSettings settings = RelationalSettings.builder()
                    .jdbcUrl(H2DataSources.jdbcUrl() + ";DB_CLOSE_DELAY=-1")
                    .username("sa")
                    .insertBatchSize(2)
                    .build();
            MatchOptions options = options(MatchType.ONE_TO_ONE).relationalSettings(settings).build();

            try (RecordLinkageEngine engine = RecordLinkageEngine.builder()
                    .options(options).comparer(comparerFor(options)).build()) {
                assertTrue(engine.isRelational());
                MatchRunResult result = engine.run(census, claims);
                assertEquals(4, result.counts().total());
                assertEquals(1, result.counts().matches("1", StrictnessTier.STRICT));
            }
        }
    }
}
