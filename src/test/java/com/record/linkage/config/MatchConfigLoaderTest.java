package com.record.linkage.config;

import com.record.linkage.api.MatchOptions;
import com.record.linkage.blocking.BlockingPlan;
import com.record.linkage.blocking.PassDefinition;
import com.record.linkage.core.model.MatchType;
import com.record.linkage.relational.RelationalSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MatchConfigLoader Tests")
class MatchConfigLoaderTest {

    private MatchConfigLoader loader;

    @BeforeEach
    void setUp() {
        loader = new MatchConfigLoader();
    }

    @Nested
    @DisplayName("Full configuration file")
    class FullConfigTests {

        private MatchConfig config;

        @BeforeEach
        void load() throws URISyntaxException {
            Path path = Path.of(MatchConfigLoaderTest.class.getResource("/match-config.json").toURI());
            config = loader.load(path);
        }

        @Test
        @DisplayName("Reads both sides")
        void sides() {
            assertEquals(MatchType.ONE_TO_ONE, config.matchType());
            assertEquals("census", config.nameA());
            assertEquals("claims", config.nameB());
            assertEquals("id", config.fieldsA().identifierColumn());
            assertEquals("soc_sec", config.fieldsB().column("ssn").orElseThrow());
        }

        @Test
        @DisplayName("Builds the blocking plan with chunk sizes")
        void blockingPlan() {
            BlockingPlan plan = config.blockingPlan();

            assertEquals(List.of("dup_ssn", "1", "2", "3", "10"),
                    plan.orderedPasses().stream().map(PassDefinition::name).toList());
            assertEquals(5000, plan.findPass("1").orElseThrow().chunkSize());
            assertEquals(2500, plan.findPass("2").orElseThrow().chunkSize());
            assertEquals(BlockingPlan.DEFAULT_CHUNK_SIZE, plan.findPass("10").orElseThrow().chunkSize());
            assertTrue(plan.findPass("3").orElseThrow().isInverted());
        }

        @Test
        @DisplayName("Reads comparer variables, parallelism and database settings")
        void runSettings() {
            assertEquals(Map.of("1", List.of("first_name", "last_name"), "2", List.of("last_name", "ssn")),
                    config.comparerVariablesByPass());
            assertEquals(3, config.parallelism());

            RelationalSettings db = config.relational().orElseThrow();
            assertEquals("jdbc:postgresql://localhost:5432/linkage", db.getJdbcUrl());
            assertEquals("linker", db.getUsername());
            assertEquals("linkage", db.getSchema());
            assertEquals(3, db.getPoolSize());
        }

        @Test
        @DisplayName("Converts to match options")
        void toOptions(@TempDir Path out) {
            MatchOptions options = config.toOptions(out).chunkRetries(1).build();

            assertEquals(3, options.getParallelism());
            assertEquals(6, options.getBatchThreshold());
            assertEquals(1, options.getChunkRetries());
            assertEquals(List.of("first_name", "last_name", "ssn"), options.comparerColumns());
            assertTrue(options.getRelationalSettings().isPresent());
        }
    }

    @Test
    @DisplayName("Dedup ignores df_b and no database selects in-memory blocking")
    void dedupInMemory() {
        MatchConfig config = loader.parse("""
                {
                  "matchtype": "dedup",
                  "data_param": {"df_a": {"name": "people", "vars": {"indv_id": "id", "dob": "dob"}}},
                  "blocks_by_pass": {"1": ["dob"]},
                  "database_information": {"jdbc_url": ""}
                }
                """);

        assertEquals(MatchType.DEDUP, config.matchType());
        assertNull(config.nameB());
        assertNull(config.fieldsB());
        assertTrue(config.relational().isEmpty());
        assertEquals(4, config.parallelism());
        assertTrue(config.comparerVariablesByPass().isEmpty());
    }

    @Test
    @DisplayName("Null pass variables load as an empty pass and null chunk sizes fall back to the default")
    void nullPassEntries() {
        MatchConfig config = loader.parse("""
                {
                  "matchtype": "dedup",
                  "data_param": {"df_a": {"name": "people", "vars": {"indv_id": "id", "ssn": "ssn"}}},
                  "blocks_by_pass": {"1": ["ssn"], "2": null},
                  "parallelization_metrics": {"chunk_sizes": {"1": null, "2": 100}}
                }
                """);

        BlockingPlan plan = config.blockingPlan();
        assertEquals(List.of("ssn"), plan.findPass("1").orElseThrow().variables());
        assertEquals(BlockingPlan.DEFAULT_CHUNK_SIZE, plan.findPass("1").orElseThrow().chunkSize());
        assertTrue(plan.findPass("2").orElseThrow().variables().isEmpty());
        assertEquals(100, plan.findPass("2").orElseThrow().chunkSize());
    }

    @Test
    @DisplayName("Null entries inside a pass variable list are rejected")
    void nullPassVariable() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.parse("""
                {
                  "matchtype": "dedup",
                  "data_param": {"df_a": {"name": "people", "vars": {"indv_id": "id", "ssn": "ssn"}}},
                  "blocks_by_pass": {"1": ["ssn", null]}
                }
                """));
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }

    @Test
    @DisplayName("Invalid documents raise ConfigurationException")
    void invalidDocuments() {
        assertThrows(ConfigurationException.class, () -> loader.parse("{not json"));
        assertThrows(ConfigurationException.class, () -> loader.parse("{\"data_param\": {}}"));
        assertThrows(ConfigurationException.class, () -> loader.parse("""
                {"matchtype": "1:1", "data_param": {"df_a": {"name": "a", "vars": {"indv_id": "id"}}}}
                """));
        assertThrows(ConfigurationException.class, () -> loader.parse("""
                {"matchtype": "2:2", "data_param": {"df_a": {"name": "a", "vars": {"indv_id": "id"}}}}
                """));
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.parse("""
                {"matchtype": "dedup", "data_param": {"df_a": {"name": "a", "vars": {"ssn": "ssn"}}}}
                """));
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }

    @Test
    @DisplayName("Missing files raise ConfigurationException")
    void missingFile(@TempDir Path dir) {
        assertThrows(ConfigurationException.class, () -> loader.load(dir.resolve("missing.json")));
    }
}
