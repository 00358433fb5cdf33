package com.record.linkage.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.record.linkage.blocking.BlockingPlan;
import com.record.linkage.core.model.FieldMap;
import com.record.linkage.core.model.MatchType;
import com.record.linkage.relational.RelationalSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the JSON match configuration.
 *
 * <pre>
 * {
 *   "matchtype": "1:1",
 *   "data_param": {
 *     "df_a": {"name": "census", "vars": {"indv_id": "id", "ssn": "ssn"}},
 *     "df_b": {"name": "claims", "vars": {"indv_id": "pid", "ssn": "soc_sec"}}
 *   },
 *   "ground_truth_ids": ["ssn"],
 *   "blocks_by_pass": {"1": ["ssn"], "2": ["first_name", "dob"]},
 *   "comp_names_by_pass": {"1": ["first_name", "last_name"]},
 *   "parallelization_metrics": {"chunk_sizes": {"1": 10000}, "num_processes": 4},
 *   "database_information": {"jdbc_url": "jdbc:postgresql://db/linkage", "user": "u",
 *                            "password": "p", "schema": "linkage"}
 * }
 * </pre>
 *
 * <p>{@code df_b} is not read for {@code dedup}. An empty or absent
 * {@code database_information} selects in-memory blocking.</p>
 */
public class MatchConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(MatchConfigLoader.class);

    private static final int DEFAULT_PARALLELISM = 4;

    private final ObjectMapper objectMapper;

    public MatchConfigLoader() {
        this.objectMapper = new ObjectMapper();
    }

    public MatchConfig load(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration " + path, e);
        }
    }

    public MatchConfig load(Reader reader) {
        ConfigDocument document;
        try {
            document = objectMapper.readValue(reader, ConfigDocument.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed configuration: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration", e);
        }
        try {
            return toConfig(document);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    public MatchConfig parse(String json) {
        return load(new StringReader(json));
    }

    private MatchConfig toConfig(ConfigDocument doc) {
        if (doc.matchType() == null) {
            throw new ConfigurationException("matchtype is required");
        }
        MatchType matchType = MatchType.fromCode(doc.matchType());
        if (doc.dataParam() == null || doc.dataParam().dfA() == null) {
            throw new ConfigurationException("data_param.df_a is required");
        }
        DataSide sideA = doc.dataParam().dfA();
        FieldMap fieldsA = fieldMap("df_a", sideA);

        String nameB = null;
        FieldMap fieldsB = null;
        if (!matchType.isDedup()) {
            DataSide sideB = doc.dataParam().dfB();
            if (sideB == null) {
                throw new ConfigurationException("data_param.df_b is required for matchtype " + doc.matchType());
            }
            nameB = requireName("df_b", sideB);
            fieldsB = fieldMap("df_b", sideB);
        }

        Parallelization parallelization = doc.parallelization() != null
                ? doc.parallelization() : new Parallelization(Map.of(), null);
        BlockingPlan.Builder plan = BlockingPlan.builder();
        if (doc.groundTruthIds() != null) {
            plan.groundTruth(doc.groundTruthIds());
        }
        orEmpty(doc.blocksByPass()).forEach(plan::pass);
        orEmpty(parallelization.chunkSizes()).forEach((pass, size) -> {
            if (size != null) {
                plan.chunkSize(pass, size);
            }
        });

        int parallelism = parallelization.numProcesses() != null
                ? parallelization.numProcesses() : DEFAULT_PARALLELISM;

        MatchConfig config = new MatchConfig(matchType, requireName("df_a", sideA), fieldsA, nameB, fieldsB,
                plan.build(), orEmpty(doc.comparerNamesByPass()), parallelism,
                relationalSettings(doc.databaseInformation()));
        log.info("config.loaded matchType={} passes={} relational={}",
                matchType.getCode(), config.blockingPlan().orderedPasses().size(), config.relational().isPresent());
        return config;
    }

    private static String requireName(String side, DataSide data) {
        if (data.name() == null || data.name().isBlank()) {
            throw new ConfigurationException("data_param." + side + ".name is required");
        }
        return data.name();
    }

    private static FieldMap fieldMap(String side, DataSide data) {
        if (data.vars() == null) {
            throw new ConfigurationException("data_param." + side + ".vars is required");
        }
        return FieldMap.of(data.vars());
    }

    private static RelationalSettings relationalSettings(DatabaseInformation db) {
        if (db == null || db.jdbcUrl() == null || db.jdbcUrl().isBlank()) {
            return null;
        }
        RelationalSettings.Builder builder = RelationalSettings.builder()
                .jdbcUrl(db.jdbcUrl())
                .username(db.user())
                .password(db.password())
                .schema(db.schema());
        if (db.poolSize() != null) {
            builder.poolSize(db.poolSize());
        }
        return builder.build();
    }

    private static <V> Map<String, V> orEmpty(Map<String, V> map) {
        return map != null ? map : new LinkedHashMap<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ConfigDocument(
            @JsonProperty("matchtype") String matchType,
            @JsonProperty("data_param") DataParam dataParam,
            @JsonProperty("ground_truth_ids") List<String> groundTruthIds,
            @JsonProperty("blocks_by_pass") LinkedHashMap<String, List<String>> blocksByPass,
            @JsonProperty("comp_names_by_pass") LinkedHashMap<String, List<String>> comparerNamesByPass,
            @JsonProperty("parallelization_metrics") Parallelization parallelization,
            @JsonProperty("database_information") DatabaseInformation databaseInformation
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record DataParam(
            @JsonProperty("df_a") DataSide dfA,
            @JsonProperty("df_b") DataSide dfB
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record DataSide(String name, Map<String, String> vars) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record Parallelization(
            @JsonProperty("chunk_sizes") Map<String, Integer> chunkSizes,
            @JsonProperty("num_processes") Integer numProcesses
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record DatabaseInformation(
            @JsonProperty("jdbc_url") String jdbcUrl,
            String user,
            String password,
            String schema,
            @JsonProperty("pool_size") Integer poolSize
    ) {
    }
}
