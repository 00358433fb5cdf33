package com.record.linkage.api;

import com.record.linkage.blocking.BlockingPlan;
import com.record.linkage.core.model.MatchType;
import com.record.linkage.dispatch.DispatchPolicy;
import com.record.linkage.output.WeightScheme;
import com.record.linkage.relational.RelationalSettings;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Options for a matching run.
 *
 * <p>Without {@link RelationalSettings} (and without a data source given to the engine)
 * the run blocks in memory.</p>
 */
public class MatchOptions {

    private static final int DEFAULT_PARALLELISM = 4;

    private final MatchType matchType;
    private final BlockingPlan blockingPlan;
    private final int parallelism;
    private final int batchThreshold;
    private final Map<String, List<String>> comparerVariablesByPass;
    private final Path outputDirectory;
    private final RelationalSettings relationalSettings;
    private final int chunkRetries;
    private final Duration taskTimeout;
    private final WeightScheme weightScheme;

    private MatchOptions(Builder builder) {
        this.matchType = builder.matchType;
        this.blockingPlan = builder.blockingPlan;
        this.parallelism = builder.parallelism;
        this.batchThreshold = builder.batchThreshold > 0 ? builder.batchThreshold : 2 * builder.parallelism;
        this.comparerVariablesByPass = copy(builder.comparerVariablesByPass);
        this.outputDirectory = builder.outputDirectory;
        this.relationalSettings = builder.relationalSettings;
        this.chunkRetries = builder.chunkRetries;
        this.taskTimeout = builder.taskTimeout;
        this.weightScheme = builder.weightScheme;
    }

    private static Map<String, List<String>> copy(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((pass, variables) -> copy.put(pass, List.copyOf(variables)));
        return Collections.unmodifiableMap(copy);
    }

    public MatchType getMatchType() {
        return matchType;
    }

    public BlockingPlan getBlockingPlan() {
        return blockingPlan;
    }

    public int getParallelism() {
        return parallelism;
    }

    public int getBatchThreshold() {
        return batchThreshold;
    }

    /**
     * Comparer variables keyed by pass name, in declaration order.
     */
    public Map<String, List<String>> getComparerVariablesByPass() {
        return comparerVariablesByPass;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public Optional<RelationalSettings> getRelationalSettings() {
        return Optional.ofNullable(relationalSettings);
    }

    public int getChunkRetries() {
        return chunkRetries;
    }

    public Optional<Duration> getTaskTimeout() {
        return Optional.ofNullable(taskTimeout);
    }

    public Optional<WeightScheme> getWeightScheme() {
        return Optional.ofNullable(weightScheme);
    }

    public DispatchPolicy getDispatchPolicy() {
        return new DispatchPolicy(parallelism, batchThreshold, chunkRetries, taskTimeout);
    }

    /**
     * Union of all comparer variables, first declaration wins the position.
     */
    public List<String> comparerColumns() {
        Set<String> columns = new LinkedHashSet<>();
        comparerVariablesByPass.values().forEach(columns::addAll);
        return new ArrayList<>(columns);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MatchType matchType;
        private BlockingPlan blockingPlan;
        private int parallelism = DEFAULT_PARALLELISM;
        private int batchThreshold;
        private final Map<String, List<String>> comparerVariablesByPass = new LinkedHashMap<>();
        private Path outputDirectory;
        private RelationalSettings relationalSettings;
        private int chunkRetries;
        private Duration taskTimeout;
        private WeightScheme weightScheme;

        public Builder matchType(MatchType matchType) {
            this.matchType = matchType;
            return this;
        }

        public Builder blockingPlan(BlockingPlan blockingPlan) {
            this.blockingPlan = blockingPlan;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        /**
         * Pending chunks per batch. Defaults to twice the parallelism.
         */
        public Builder batchThreshold(int batchThreshold) {
            if (batchThreshold <= 0) {
                throw new IllegalArgumentException("batchThreshold must be positive");
            }
            this.batchThreshold = batchThreshold;
            return this;
        }

        public Builder comparerVariables(String passName, List<String> variables) {
            if (passName == null || passName.isBlank()) {
                throw new IllegalArgumentException("passName is required");
            }
            if (variables == null) {
                throw new IllegalArgumentException("variables are required");
            }
            this.comparerVariablesByPass.put(passName, List.copyOf(variables));
            return this;
        }

        public Builder comparerVariablesByPass(Map<String, List<String>> variablesByPass) {
            variablesByPass.forEach(this::comparerVariables);
            return this;
        }

        public Builder outputDirectory(Path outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder relationalSettings(RelationalSettings relationalSettings) {
            this.relationalSettings = relationalSettings;
            return this;
        }

        public Builder chunkRetries(int chunkRetries) {
            if (chunkRetries < 0) {
                throw new IllegalArgumentException("chunkRetries must be >= 0");
            }
            this.chunkRetries = chunkRetries;
            return this;
        }

        public Builder taskTimeout(Duration taskTimeout) {
            if (taskTimeout != null && (taskTimeout.isNegative() || taskTimeout.isZero())) {
                throw new IllegalArgumentException("taskTimeout must be positive");
            }
            this.taskTimeout = taskTimeout;
            return this;
        }

        public Builder weightScheme(WeightScheme weightScheme) {
            this.weightScheme = weightScheme;
            return this;
        }

        public MatchOptions build() {
            if (matchType == null) {
                throw new IllegalArgumentException("matchType is required");
            }
            if (blockingPlan == null) {
                throw new IllegalArgumentException("blockingPlan is required");
            }
            if (outputDirectory == null) {
                throw new IllegalArgumentException("outputDirectory is required");
            }
            return new MatchOptions(this);
        }
    }
}
