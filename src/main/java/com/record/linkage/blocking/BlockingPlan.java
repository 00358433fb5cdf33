package com.record.linkage.blocking;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The ordered pass plan of a run: ground-truth passes in configuration order,
 * followed by numbered passes in ascending numeric order.
 */
public final class BlockingPlan {

    public static final int DEFAULT_CHUNK_SIZE = 50_000;

    private final List<PassDefinition> groundTruthPasses;
    private final List<PassDefinition> numberedPasses;

    private BlockingPlan(List<PassDefinition> groundTruthPasses, List<PassDefinition> numberedPasses) {
        this.groundTruthPasses = List.copyOf(groundTruthPasses);
        this.numberedPasses = List.copyOf(numberedPasses);
    }

    public List<PassDefinition> getGroundTruthPasses() {
        return groundTruthPasses;
    }

    public List<PassDefinition> getNumberedPasses() {
        return numberedPasses;
    }

    /**
     * Returns every pass in execution order.
     */
    public List<PassDefinition> orderedPasses() {
        List<PassDefinition> all = new ArrayList<>(groundTruthPasses.size() + numberedPasses.size());
        all.addAll(groundTruthPasses);
        all.addAll(numberedPasses);
        return all;
    }

    public Optional<PassDefinition> findPass(String name) {
        return orderedPasses().stream().filter(p -> p.name().equals(name)).findFirst();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int defaultChunkSize = DEFAULT_CHUNK_SIZE;
        private final List<String> groundTruthFields = new ArrayList<>();
        private final Map<String, List<String>> variablesByPass = new LinkedHashMap<>();
        private final Map<String, Integer> chunkSizesByPass = new LinkedHashMap<>();

        public Builder defaultChunkSize(int defaultChunkSize) {
            if (defaultChunkSize <= 0) {
                throw new IllegalArgumentException("defaultChunkSize must be positive");
            }
            this.defaultChunkSize = defaultChunkSize;
            return this;
        }

        public Builder groundTruth(String... fields) {
            groundTruthFields.addAll(List.of(fields));
            return this;
        }

        public Builder groundTruth(List<String> fields) {
            groundTruthFields.addAll(fields);
            return this;
        }

        public Builder pass(int number, String... variables) {
            return pass(Integer.toString(number), List.of(variables));
        }

        /**
         * Adds a numbered pass. A null or empty variable list keeps the pass in the plan;
         * it is skipped at run time.
         */
        public Builder pass(String key, List<String> variables) {
            if (variables == null) {
                variablesByPass.put(key, List.of());
                return this;
            }
            if (variables.contains(null)) {
                throw new IllegalArgumentException("Pass '" + key + "' has a null blocking variable");
            }
            variablesByPass.put(key, List.copyOf(variables));
            return this;
        }

        public Builder pass(String key, List<String> variables, int chunkSize) {
            pass(key, variables);
            return chunkSize(key, chunkSize);
        }

        /**
         * Sets the chunk size of a pass (or of a ground-truth pass, keyed {@code dup_<field>}).
         */
        public Builder chunkSize(String key, int chunkSize) {
            if (chunkSize <= 0) {
                throw new IllegalArgumentException("chunkSize for pass '" + key + "' must be positive");
            }
            chunkSizesByPass.put(key, chunkSize);
            return this;
        }

        public BlockingPlan build() {
            List<PassDefinition> groundTruth = new ArrayList<>();
            Set<String> seenFields = new HashSet<>();
            for (String field : groundTruthFields) {
                if (!seenFields.add(field)) {
                    throw new IllegalArgumentException("Duplicate ground-truth field: '" + field + "'");
                }
                String name = PassDefinition.GROUND_TRUTH_PREFIX + field;
                groundTruth.add(PassDefinition.groundTruth(field,
                        chunkSizesByPass.getOrDefault(name, defaultChunkSize)));
            }

            List<PassDefinition> numbered = new ArrayList<>();
            Set<Integer> seenNumbers = new HashSet<>();
            for (Map.Entry<String, List<String>> entry : variablesByPass.entrySet()) {
                PassDefinition pass = PassDefinition.numbered(entry.getKey(), entry.getValue(),
                        chunkSizeFor(entry.getKey()));
                if (!seenNumbers.add(pass.number())) {
                    throw new IllegalArgumentException("Duplicate pass number " + pass.number() +
                            " (key '" + entry.getKey() + "')");
                }
                numbered.add(pass);
            }
            numbered.sort(Comparator.comparingInt(PassDefinition::number));
            return new BlockingPlan(groundTruth, numbered);
        }

        private int chunkSizeFor(String key) {
            Integer byKey = chunkSizesByPass.get(key);
            if (byKey != null) {
                return byKey;
            }
            // chunk sizes may also be keyed by the bare pass number
            String digits = key.replaceAll("\\D+", "");
            return chunkSizesByPass.getOrDefault(digits, defaultChunkSize);
        }
    }
}
