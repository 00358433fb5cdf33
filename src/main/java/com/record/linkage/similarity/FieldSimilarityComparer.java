package com.record.linkage.similarity;

import com.record.linkage.api.PairComparer;
import com.record.linkage.core.model.CandidateChunk;
import com.record.linkage.core.model.CandidatePair;
import com.record.linkage.core.model.RecordSet;
import com.record.linkage.core.model.ScoredPair;
import com.record.linkage.core.model.SourceRecord;
import com.record.linkage.core.model.StrictnessTier;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reference comparer that scores each comparer variable of the pass with a
 * {@link SimilarityAlgorithm} and flags tiers by the mean score.
 *
 * <p>A variable that is unmapped or blank on either side gets no score and does not
 * count toward the mean. A pair without any score is in no tier.</p>
 */
public class FieldSimilarityComparer implements PairComparer {

    private final Map<String, List<String>> variablesByPass;
    private final SimilarityAlgorithm defaultAlgorithm;
    private final Map<String, SimilarityAlgorithm> algorithmsByVariable;
    private final TierThresholds thresholds;

    private FieldSimilarityComparer(Builder builder) {
        this.variablesByPass = Map.copyOf(builder.variablesByPass);
        this.defaultAlgorithm = builder.defaultAlgorithm;
        this.algorithmsByVariable = Map.copyOf(builder.algorithmsByVariable);
        this.thresholds = builder.thresholds;
    }

    @Override
    public List<ScoredPair> compare(CandidateChunk chunk, RecordSet recordsA, RecordSet recordsB) {
        List<String> variables = variablesByPass.getOrDefault(chunk.passName(), List.of());
        List<ScoredPair> scored = new ArrayList<>(chunk.size());
        for (CandidatePair pair : chunk.pairs()) {
            SourceRecord a = recordsA.byOrdinal(pair.ordinalA());
            SourceRecord b = recordsB.byOrdinal(pair.ordinalB());
            Map<String, Double> scores = new LinkedHashMap<>();
            for (String variable : variables) {
                Optional<String> valueA = valueOf(a, recordsA, variable);
                Optional<String> valueB = valueOf(b, recordsB, variable);
                if (valueA.isPresent() && valueB.isPresent()) {
                    scores.put(variable, algorithmFor(variable).compute(valueA.get(), valueB.get()));
                }
            }
            scored.add(new ScoredPair(pair, scores, tiers(scores)));
        }
        return scored;
    }

    private Set<StrictnessTier> tiers(Map<String, Double> scores) {
        if (scores.isEmpty()) {
            return Set.of();
        }
        double mean = scores.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        return thresholds.tiersFor(mean);
    }

    private static Optional<String> valueOf(SourceRecord record, RecordSet recordSet, String variable) {
        return recordSet.getFieldMap().column(variable)
                .filter(column -> !record.isEmpty(column))
                .map(record::value);
    }

    private SimilarityAlgorithm algorithmFor(String variable) {
        return algorithmsByVariable.getOrDefault(variable, defaultAlgorithm);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, List<String>> variablesByPass = new HashMap<>();
        private final Map<String, SimilarityAlgorithm> algorithmsByVariable = new HashMap<>();
        private SimilarityAlgorithm defaultAlgorithm = new JaroWinklerSimilarity();
        private TierThresholds thresholds = TierThresholds.defaults();

        public Builder variables(String passName, List<String> variables) {
            if (passName == null || passName.isBlank()) {
                throw new IllegalArgumentException("passName is required");
            }
            this.variablesByPass.put(passName, List.copyOf(variables));
            return this;
        }

        public Builder variablesByPass(Map<String, List<String>> variablesByPass) {
            variablesByPass.forEach(this::variables);
            return this;
        }

        public Builder defaultAlgorithm(SimilarityAlgorithm algorithm) {
            if (algorithm == null) {
                throw new IllegalArgumentException("algorithm is required");
            }
            this.defaultAlgorithm = algorithm;
            return this;
        }

        public Builder algorithm(String variable, SimilarityAlgorithm algorithm) {
            if (variable == null || algorithm == null) {
                throw new IllegalArgumentException("variable and algorithm are required");
            }
            this.algorithmsByVariable.put(variable, algorithm);
            return this;
        }

        public Builder thresholds(TierThresholds thresholds) {
            if (thresholds == null) {
                throw new IllegalArgumentException("thresholds is required");
            }
            this.thresholds = thresholds;
            return this;
        }

        public FieldSimilarityComparer build() {
            return new FieldSimilarityComparer(this);
        }
    }
}
