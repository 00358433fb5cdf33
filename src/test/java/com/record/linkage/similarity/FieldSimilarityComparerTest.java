package com.record.linkage.similarity;

import com.record.linkage.core.model.CandidateChunk;
import com.record.linkage.core.model.CandidatePair;
import com.record.linkage.core.model.RecordSet;
import com.record.linkage.core.model.ScoredPair;
import com.record.linkage.core.model.StrictnessTier;
import com.record.linkage.fixtures.TestRecordSets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FieldSimilarityComparer Tests")
class FieldSimilarityComparerTest {

    private final RecordSet census = TestRecordSets.builder("census")
            .field("indv_id", "id").field("first_name", "fname").field("dob", "birth")
            .row("A0", "fname", "MARTHA", "birth", "1980-01-01")
            .row("A1", "fname", "JOHN", "birth", null)
            .build();

    private final RecordSet claims = TestRecordSets.builder("claims")
            .field("indv_id", "id").field("first_name", "given").field("dob", "dob")
            .row("B0", "given", "MARHTA", "dob", "1980-01-01")
            .row("B1", "given", "JOHN", "dob", "1975-05-05")
            .build();

    private static CandidateChunk chunk(String pass, CandidatePair... pairs) {
        return new CandidateChunk(pass, 0, List.of(pairs));
    }

    @Test
    @DisplayName("Scores the pass variables and flags tiers by the mean")
    void scoresPassVariables() {
        FieldSimilarityComparer comparer = FieldSimilarityComparer.builder()
                .variables("1", List.of("first_name", "dob"))
                .algorithm("dob", new ExactSimilarity())
                .build();

        List<ScoredPair> scored = comparer.compare(
                chunk("1", new CandidatePair("A0", "B0", 0, 0)), census, claims);

        assertEquals(1, scored.size());
        Map<String, Double> scores = scored.get(0).scores();
        assertEquals(0.961, scores.get("first_name"), 0.001);
        assertEquals(1.0, scores.get("dob"));
        assertEquals(EnumSet.allOf(StrictnessTier.class), scored.get(0).tiers());
    }

    @Test
    @DisplayName("Blank values are not scored and do not drag the mean down")
    void blankValuesSkipped() {
        FieldSimilarityComparer comparer = FieldSimilarityComparer.builder()
                .variables("1", List.of("first_name", "dob"))
                .build();

        ScoredPair scored = comparer.compare(
                chunk("1", new CandidatePair("A1", "B1", 1, 1)), census, claims).get(0);

        assertEquals(Map.of("first_name", 1.0), scored.scores());
        assertTrue(scored.tiers().contains(StrictnessTier.STRICT));
    }

    @Test
    @DisplayName("Passes without comparer variables yield unscored pairs in no tier")
    void noVariables() {
        FieldSimilarityComparer comparer = FieldSimilarityComparer.builder()
                .variables("1", List.of("first_name"))
                .build();

        ScoredPair scored = comparer.compare(
                chunk("2", new CandidatePair("A0", "B0", 0, 0)), census, claims).get(0);

        assertTrue(scored.scores().isEmpty());
        assertTrue(scored.tiers().isEmpty());
    }

    @Test
    @DisplayName("Unmapped variables are ignored")
    void unmappedVariable() {
        FieldSimilarityComparer comparer = FieldSimilarityComparer.builder()
                .variables("1", List.of("last_name", "first_name"))
                .defaultAlgorithm(new LevenshteinSimilarity())
                .build();

        ScoredPair scored = comparer.compare(
                chunk("1", new CandidatePair("A1", "B1", 1, 1)), census, claims).get(0);

        assertEquals(Map.of("first_name", 1.0), scored.scores());
    }

    @Test
    @DisplayName("Builder rejects missing arguments")
    void builderValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> FieldSimilarityComparer.builder().variables(" ", List.of("dob")));
        assertThrows(IllegalArgumentException.class,
                () -> FieldSimilarityComparer.builder().thresholds(null));
        assertThrows(IllegalArgumentException.class,
                () -> FieldSimilarityComparer.builder().defaultAlgorithm(null));
    }
}
