package com.record.linkage.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MatchResult Tests")
class MatchResultTest {

    private final CandidatePair pair = new CandidatePair("A1", "B1", 0, 0);

    @Test
    @DisplayName("Should carry scores and tiers of the scored pair")
    void fromScoredPair() {
        ScoredPair scored = new ScoredPair(pair, Map.of("first_name", 0.97),
                EnumSet.of(StrictnessTier.MODERATE, StrictnessTier.REVIEW));

        MatchResult result = MatchResult.of(scored, "2", 100.0);

        assertEquals("2", result.passName());
        assertEquals(100.0, result.weight());
        assertEquals(0.97, result.scores().get("first_name"));
        assertTrue(result.isMatch(StrictnessTier.MODERATE));
        assertFalse(result.isMatch(StrictnessTier.STRICT));
    }

    @Test
    @DisplayName("Ground-truth results match in every tier without scores")
    void groundTruth() {
        MatchResult result = MatchResult.groundTruth(pair, "dup_ssn", 1000.0);

        for (StrictnessTier tier : StrictnessTier.values()) {
            assertTrue(result.isMatch(tier));
        }
        assertTrue(result.scores().isEmpty());
    }

    @Test
    @DisplayName("Should reject negative weight")
    void rejectsNegativeWeight() {
        assertThrows(IllegalArgumentException.class,
                () -> new MatchResult(pair, "1", Map.of(), Set.of(), -1.0));
    }

    @Test
    @DisplayName("Should reject NaN and infinite weight")
    void rejectsNonFiniteWeight() {
        assertThrows(IllegalArgumentException.class,
                () -> new MatchResult(pair, "1", Map.of(), Set.of(), Double.NaN));
        assertThrows(IllegalArgumentException.class,
                () -> new MatchResult(pair, "1", Map.of(), Set.of(), Double.POSITIVE_INFINITY));
    }

    @Test
    @DisplayName("Tiers should be immutable")
    void tiersImmutable() {
        MatchResult result = new MatchResult(pair, "1", null, null, 1.0);

        assertTrue(result.tiers().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> result.tiers().add(StrictnessTier.STRICT));
    }
}
