package com.record.linkage.similarity;

import com.record.linkage.core.model.StrictnessTier;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TierThresholdsTest {

    @Test
    void defaults_nestTiers() {
        TierThresholds thresholds = TierThresholds.defaults();

        assertEquals(EnumSet.allOf(StrictnessTier.class), thresholds.tiersFor(0.97));
        assertEquals(EnumSet.of(StrictnessTier.RELAXED, StrictnessTier.REVIEW), thresholds.tiersFor(0.87));
        assertEquals(EnumSet.of(StrictnessTier.REVIEW), thresholds.tiersFor(0.75));
        assertEquals(Set.of(), thresholds.tiersFor(0.5));
        assertEquals(0.90, thresholds.minimum(StrictnessTier.MODERATE));
    }

    @Test
    void of_rejectsOutOfRangeOrIncreasingValues() {
        assertThrows(IllegalArgumentException.class, () -> TierThresholds.of(1.1, 0.9, 0.8, 0.7));
        assertThrows(IllegalArgumentException.class, () -> TierThresholds.of(0.9, 0.9, 0.8, -0.1));
        assertThrows(IllegalArgumentException.class, () -> TierThresholds.of(0.8, 0.9, 0.7, 0.6));
    }
}
