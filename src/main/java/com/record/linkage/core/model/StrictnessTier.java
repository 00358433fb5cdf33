package com.record.linkage.core.model;

/**
 * Threshold classification of a candidate pair's match confidence.
 * Each tier is reported as its own output flag column.
 */
public enum StrictnessTier {
    STRICT("match_strict"),
    MODERATE("match_moderate"),
    RELAXED("match_relaxed"),
    REVIEW("match_review");

    private final String columnName;

    StrictnessTier(String columnName) {
        this.columnName = columnName;
    }

    public String getColumnName() {
        return columnName;
    }
}
