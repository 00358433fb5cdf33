package com.record.linkage.core.model;

/**
 * Type of linkage being performed.
 * Only {@link #DEDUP} changes pairing semantics: the record set is joined
 * against itself and self-pairs and mirrored pairs are excluded.
 */
public enum MatchType {
    ONE_TO_ONE("1:1"),
    ONE_TO_MANY("1:M"),
    MANY_TO_MANY("M:M"),
    DEDUP("dedup");

    private final String code;

    MatchType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isDedup() {
        return this == DEDUP;
    }

    /**
     * Parses a match type from its configuration code ({@code 1:1}, {@code 1:M},
     * {@code M:M}, {@code dedup}) or its enum name.
     *
     * @throws IllegalArgumentException if the value is not a known match type
     */
    public static MatchType fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Match type must not be null or blank");
        }
        String trimmed = value.trim();
        for (MatchType type : values()) {
            if (type.code.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown match type: '" + value + "'");
    }
}
