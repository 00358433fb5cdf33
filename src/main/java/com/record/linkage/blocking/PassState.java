package com.record.linkage.blocking;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a single pass:
 * {@code PENDING -> GENERATING -> STREAMING -> EXHAUSTED}, with
 * {@code GENERATING -> SKIPPED} for empty or unmapped blocking variables and
 * {@code STREAMING -> SKIPPED} when no candidate set exists.
 */
public enum PassState {
    PENDING,
    GENERATING,
    STREAMING,
    EXHAUSTED,
    SKIPPED;

    public boolean isTerminal() {
        return this == EXHAUSTED || this == SKIPPED;
    }

    public boolean canTransitionTo(PassState next) {
        return allowedNext().contains(next);
    }

    private Set<PassState> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(GENERATING);
            case GENERATING -> EnumSet.of(STREAMING, SKIPPED);
            case STREAMING -> EnumSet.of(EXHAUSTED, SKIPPED);
            case EXHAUSTED, SKIPPED -> EnumSet.noneOf(PassState.class);
        };
    }
}
