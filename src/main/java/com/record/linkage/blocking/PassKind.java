package com.record.linkage.blocking;

public enum PassKind {
    /** Keyed on one identifier field assumed to already indicate equivalence. Always runs first. */
    GROUND_TRUTH,
    /** A configured blocking pass, run in ascending numeric order. */
    NUMBERED
}
