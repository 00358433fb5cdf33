package com.record.linkage.core.model;

/**
 * Identifies which record set a column reference belongs to.
 * Dedup runs still use both sides; they simply point at the same record set.
 */
public enum Side {
    A,
    B
}
