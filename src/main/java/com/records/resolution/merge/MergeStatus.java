package com.records.resolution.merge;

/**
 * Outcome of an entity merge.
 */
public enum MergeStatus {
    /** The duplicate was folded into the primary and deleted. */
    MERGED,
    /** Nothing was changed: an entity was missing or both ids were the same. */
    SKIPPED,
    /** A step failed; the primary was restored and the duplicate kept. */
    FAILED
}
