package com.records.resolution.core.model;

import java.util.Objects;

/**
 * Two stored entities whose names are similar enough to be likely duplicates.
 */
public record DuplicatePair(
        String firstEntityId,
        String secondEntityId,
        String firstName,
        String secondName,
        double score
) {
    public DuplicatePair {
        Objects.requireNonNull(firstEntityId, "firstEntityId is required");
        Objects.requireNonNull(secondEntityId, "secondEntityId is required");
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0");
        }
    }

    /**
     * Returns true if this pair refers to the given entity on either side.
     */
    public boolean involves(String entityId) {
        return firstEntityId.equals(entityId) || secondEntityId.equals(entityId);
    }
}
