package com.records.resolution.core.model;

import java.util.Objects;

/**
 * Outcome of resolving one candidate observation.
 *
 * @param entityId   id of the matched or newly created entity
 * @param isNew      true when the cascade created the entity
 * @param confidence confidence of the decision, between 0.0 and 1.0
 * @param matchedBy  the cascade stage that produced the decision
 */
public record ResolvedEntity(
        String entityId,
        boolean isNew,
        double confidence,
        MatchMethod matchedBy
) {
    public ResolvedEntity {
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(matchedBy, "matchedBy is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        if (isNew != (matchedBy == MatchMethod.NEW)) {
            throw new IllegalArgumentException("isNew must be true exactly when matchedBy is NEW");
        }
    }

    public static ResolvedEntity created(String entityId) {
        return new ResolvedEntity(entityId, true, 1.0, MatchMethod.NEW);
    }

    public static ResolvedEntity matched(String entityId, MatchMethod method, double confidence) {
        return new ResolvedEntity(entityId, false, confidence, method);
    }
}
