package com.records.resolution.graph;

import com.records.resolution.core.model.EntityCandidate;
import com.records.resolution.rules.NormalizationEngine;

/**
 * Input validation utility for entity resolution operations.
 * Rejects input that cannot be resolved meaningfully or stored safely.
 */
public final class InputSanitizer {

    /** Maximum allowed length for entity names. */
    public static final int MAX_ENTITY_NAME_LENGTH = 1000;

    /** Maximum allowed length for source names. */
    public static final int MAX_SOURCE_LENGTH = 200;

    private InputSanitizer() {
        // utility class
    }

    /**
     * Validates an entity name for resolution.
     * Rejects null, blank, overly long, or control-character-containing names.
     *
     * @param name the entity name to validate
     * @throws IllegalArgumentException if the name is invalid
     */
    public static void validateEntityName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Entity name must not be null or blank");
        }
        if (name.length() > MAX_ENTITY_NAME_LENGTH) {
            throw new IllegalArgumentException(
                    "Entity name exceeds maximum length of " + MAX_ENTITY_NAME_LENGTH +
                            " characters (was " + name.length() + ")");
        }
        if (containsControlCharacters(name)) {
            throw new IllegalArgumentException("Entity name must not contain control characters");
        }
    }

    /**
     * Validates a candidate before resolution, including that its name survives normalization.
     * A name such as {@code "Inc."} normalizes to nothing and would match arbitrary entities.
     *
     * @throws IllegalArgumentException if the candidate is invalid
     */
    public static void validateCandidate(EntityCandidate candidate, NormalizationEngine normalizationEngine) {
        if (candidate == null) {
            throw new IllegalArgumentException("Candidate must not be null");
        }
        validateEntityName(candidate.getName());
        if (normalizationEngine.normalize(candidate.getName()).isEmpty()) {
            throw new IllegalArgumentException(
                    "Entity name '" + candidate.getName() + "' is empty after normalization");
        }
        String source = candidate.getSource();
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Candidate source must not be null or blank");
        }
        if (source.length() > MAX_SOURCE_LENGTH || containsControlCharacters(source)) {
            throw new IllegalArgumentException("Candidate source is not a valid source name: '" + source + "'");
        }
    }

    /**
     * Validates a relationship type string.
     * Only alphanumeric characters and underscores are allowed.
     *
     * @param relationshipType the relationship type to validate
     * @throws IllegalArgumentException if the type is invalid
     */
    public static void validateRelationshipType(String relationshipType) {
        if (relationshipType == null || relationshipType.isBlank()) {
            throw new IllegalArgumentException("Relationship type must not be null or blank");
        }
        if (!relationshipType.matches("^[A-Za-z0-9_]+$")) {
            throw new IllegalArgumentException(
                    "Relationship type must contain only alphanumeric characters and underscores, " +
                            "got: '" + relationshipType + "'");
        }
    }

    /**
     * Validates an entity id supplied by a caller.
     */
    public static void validateEntityId(String entityId) {
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("Entity id must not be null or blank");
        }
    }

    /**
     * Checks whether a string contains ASCII control characters (0x00-0x1F, 0x7F),
     * excluding common whitespace characters (tab, newline, carriage return).
     */
    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 && c != '\t' && c != '\n' && c != '\r') {
                return true;
            }
            if (c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
