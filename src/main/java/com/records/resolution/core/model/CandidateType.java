package com.records.resolution.core.model;

import java.util.Locale;

/**
 * Entity kinds reported by public-records sources.
 * Committees are stored as organizations, contracts and filings as events.
 */
public enum CandidateType {
    PERSON("person", EntityType.PERSON, true),
    ORGANIZATION("organization", EntityType.ORGANIZATION, true),
    COMMITTEE("committee", EntityType.ORGANIZATION, true),
    CONTRACT("contract", EntityType.EVENT, false),
    FILING("filing", EntityType.EVENT, false),
    LOCATION("location", EntityType.LOCATION, false),
    TOPIC("topic", EntityType.TOPIC, false);

    private final String key;
    private final EntityType entityType;
    private final boolean fuzzyTypeScoped;

    CandidateType(String key, EntityType entityType, boolean fuzzyTypeScoped) {
        this.key = key;
        this.entityType = entityType;
        this.fuzzyTypeScoped = fuzzyTypeScoped;
    }

    public String getKey() {
        return key;
    }

    /**
     * Graph type a newly created entity of this kind receives.
     */
    public EntityType toEntityType() {
        return entityType;
    }

    /**
     * Whether fuzzy matching only considers stored entities of the mapped graph type.
     * Other kinds are compared against every entity.
     */
    public boolean isFuzzyTypeScoped() {
        return fuzzyTypeScoped;
    }

    /**
     * Parses a source-supplied type key such as {@code "committee"}.
     * Keys no source vocabulary defines map to {@link #ORGANIZATION}.
     *
     * @throws IllegalArgumentException if the key is null or blank
     */
    public static CandidateType fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Candidate type must not be null or blank");
        }
        String lower = key.trim().toLowerCase(Locale.ROOT);
        for (CandidateType type : values()) {
            if (type.key.equals(lower)) {
                return type;
            }
        }
        return ORGANIZATION;
    }
}
