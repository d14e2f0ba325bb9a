package com.records.resolution.core.model;

/**
 * Types of nodes stored in the knowledge graph.
 * Candidate types reported by sources are mapped onto this set, see {@link CandidateType}.
 */
public enum EntityType {
    PERSON("Person"),
    ORGANIZATION("Organization"),
    EVENT("Event"),
    LOCATION("Location"),
    TOPIC("Topic");

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
