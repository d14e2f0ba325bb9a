package com.records.resolution.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Directed, typed edge between two live entities.
 *
 * <p>When an entity is merged away every relationship that touched it is re-pointed to
 * the surviving entity, so no relationship ever references a deleted id.</p>
 */
public final class Relationship {

    private final String id;
    private final String sourceEntityId;
    private final String targetEntityId;
    private final String relationshipType;
    private final Map<String, Object> properties;
    private final Instant createdAt;

    private Relationship(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.sourceEntityId = Objects.requireNonNull(builder.sourceEntityId, "sourceEntityId is required");
        this.targetEntityId = Objects.requireNonNull(builder.targetEntityId, "targetEntityId is required");
        this.relationshipType = Objects.requireNonNull(builder.relationshipType, "relationshipType is required");
        this.properties = EntityAttributes.copyOf(builder.properties);
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getSourceEntityId() {
        return sourceEntityId;
    }

    public String getTargetEntityId() {
        return targetEntityId;
    }

    public String getRelationshipType() {
        return relationshipType;
    }

    public Map<String, Object> getProperties() {
        return properties;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Returns true if the entity is either endpoint of this relationship.
     */
    public boolean touches(String entityId) {
        return sourceEntityId.equals(entityId) || targetEntityId.equals(entityId);
    }

    /**
     * Copy of this relationship with every endpoint equal to {@code fromId} replaced by {@code toId}.
     */
    public Relationship repoint(String fromId, String toId) {
        return toBuilder()
                .sourceEntityId(sourceEntityId.equals(fromId) ? toId : sourceEntityId)
                .targetEntityId(targetEntityId.equals(fromId) ? toId : targetEntityId)
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .sourceEntityId(sourceEntityId)
                .targetEntityId(targetEntityId)
                .relationshipType(relationshipType)
                .properties(properties)
                .createdAt(createdAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Relationship that = (Relationship) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Relationship{" +
                "id='" + id + '\'' +
                ", sourceEntityId='" + sourceEntityId + '\'' +
                ", targetEntityId='" + targetEntityId + '\'' +
                ", type='" + relationshipType + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String sourceEntityId;
        private String targetEntityId;
        private String relationshipType;
        private Map<String, ?> properties;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sourceEntityId(String sourceEntityId) {
            this.sourceEntityId = sourceEntityId;
            return this;
        }

        public Builder targetEntityId(String targetEntityId) {
            this.targetEntityId = targetEntityId;
            return this;
        }

        public Builder relationshipType(String relationshipType) {
            this.relationshipType = relationshipType;
            return this;
        }

        public Builder properties(Map<String, ?> properties) {
            this.properties = properties;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Relationship build() {
            return new Relationship(this);
        }
    }
}
