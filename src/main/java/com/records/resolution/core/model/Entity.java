package com.records.resolution.core.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Represents an entity node in the knowledge graph.
 * Instances are immutable snapshots; changes go through the store.
 */
public final class Entity {
    public static final int DEFAULT_IMPORTANCE = 5;

    private final String id;
    private final EntityType type;
    private final String name;
    private final Set<String> aliases;
    private final Map<String, Object> attributes;
    private final String description;
    private final int importance;
    private final int mentionCount;
    private final Instant createdAt;

    private Entity(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.aliases = builder.aliases != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(builder.aliases)) : Set.of();
        this.attributes = EntityAttributes.copyOf(builder.attributes);
        this.description = builder.description;
        this.importance = builder.importance;
        this.mentionCount = builder.mentionCount;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public EntityType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public Set<String> getAliases() {
        return aliases;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public String getDescription() {
        return description;
    }

    public int getImportance() {
        return importance;
    }

    public int getMentionCount() {
        return mentionCount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Returns the attribute value for a strong identifier, or null.
     */
    public String getIdentifier(IdentifierKind kind) {
        Object value = attributes.get(kind.getAttributeKey());
        return value != null ? value.toString() : null;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .type(type)
                .name(name)
                .aliases(aliases)
                .attributes(attributes)
                .description(description)
                .importance(importance)
                .mentionCount(mentionCount)
                .createdAt(createdAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return Objects.equals(id, entity.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", name='" + name + '\'' +
                ", mentionCount=" + mentionCount +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private EntityType type;
        private String name;
        private Collection<String> aliases;
        private Map<String, ?> attributes;
        private String description;
        private int importance = DEFAULT_IMPORTANCE;
        private int mentionCount = 1;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(EntityType type) {
            this.type = type;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder aliases(Collection<String> aliases) {
            this.aliases = aliases;
            return this;
        }

        public Builder attributes(Map<String, ?> attributes) {
            this.attributes = attributes;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder importance(int importance) {
            this.importance = importance;
            return this;
        }

        public Builder mentionCount(int mentionCount) {
            this.mentionCount = mentionCount;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Entity build() {
            Objects.requireNonNull(type, "type is required");
            Objects.requireNonNull(name, "name is required");
            if (mentionCount < 0) {
                throw new IllegalArgumentException("mentionCount must not be negative");
            }
            return new Entity(this);
        }
    }
}
