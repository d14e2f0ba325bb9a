package com.records.resolution.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An entity observation produced by a public-records source, awaiting resolution.
 */
public final class EntityCandidate {
    private final String name;
    private final CandidateType type;
    private final String source;
    private final Map<IdentifierKind, String> identifiers;
    private final Map<String, Object> attributes;
    private final Set<String> aliases;

    private EntityCandidate(Builder builder) {
        this.name = builder.name;
        this.type = builder.type;
        this.source = builder.source;
        this.identifiers = builder.identifiers.isEmpty()
                ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(builder.identifiers));
        this.attributes = EntityAttributes.copyOf(builder.attributes);
        this.aliases = builder.aliases != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(builder.aliases)) : Set.of();
    }

    public String getName() {
        return name;
    }

    public CandidateType getType() {
        return type;
    }

    public String getSource() {
        return source;
    }

    public Map<IdentifierKind, String> getIdentifiers() {
        return identifiers;
    }

    public String getIdentifier(IdentifierKind kind) {
        return identifiers.get(kind);
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Set<String> getAliases() {
        return aliases;
    }

    @Override
    public String toString() {
        return "EntityCandidate{" +
                "name='" + name + '\'' +
                ", type=" + type +
                ", source='" + source + '\'' +
                ", identifiers=" + identifiers.keySet() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private CandidateType type;
        private String source;
        private final Map<IdentifierKind, String> identifiers = new EnumMap<>(IdentifierKind.class);
        private Map<String, ?> attributes;
        private Collection<String> aliases;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(CandidateType type) {
            this.type = type;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        /**
         * Adds an identifier; blank values are ignored.
         */
        public Builder identifier(IdentifierKind kind, String value) {
            Objects.requireNonNull(kind, "kind is required");
            if (value != null && !value.isBlank()) {
                identifiers.put(kind, value.trim());
            }
            return this;
        }

        public Builder identifiers(Map<IdentifierKind, String> values) {
            if (values != null) {
                values.forEach(this::identifier);
            }
            return this;
        }

        public Builder attributes(Map<String, ?> attributes) {
            this.attributes = attributes;
            return this;
        }

        public Builder aliases(Collection<String> aliases) {
            this.aliases = aliases;
            return this;
        }

        public EntityCandidate build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(type, "type is required");
            Objects.requireNonNull(source, "source is required");
            EntityAttributes.validate(attributes);
            return new EntityCandidate(this);
        }
    }
}
