package com.records.resolution.store;

import com.records.resolution.core.model.EntityAttributes;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Partial update of an entity. Null fields are left untouched; non-null fields replace
 * the stored value wholesale.
 */
public record EntityUpdate(
        Map<String, Object> attributes,
        Set<String> aliases,
        Integer mentionCount
) {
    public EntityUpdate {
        if (attributes != null) {
            EntityAttributes.validate(attributes);
            attributes = EntityAttributes.copyOf(attributes);
        }
        if (aliases != null) {
            aliases = Collections.unmodifiableSet(new LinkedHashSet<>(aliases));
        }
        if (mentionCount != null && mentionCount < 0) {
            throw new IllegalArgumentException("mentionCount must not be negative");
        }
    }

    public boolean isEmpty() {
        return attributes == null && aliases == null && mentionCount == null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Map<String, Object> attributes;
        private Set<String> aliases;
        private Integer mentionCount;

        public Builder attributes(Map<String, Object> attributes) {
            this.attributes = attributes;
            return this;
        }

        public Builder aliases(Collection<String> aliases) {
            this.aliases = aliases != null ? new LinkedHashSet<>(aliases) : null;
            return this;
        }

        public Builder mentionCount(int mentionCount) {
            this.mentionCount = mentionCount;
            return this;
        }

        public EntityUpdate build() {
            return new EntityUpdate(attributes, aliases, mentionCount);
        }
    }
}
