package com.records.resolution.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Helpers for the open attribute map carried by entities.
 *
 * <p>Attribute values are restricted to strings, booleans, numbers and lists of those.
 * A few keys are maintained by the library itself:</p>
 * <ul>
 *   <li>{@link #SOURCES} - names of every source that reported the entity</li>
 *   <li>{@link #DISCOVERED_AT} - ISO-8601 instant of creation</li>
 *   <li>{@link #LAST_UPDATED} - ISO-8601 instant of the last attribute merge</li>
 * </ul>
 */
public final class EntityAttributes {

    public static final String SOURCES = "sources";
    public static final String DISCOVERED_AT = "discoveredAt";
    public static final String LAST_UPDATED = "lastUpdated";

    private EntityAttributes() {
        // Utility class
    }

    /**
     * Checks that a value is one of the supported attribute kinds.
     */
    public static boolean isSupportedValue(Object value) {
        if (isScalar(value)) {
            return true;
        }
        if (value instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (!isScalar(element)) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    /**
     * Validates every value of the given map.
     *
     * @throws IllegalArgumentException naming the first offending key
     */
    public static void validate(Map<String, ?> attributes) {
        if (attributes == null) {
            return;
        }
        for (Map.Entry<String, ?> entry : attributes.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new IllegalArgumentException("Attribute keys must not be blank");
            }
            if (!isSupportedValue(entry.getValue())) {
                Object value = entry.getValue();
                throw new IllegalArgumentException("Unsupported value for attribute '" + entry.getKey()
                        + "': " + (value == null ? "null" : value.getClass().getSimpleName()));
            }
        }
    }

    /**
     * Returns an unmodifiable, insertion-ordered copy. List values are copied as well.
     */
    public static Map<String, Object> copyOf(Map<String, ?> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : attributes.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Collection<?> collection) {
                value = List.copyOf(collection);
            }
            copy.put(entry.getKey(), value);
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Reads the {@link #SOURCES} list, tolerating a single string value.
     */
    public static List<String> sources(Map<String, ?> attributes) {
        Object raw = attributes == null ? null : attributes.get(SOURCES);
        if (raw == null) {
            return List.of();
        }
        if (raw instanceof Collection<?> collection) {
            List<String> result = new ArrayList<>(collection.size());
            for (Object element : collection) {
                result.add(String.valueOf(element));
            }
            return result;
        }
        return List.of(String.valueOf(raw));
    }

    /**
     * Order-preserving union of existing sources with one more source.
     */
    public static List<String> unionSources(List<String> existing, String source) {
        Set<String> union = new LinkedHashSet<>(existing);
        if (source != null) {
            union.add(source);
        }
        return List.copyOf(union);
    }

    private static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Boolean || value instanceof Number;
    }
}
