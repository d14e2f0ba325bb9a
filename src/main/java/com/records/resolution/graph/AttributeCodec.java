package com.records.resolution.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.records.resolution.store.StorageException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serializes attribute maps to the JSON strings stored on graph nodes and edges.
 * Graph properties cannot hold nested maps, so the whole map is kept as one string.
 */
public class AttributeCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public AttributeCodec() {
        this(new ObjectMapper());
    }

    public AttributeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(Map<String, ?> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(attributes);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize attributes", e);
        }
    }

    public Map<String, Object> decode(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to deserialize attributes: " + e.getOriginalMessage(), e);
        }
    }
}
