package com.records.resolution.graph;

import com.records.resolution.core.model.Entity;
import com.records.resolution.core.model.EntityType;
import com.records.resolution.core.model.IdentifierKind;
import com.records.resolution.core.model.Relationship;
import com.records.resolution.store.EntityStore;
import com.records.resolution.store.EntityUpdate;
import com.records.resolution.store.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link EntityStore} backed by a FalkorDB graph.
 * Driver failures surface as {@link StorageException}.
 */
public class GraphEntityStore implements EntityStore {
    private static final Logger log = LoggerFactory.getLogger(GraphEntityStore.class);

    private final CypherExecutor executor;
    private final AttributeCodec codec;

    public GraphEntityStore(GraphConnection connection) {
        this(new CypherExecutor(connection), new AttributeCodec());
    }

    public GraphEntityStore(CypherExecutor executor, AttributeCodec codec) {
        this.executor = executor;
        this.codec = codec;
    }

    @Override
    public Optional<Entity> findById(String id) {
        return firstEntity(guarded("findById", () -> executor.findEntityById(id)));
    }

    @Override
    public Optional<Entity> findByExactName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String nameKey = name.toLowerCase(Locale.ROOT);
        return firstEntity(guarded("findByExactName", () -> executor.findEntityByNameKey(nameKey)));
    }

    @Override
    public Optional<Entity> findByIdentifier(IdentifierKind kind, String value) {
        if (value == null) {
            return Optional.empty();
        }
        return firstEntity(guarded("findByIdentifier", () -> executor.findEntityByIdentifier(kind, value)));
    }

    @Override
    public List<Entity> listEntities(EntityType typeFilter, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        String type = typeFilter != null ? typeFilter.name() : null;
        return guarded("listEntities", () -> executor.listEntities(type, limit)).stream()
                .map(this::mapToEntity)
                .toList();
    }

    @Override
    public String insertEntity(Entity entity) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("id", entity.getId());
        properties.put("type", entity.getType().name());
        properties.put("name", entity.getName());
        properties.put("nameKey", entity.getName().toLowerCase(Locale.ROOT));
        properties.put("aliases", new ArrayList<>(entity.getAliases()));
        properties.put("attributes", codec.encode(entity.getAttributes()));
        if (entity.getDescription() != null) {
            properties.put("description", entity.getDescription());
        }
        properties.put("importance", entity.getImportance());
        properties.put("mentionCount", entity.getMentionCount());
        properties.put("createdAt", entity.getCreatedAt().toEpochMilli());
        identifierProperties(entity.getAttributes()).forEach((key, value) -> {
            if (value != null) {
                properties.put(key, value);
            }
        });

        guarded("insertEntity", () -> {
            executor.createEntity(properties);
            return null;
        });
        return entity.getId();
    }

    @Override
    public void updateEntity(String id, EntityUpdate update) {
        if (update.isEmpty()) {
            return;
        }
        Map<String, Object> properties = new LinkedHashMap<>();
        if (update.attributes() != null) {
            properties.put("attributes", codec.encode(update.attributes()));
            properties.putAll(identifierProperties(update.attributes()));
        }
        if (update.aliases() != null) {
            properties.put("aliases", new ArrayList<>(update.aliases()));
        }
        if (update.mentionCount() != null) {
            properties.put("mentionCount", update.mentionCount());
        }
        boolean found = guarded("updateEntity", () -> executor.updateEntity(id, properties));
        if (!found) {
            throw new StorageException("Entity not found: " + id);
        }
    }

    @Override
    public void deleteEntity(String id) {
        guarded("deleteEntity", () -> {
            executor.deleteEntity(id);
            return null;
        });
    }

    @Override
    public int repointRelationships(String fromId, String toId) {
        int count = findRelationshipsByEntity(fromId).size();
        if (count == 0) {
            return 0;
        }
        guarded("repointRelationships", () -> {
            executor.repointRelationships(fromId, toId);
            return null;
        });
        return count;
    }

    @Override
    public Relationship createRelationship(Relationship relationship) {
        List<Map<String, Object>> created = guarded("createRelationship", () -> executor.createRelationship(
                relationship.getId(),
                relationship.getSourceEntityId(),
                relationship.getTargetEntityId(),
                relationship.getRelationshipType(),
                codec.encode(relationship.getProperties()),
                relationship.getCreatedAt().toEpochMilli()));
        if (created.isEmpty()) {
            throw new StorageException("Cannot create relationship " + relationship.getId()
                    + ": source or target entity not found");
        }
        return relationship;
    }

    @Override
    public List<Relationship> findRelationshipsByEntity(String entityId) {
        return guarded("findRelationshipsByEntity", () -> executor.findRelationshipsByEntity(entityId))
                .stream()
                .map(this::mapToRelationship)
                .toList();
    }

    /**
     * Identifier values mirrored to node properties. Absent identifiers map to null so an
     * update clears a property whose attribute has gone.
     */
    private Map<String, Object> identifierProperties(Map<String, Object> attributes) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (IdentifierKind kind : IdentifierKind.values()) {
            Object value = attributes.get(kind.getAttributeKey());
            result.put(kind.getAttributeKey(), value != null ? value.toString() : null);
        }
        return result;
    }

    private Optional<Entity> firstEntity(List<Map<String, Object>> rows) {
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mapToEntity(rows.get(0)));
    }

    private Entity mapToEntity(Map<String, Object> row) {
        Entity.Builder builder = Entity.builder()
                .id((String) row.get("id"))
                .type(EntityType.valueOf((String) row.get("type")))
                .name((String) row.get("name"))
                .aliases(toStrings(row.get("aliases")))
                .attributes(codec.decode((String) row.get("attributes")))
                .description((String) row.get("description"));

        Object importance = row.get("importance");
        if (importance instanceof Number number) {
            builder.importance(number.intValue());
        }
        Object mentionCount = row.get("mentionCount");
        if (mentionCount instanceof Number number) {
            builder.mentionCount(number.intValue());
        }
        Object createdAt = row.get("createdAt");
        if (createdAt instanceof Number number) {
            builder.createdAt(Instant.ofEpochMilli(number.longValue()));
        }
        return builder.build();
    }

    private Relationship mapToRelationship(Map<String, Object> row) {
        Relationship.Builder builder = Relationship.builder()
                .id((String) row.get("id"))
                .sourceEntityId((String) row.get("sourceEntityId"))
                .targetEntityId((String) row.get("targetEntityId"))
                .relationshipType((String) row.get("relationshipType"))
                .properties(codec.decode((String) row.get("properties")));
        Object createdAt = row.get("createdAt");
        if (createdAt instanceof Number number) {
            builder.createdAt(Instant.ofEpochMilli(number.longValue()));
        }
        return builder.build();
    }

    private static List<String> toStrings(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> collection) {
            List<String> result = new ArrayList<>(collection.size());
            for (Object element : collection) {
                result.add(String.valueOf(element));
            }
            return result;
        }
        return List.of(String.valueOf(value));
    }

    private <T> T guarded(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (StorageException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("store.failed operation={} error={}", operation, e.getMessage());
            throw new StorageException("Graph operation '" + operation + "' failed", e);
        }
    }
}
