package com.records.resolution.graph;

import com.records.resolution.core.model.IdentifierKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes the Cypher queries behind {@link GraphEntityStore}.
 *
 * <p>Entities are {@code :Entity} nodes. Attributes are stored as one JSON string,
 * identifiers are mirrored into indexed top-level properties and {@code nameKey}
 * holds the lower-cased name for exact lookups. Relationships are
 * {@code :RELATES_TO} edges carrying their own id and type.</p>
 */
public class CypherExecutor {
    private static final Logger log = LoggerFactory.getLogger(CypherExecutor.class);

    static final String ENTITY_COLUMNS = """
            e.id AS id, e.type AS type, e.name AS name, e.aliases AS aliases,
            e.attributes AS attributes, e.description AS description,
            e.importance AS importance, e.mentionCount AS mentionCount, e.createdAt AS createdAt
            """;

    static final String RELATIONSHIP_COLUMNS = """
            r.id AS id, s.id AS sourceEntityId, t.id AS targetEntityId,
            r.type AS relationshipType, r.properties AS properties, r.createdAt AS createdAt
            """;

    private final GraphConnection connection;

    public CypherExecutor(GraphConnection connection) {
        this.connection = connection;
    }

    // ========== Entity lookups ==========

    public List<Map<String, Object>> findEntityById(String id) {
        String query = """
                MATCH (e:Entity {id: $id})
                RETURN %s
                """.formatted(ENTITY_COLUMNS);
        return connection.query(query, Map.of("id", id));
    }

    public List<Map<String, Object>> findEntityByNameKey(String nameKey) {
        String query = """
                MATCH (e:Entity)
                WHERE e.nameKey = $nameKey
                RETURN %s
                ORDER BY e.createdAt, e.id
                LIMIT 1
                """.formatted(ENTITY_COLUMNS);
        return connection.query(query, Map.of("nameKey", nameKey));
    }

    public List<Map<String, Object>> findEntityByIdentifier(IdentifierKind kind, String value) {
        // Property names come from the enum, never from input
        String query = """
                MATCH (e:Entity)
                WHERE e.%s = $value
                RETURN %s
                ORDER BY e.createdAt, e.id
                LIMIT 1
                """.formatted(kind.getAttributeKey(), ENTITY_COLUMNS);
        return connection.query(query, Map.of("value", value));
    }

    public List<Map<String, Object>> listEntities(String type, int limit) {
        if (type == null) {
            String query = """
                    MATCH (e:Entity)
                    RETURN %s
                    ORDER BY e.createdAt, e.id
                    LIMIT %d
                    """.formatted(ENTITY_COLUMNS, limit);
            return connection.query(query, Map.of());
        }
        String query = """
                MATCH (e:Entity)
                WHERE e.type = $type
                RETURN %s
                ORDER BY e.createdAt, e.id
                LIMIT %d
                """.formatted(ENTITY_COLUMNS, limit);
        return connection.query(query, Map.of("type", type));
    }

    // ========== Entity writes ==========

    /**
     * Creates an entity node. {@code properties} must hold every node property,
     * identifier properties included (null for absent identifiers).
     */
    public void createEntity(Map<String, Object> properties) {
        StringBuilder assignments = new StringBuilder();
        for (String key : properties.keySet()) {
            if (!assignments.isEmpty()) {
                assignments.append(", ");
            }
            assignments.append(key).append(": $").append(key);
        }
        String query = "CREATE (e:Entity {" + assignments + "})";
        connection.execute(query, properties);
        log.debug("Created entity node {}", properties.get("id"));
    }

    /**
     * Sets the given properties on an entity.
     *
     * @return true if the entity exists
     */
    public boolean updateEntity(String id, Map<String, Object> properties) {
        StringBuilder assignments = new StringBuilder();
        Map<String, Object> params = new HashMap<>(properties);
        for (String key : properties.keySet()) {
            if (!assignments.isEmpty()) {
                assignments.append(", ");
            }
            assignments.append("e.").append(key).append(" = $").append(key);
        }
        params.put("id", id);
        String query = """
                MATCH (e:Entity {id: $id})
                SET %s
                RETURN e.id AS id
                """.formatted(assignments);
        return !connection.query(query, params).isEmpty();
    }

    public void deleteEntity(String id) {
        String query = """
                MATCH (e:Entity {id: $id})
                DETACH DELETE e
                """;
        connection.execute(query, Map.of("id", id));
        log.debug("Deleted entity node {}", id);
    }

    // ========== Relationships ==========

    public List<Map<String, Object>> createRelationship(String relationshipId, String sourceEntityId,
                                                        String targetEntityId, String relationshipType,
                                                        String propertiesJson, long createdAt) {
        String query = """
                MATCH (s:Entity {id: $sourceEntityId})
                MATCH (t:Entity {id: $targetEntityId})
                CREATE (s)-[r:RELATES_TO {
                    id: $relationshipId,
                    type: $relationshipType,
                    properties: $properties,
                    createdAt: $createdAt
                }]->(t)
                RETURN r.id AS id
                """;
        return connection.query(query, Map.of(
                "relationshipId", relationshipId,
                "sourceEntityId", sourceEntityId,
                "targetEntityId", targetEntityId,
                "relationshipType", relationshipType,
                "properties", propertiesJson,
                "createdAt", createdAt
        ));
    }

    public List<Map<String, Object>> findRelationshipsByEntity(String entityId) {
        String query = """
                MATCH (s:Entity)-[r:RELATES_TO]->(t:Entity)
                WHERE s.id = $entityId OR t.id = $entityId
                RETURN %s
                ORDER BY r.createdAt, r.id
                """.formatted(RELATIONSHIP_COLUMNS);
        return connection.query(query, Map.of("entityId", entityId));
    }

    /**
     * Moves every {@code RELATES_TO} edge of {@code fromId} onto {@code toId}.
     * Outgoing edges move first, so a self-loop ends up as a self-loop on the target.
     */
    public void repointRelationships(String fromId, String toId) {
        String repointOutgoing = """
                MATCH (from:Entity {id: $fromId})-[r:RELATES_TO]->(other:Entity)
                MATCH (to:Entity {id: $toId})
                CREATE (to)-[moved:RELATES_TO]->(other)
                SET moved = properties(r)
                DELETE r
                """;

        String repointIncoming = """
                MATCH (other:Entity)-[r:RELATES_TO]->(from:Entity {id: $fromId})
                MATCH (to:Entity {id: $toId})
                CREATE (other)-[moved:RELATES_TO]->(to)
                SET moved = properties(r)
                DELETE r
                """;

        Map<String, Object> params = Map.of("fromId", fromId, "toId", toId);
        connection.execute(repointOutgoing, params);
        connection.execute(repointIncoming, params);
        log.debug("Re-pointed relationships from {} to {}", fromId, toId);
    }
}
