package com.records.resolution.store;

import com.records.resolution.core.model.Entity;
import com.records.resolution.core.model.EntityType;
import com.records.resolution.core.model.IdentifierKind;
import com.records.resolution.core.model.Relationship;

import java.util.List;
import java.util.Optional;

/**
 * Storage contract for entities and the relationships between them.
 *
 * <p>Every method may throw {@link StorageException}. Implementations must be safe for
 * concurrent use; callers that need read-then-write atomicity for a name hold a
 * {@link com.records.resolution.lock.DistributedLock} around the sequence.</p>
 */
public interface EntityStore {

    Optional<Entity> findById(String id);

    /**
     * Finds an entity whose stored name equals {@code name} ignoring case.
     * If several match, the oldest one is returned.
     */
    Optional<Entity> findByExactName(String name);

    /**
     * Finds an entity whose attributes carry exactly this identifier value.
     */
    Optional<Entity> findByIdentifier(IdentifierKind kind, String value);

    /**
     * Lists entities oldest first (ties broken by id), optionally restricted to one type.
     *
     * @param typeFilter type to restrict to, or null for every type
     * @param limit      maximum number of entities returned
     */
    List<Entity> listEntities(EntityType typeFilter, int limit);

    /**
     * Stores a new entity.
     *
     * @return the id of the stored entity
     */
    String insertEntity(Entity entity);

    /**
     * Applies a partial update.
     *
     * @throws StorageException if no entity has this id
     */
    void updateEntity(String id, EntityUpdate update);

    /**
     * Deletes an entity together with any relationships still attached to it.
     */
    void deleteEntity(String id);

    /**
     * Re-points every relationship that has {@code fromId} as source or target to {@code toId}.
     *
     * @return number of relationships re-pointed
     */
    int repointRelationships(String fromId, String toId);

    /**
     * Stores a relationship between two existing entities.
     *
     * @throws StorageException if either endpoint does not exist
     */
    Relationship createRelationship(Relationship relationship);

    /**
     * All relationships where the entity is source or target.
     */
    List<Relationship> findRelationshipsByEntity(String entityId);
}
