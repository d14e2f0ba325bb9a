package com.records.resolution.store;

import com.records.resolution.core.model.Entity;
import com.records.resolution.core.model.EntityType;
import com.records.resolution.core.model.IdentifierKind;
import com.records.resolution.core.model.Relationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe in-memory store. Intended for tests and for embedding the resolver
 * without a graph database.
 */
public class InMemoryEntityStore implements EntityStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEntityStore.class);

    static final Comparator<Entity> SCAN_ORDER = Comparator
            .comparing(Entity::getCreatedAt)
            .thenComparing(Entity::getId);

    private final Map<String, Entity> entities = new LinkedHashMap<>();
    private final Map<String, Relationship> relationships = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public Optional<Entity> findById(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entities.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Entity> findByExactName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String key = name.toLowerCase(Locale.ROOT);
        lock.readLock().lock();
        try {
            return entities.values().stream()
                    .filter(e -> e.getName().toLowerCase(Locale.ROOT).equals(key))
                    .min(SCAN_ORDER);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Entity> findByIdentifier(IdentifierKind kind, String value) {
        if (value == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return entities.values().stream()
                    .filter(e -> value.equals(e.getIdentifier(kind)))
                    .min(SCAN_ORDER);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Entity> listEntities(EntityType typeFilter, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        lock.readLock().lock();
        try {
            return entities.values().stream()
                    .filter(e -> typeFilter == null || e.getType() == typeFilter)
                    .sorted(SCAN_ORDER)
                    .limit(limit)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String insertEntity(Entity entity) {
        lock.writeLock().lock();
        try {
            if (entities.containsKey(entity.getId())) {
                throw new StorageException("Entity already exists: " + entity.getId());
            }
            entities.put(entity.getId(), entity);
            log.debug("store.insert entityId={} name='{}'", entity.getId(), entity.getName());
            return entity.getId();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void updateEntity(String id, EntityUpdate update) {
        lock.writeLock().lock();
        try {
            Entity current = entities.get(id);
            if (current == null) {
                throw new StorageException("Entity not found: " + id);
            }
            Entity.Builder builder = current.toBuilder();
            if (update.attributes() != null) {
                builder.attributes(update.attributes());
            }
            if (update.aliases() != null) {
                builder.aliases(update.aliases());
            }
            if (update.mentionCount() != null) {
                builder.mentionCount(update.mentionCount());
            }
            entities.put(id, builder.build());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void deleteEntity(String id) {
        lock.writeLock().lock();
        try {
            if (entities.remove(id) != null) {
                relationships.values().removeIf(r -> r.touches(id));
                log.debug("store.delete entityId={}", id);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int repointRelationships(String fromId, String toId) {
        lock.writeLock().lock();
        try {
            int count = 0;
            for (Map.Entry<String, Relationship> entry : relationships.entrySet()) {
                Relationship relationship = entry.getValue();
                if (relationship.touches(fromId)) {
                    entry.setValue(relationship.repoint(fromId, toId));
                    count++;
                }
            }
            return count;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Relationship createRelationship(Relationship relationship) {
        lock.writeLock().lock();
        try {
            if (!entities.containsKey(relationship.getSourceEntityId())) {
                throw new StorageException("Source entity not found: " + relationship.getSourceEntityId());
            }
            if (!entities.containsKey(relationship.getTargetEntityId())) {
                throw new StorageException("Target entity not found: " + relationship.getTargetEntityId());
            }
            relationships.put(relationship.getId(), relationship);
            return relationship;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Relationship> findRelationshipsByEntity(String entityId) {
        lock.readLock().lock();
        try {
            List<Relationship> result = new ArrayList<>();
            for (Relationship relationship : relationships.values()) {
                if (relationship.touches(entityId)) {
                    result.add(relationship);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Number of stored entities.
     */
    public int size() {
        lock.readLock().lock();
        try {
            return entities.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
