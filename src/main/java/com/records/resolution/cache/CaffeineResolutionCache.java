package com.records.resolution.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Caffeine-backed exact-name cache with an entity id index for targeted invalidation.
 * Implements {@link MergeListener} so merged-away entities drop out of the cache.
 */
public class CaffeineResolutionCache implements ResolutionCache, MergeListener {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResolutionCache.class);

    private final Cache<String, String> cache;
    // entityId -> name keys pointing at it
    private final ConcurrentMap<String, Set<String>> entityIndex = new ConcurrentHashMap<>();

    public CaffeineResolutionCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .removalListener((String nameKey, String entityId, RemovalCause cause) -> {
                    if (cause.wasEvicted() && nameKey != null && entityId != null) {
                        removeFromIndex(entityId, nameKey);
                    }
                })
                .build();
        log.info("CaffeineResolutionCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<String> get(String nameKey) {
        return Optional.ofNullable(cache.getIfPresent(nameKey));
    }

    @Override
    public void put(String nameKey, String entityId) {
        cache.put(nameKey, entityId);
        entityIndex.computeIfAbsent(entityId, k -> ConcurrentHashMap.newKeySet()).add(nameKey);
    }

    @Override
    public void invalidate(String entityId) {
        Set<String> keys = entityIndex.remove(entityId);
        if (keys != null) {
            keys.forEach(cache::invalidate);
            log.debug("Invalidated {} cache entries for entity {}", keys.size(), entityId);
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        entityIndex.clear();
        log.debug("Invalidated all cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    @Override
    public void onMerge(String primaryEntityId, String duplicateEntityId) {
        invalidate(duplicateEntityId);
        log.debug("Cache invalidated for merge: {} -> {}", duplicateEntityId, primaryEntityId);
    }

    private void removeFromIndex(String entityId, String nameKey) {
        entityIndex.computeIfPresent(entityId, (id, keys) -> {
            keys.remove(nameKey);
            return keys.isEmpty() ? null : keys;
        });
    }
}
