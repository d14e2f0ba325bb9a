package com.records.resolution.cache;

import java.util.Optional;

/**
 * Cache of exact-name lookups: lower-cased entity name to entity id.
 * Cached ids may be stale and are verified against the store by the caller.
 */
public interface ResolutionCache {

    Optional<String> get(String nameKey);

    void put(String nameKey, String entityId);

    /**
     * Invalidates all cache entries pointing at the given entity.
     */
    void invalidate(String entityId);

    void invalidateAll();

    CacheStats getStats();
}
