package com.records.resolution.cache;

import java.util.Optional;

/**
 * Cache that stores nothing. Every lookup goes to the store.
 */
public class NoOpResolutionCache implements ResolutionCache {

    @Override
    public Optional<String> get(String nameKey) {
        return Optional.empty();
    }

    @Override
    public void put(String nameKey, String entityId) {
    }

    @Override
    public void invalidate(String entityId) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
