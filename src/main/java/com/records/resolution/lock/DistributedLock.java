package com.records.resolution.lock;

import java.util.function.Supplier;

/**
 * Mutual exclusion keyed by name. The resolver holds the lock for a candidate's
 * normalized name for the whole resolution, so two concurrent observations of the
 * same name cannot both create an entity.
 */
public interface DistributedLock {

    /**
     * Attempts to acquire a lock on the given key.
     *
     * @param key the lock key (the normalized entity name)
     * @return true if the lock was acquired
     * @throws LockAcquisitionException if lock acquisition fails after retries
     */
    boolean tryLock(String key);

    /**
     * Releases a lock on the given key.
     *
     * @param key the lock key
     */
    void unlock(String key);

    /**
     * Runs {@code action} while holding the lock for {@code key}.
     */
    default <T> T withLock(String key, Supplier<T> action) {
        tryLock(key);
        try {
            return action.get();
        } finally {
            unlock(key);
        }
    }
}
