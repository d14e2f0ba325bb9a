package com.records.resolution.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process per-name lock using {@link ReentrantLock}.
 * Suitable for single-JVM deployments. This is the default lock implementation.
 *
 * <p>Locks are reference counted and dropped once no thread holds or waits for them,
 * so resolving millions of distinct names does not leave millions of lock objects behind.</p>
 */
public class LocalDistributedLock implements DistributedLock {
    private static final Logger log = LoggerFactory.getLogger(LocalDistributedLock.class);

    private final ConcurrentHashMap<String, CountedLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalDistributedLock() {
        this(LockConfig.defaults());
    }

    public LocalDistributedLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public boolean tryLock(String key) {
        CountedLock lock = locks.compute(key, (k, existing) -> {
            CountedLock counted = existing != null ? existing : new CountedLock();
            counted.users++;
            return counted;
        });
        boolean acquired = false;
        try {
            acquired = lock.lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException(key, "Interrupted while acquiring lock for key: " + key, e);
        } finally {
            if (!acquired) {
                release(key);
            }
        }
        if (!acquired) {
            throw new LockAcquisitionException(key,
                    "Failed to acquire lock for key '" + key + "' within " + config.timeoutMs() + "ms");
        }
        log.debug("Lock acquired: {}", key);
        return true;
    }

    @Override
    public void unlock(String key) {
        CountedLock lock = locks.get(key);
        if (lock != null && lock.lock.isHeldByCurrentThread()) {
            lock.lock.unlock();
            release(key);
            log.debug("Lock released: {}", key);
        }
    }

    /**
     * Number of keys currently tracked.
     */
    int trackedKeys() {
        return locks.size();
    }

    private void release(String key) {
        locks.computeIfPresent(key, (k, counted) -> --counted.users == 0 ? null : counted);
    }

    private static final class CountedLock {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int users;
    }
}
