package com.records.resolution.lock;

/**
 * No-op lock implementation. Always succeeds immediately.
 * With this lock concurrent resolutions of the same new name may create duplicates,
 * which a later duplicate scan and merge can clean up.
 */
public class NoOpDistributedLock implements DistributedLock {

    @Override
    public boolean tryLock(String key) {
        return true;
    }

    @Override
    public void unlock(String key) {
        // no-op
    }
}
