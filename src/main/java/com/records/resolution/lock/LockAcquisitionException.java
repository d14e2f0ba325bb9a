package com.records.resolution.lock;

/**
 * Thrown when the per-name lock for a resolution cannot be taken in time.
 * The candidate was not resolved and may be retried.
 */
public class LockAcquisitionException extends RuntimeException {

    private final String key;

    public LockAcquisitionException(String key, String message) {
        super(message);
        this.key = key;
    }

    public LockAcquisitionException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    /**
     * The lock key, i.e. the normalized name being resolved.
     */
    public String getKey() {
        return key;
    }
}
