package com.records.resolution.store;

/**
 * Runtime exception thrown when the entity store cannot complete an operation.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
