package com.catalogcache.storage;

/**
 * Raised when the state store cannot complete an operation, typically after retries.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
