package com.github.stormino.medialib.exception;

/**
 * Exception thrown when a blob-store operation fails.
 */
public class StorageException extends AcquisitionException {

    private final String storageKey;
    private final String operation;

    public StorageException(String message, String storageKey, String operation) {
        super(message);
        this.storageKey = storageKey;
        this.operation = operation;
    }

    public StorageException(String message, Throwable cause, String storageKey, String operation) {
        super(message, cause);
        this.storageKey = storageKey;
        this.operation = operation;
    }

    public String getStorageKey() {
        return storageKey;
    }

    public String getOperation() {
        return operation;
    }
}
