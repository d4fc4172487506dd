package com.github.stormino.medialib.exception;

/**
 * Thrown when acquired bytes could not be registered or attached to a tenant library.
 * The bytes stay registered for reuse; only the job reports failure.
 */
public class RegistrationException extends AcquisitionException {

    private final String storageKey;

    public RegistrationException(String message, String storageKey, Throwable cause) {
        super(message, cause);
        this.storageKey = storageKey;
    }

    public String getStorageKey() {
        return storageKey;
    }
}
