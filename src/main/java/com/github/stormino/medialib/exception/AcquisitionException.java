package com.github.stormino.medialib.exception;

/**
 * Base exception for all acquisition-related errors.
 */
public class AcquisitionException extends RuntimeException {

    public AcquisitionException(String message) {
        super(message);
    }

    public AcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }

    public AcquisitionException(Throwable cause) {
        super(cause);
    }
}
