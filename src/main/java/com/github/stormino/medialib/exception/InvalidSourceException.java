package com.github.stormino.medialib.exception;

/**
 * Thrown when a requested source identity is malformed or not on the allowed host list.
 * Never retried; rejected before any job exists.
 */
public class InvalidSourceException extends AcquisitionException {

    private final String source;

    public InvalidSourceException(String message, String source) {
        super(message);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
