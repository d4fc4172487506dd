package com.github.stormino.medialib.exception;

/**
 * Thrown when submitted credential data is not a cookie jar the extraction tool can read.
 */
public class InvalidCredentialException extends AcquisitionException {

    public InvalidCredentialException(String message) {
        super(message);
    }
}
