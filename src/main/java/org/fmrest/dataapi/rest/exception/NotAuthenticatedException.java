package org.fmrest.dataapi.rest.exception;

/**
 * Raised when an operation needs a session token but the session holds none.
 * No request is sent to the server in that case.
 */
public class NotAuthenticatedException extends FileMakerException {

    public NotAuthenticatedException(String message) {
        super(message);
    }
}
