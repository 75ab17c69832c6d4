package org.fmrest.dataapi.rest.exception;

/**
 * Transport failure other than a timeout (connection refused, broken stream, ...).
 */
public class RequestException extends FileMakerException {

    public RequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
