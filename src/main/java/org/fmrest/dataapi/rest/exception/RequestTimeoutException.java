package org.fmrest.dataapi.rest.exception;

/**
 * The transport deadline was exceeded. The request may still be processed by the
 * server; the client only stopped waiting.
 */
public class RequestTimeoutException extends FileMakerException {

    public RequestTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
