package org.fmrest.dataapi.freemarker.exception;

import org.fmrest.dataapi.rest.exception.FileMakerException;

/**
 * Failure to compile an endpoint path template.
 * <p>
 * Path templates are fixed in the client, so this signals a programming error rather
 * than bad input.
 * </p>
 */
public class FreeMarkerException extends FileMakerException {

    /**
     * Constructs a new FreeMarkerException with message and cause.
     *
     * @param message Error description for context and debugging.
     * @param cause   The underlying reason or stack-trace root.
     */
    public FreeMarkerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new FreeMarkerException with a message only.
     *
     * @param message Reason for the exception.
     */
    public FreeMarkerException(String message) {
        super(message);
    }
}
