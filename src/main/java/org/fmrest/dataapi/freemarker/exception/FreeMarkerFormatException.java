package org.fmrest.dataapi.freemarker.exception;

/**
 * A path template failed to render, typically because a variable such as the
 * database or layout name is missing.
 * <p>
 * Extends {@link FreeMarkerException} for unified template exception handling.
 * </p>
 */
public class FreeMarkerFormatException extends FreeMarkerException {

    /**
     * Constructs a new FreeMarkerFormatException with message and cause.
     *
     * @param message Human-readable error description.
     * @param cause   The underlying cause of the formatting error.
     */
    public FreeMarkerFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
