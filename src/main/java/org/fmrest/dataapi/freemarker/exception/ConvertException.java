package org.fmrest.dataapi.freemarker.exception;

import org.fmrest.dataapi.rest.exception.FileMakerException;

/**
 * Failure to wrap a Java value as a template variable.
 */
public class ConvertException extends FileMakerException {

    /**
     * Constructs a new ConvertException wrapping the originating cause.
     *
     * @param message Reason for the exception.
     * @param cause The underlying exception or error.
     */
    public ConvertException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Static factory for consistent exception wrapping.
     *
     * @param value The value that could not be wrapped.
     * @param cause The root cause.
     * @return      New instance of ConvertException wrapping the cause.
     */
    public static ConvertException buildConvertException(Object value, Throwable cause) {
        return new ConvertException("Cannot use " + value + " as template variable", cause);
    }
}
