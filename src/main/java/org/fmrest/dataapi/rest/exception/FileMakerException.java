package org.fmrest.dataapi.rest.exception;

/**
 * Root of all failures raised by the Data API client.
 * <p>
 * Every exception thrown by the client is unchecked and extends this type, so callers
 * can handle the whole family with one catch clause and narrow down when they need to
 * (e.g. reload-and-retry on {@link RecordConflictException}).
 * </p>
 */
public class FileMakerException extends RuntimeException {

    /**
     * Constructs a new FileMakerException with a message.
     *
     * @param message Human-readable error message.
     */
    public FileMakerException(String message) {
        super(message);
    }

    /**
     * Constructs a new FileMakerException with a message and cause.
     *
     * @param message Human-readable error message.
     * @param cause   The underlying failure.
     */
    public FileMakerException(String message, Throwable cause) {
        super(message, cause);
    }
}
