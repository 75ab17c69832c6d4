package org.fmrest.dataapi.rest.exception;

import lombok.Getter;
import org.fmrest.dataapi.rest.FileMakerErrorCode;

/**
 * Error reported by the Data API through a non-zero message code.
 * <p>
 * Carries the numeric code and the message returned by the server so callers can
 * inspect them. More specific codes are reported through subclasses
 * ({@link TokenExpiredException}, {@link RecordConflictException}).
 * </p>
 */
@Getter
public class ServiceException extends FileMakerException {

    /** Code used when the failure did not come with a service message code. */
    public static final int NO_CODE = -1;

    /** Numeric message code returned by the service, or {@link #NO_CODE}. */
    private final int code;

    /** Message text returned by the service. */
    private final String serviceMessage;

    public ServiceException(int code, String serviceMessage) {
        super("FileMaker Server returned error " + code + ", " + serviceMessage);
        this.code = code;
        this.serviceMessage = serviceMessage;
    }

    protected ServiceException(int code, String serviceMessage, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.serviceMessage = serviceMessage;
    }

    /**
     * @return The known code this error carries, or null when the client has no special meaning for it.
     */
    public FileMakerErrorCode getErrorCode() {
        return FileMakerErrorCode.of(code);
    }

    /**
     * Factory method for an error decoded from a response envelope.
     *
     * @param code           Service message code.
     * @param serviceMessage Service message text.
     * @return A new ServiceException.
     */
    public static ServiceException buildServiceException(int code, String serviceMessage) {
        return new ServiceException(code, serviceMessage);
    }
}
