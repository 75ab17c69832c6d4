package org.fmrest.dataapi.rest.exception;

/**
 * Login or logout failure: rejected credentials, unreachable host, or a session
 * that could not be closed on the server.
 */
public class AuthException extends ServiceException {

    public AuthException(int code, String serviceMessage) {
        this(code, serviceMessage, null);
    }

    public AuthException(int code, String serviceMessage, Throwable cause) {
        super(code, serviceMessage, "Authentication failed with error " + code + ", " + serviceMessage, cause);
    }

    public AuthException(String message, Throwable cause) {
        super(NO_CODE, message, message, cause);
    }

    /**
     * Wraps a failure that happened while talking to the sessions endpoint.
     *
     * @param cause Original failure (service error or transport error).
     * @return AuthException preserving the service code when there is one.
     */
    public static AuthException buildAuthException(FileMakerException cause) {
        if (cause instanceof AuthException) {
            return (AuthException) cause;
        }
        if (cause instanceof ServiceException) {
            ServiceException serviceException = (ServiceException) cause;
            return new AuthException(serviceException.getCode(), serviceException.getServiceMessage(), cause);
        }
        return new AuthException(cause.getMessage(), cause);
    }
}
