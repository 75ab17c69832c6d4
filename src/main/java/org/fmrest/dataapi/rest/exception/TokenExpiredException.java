package org.fmrest.dataapi.rest.exception;

/**
 * The server no longer accepts the session token (code 952, or an HTTP 401 without
 * a readable envelope). The session is reset before this is thrown: the caller has to
 * log in again and resubmit the call.
 */
public class TokenExpiredException extends ServiceException {

    public TokenExpiredException(int code, String serviceMessage) {
        super(code, serviceMessage);
    }
}
