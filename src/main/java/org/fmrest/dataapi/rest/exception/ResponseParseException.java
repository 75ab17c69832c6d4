package org.fmrest.dataapi.rest.exception;

/**
 * The server answered with a body that is not a valid Data API envelope.
 * <p>
 * Never replaced by an empty result: acting on a partially read response could
 * corrupt data on the next write.
 * </p>
 */
public class ResponseParseException extends FileMakerException {

    public ResponseParseException(String message) {
        super(message);
    }

    public ResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Factory method for a body that could not be decoded.
     *
     * @param statusCode HTTP status of the response.
     * @param cause      The decoding failure.
     * @return A new ResponseParseException.
     */
    public static ResponseParseException buildResponseParseException(int statusCode, Throwable cause) {
        return new ResponseParseException("Invalid JSON in " + statusCode + " http response: " + cause.getMessage(), cause);
    }
}
