package org.fmrest.dataapi.rest.service;

import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.core5.http.HttpStatus;
import org.fmrest.dataapi.rest.HttpResult;
import org.fmrest.dataapi.rest.exception.RequestException;
import org.fmrest.dataapi.rest.exception.RequestTimeoutException;
import org.fmrest.dataapi.rest.exception.ResponseParseException;
import org.fmrest.dataapi.rest.exception.ServiceException;
import org.fmrest.dataapi.rest.exception.TokenExpiredException;
import org.fmrest.dataapi.rest.interfaces.Transport;
import org.fmrest.dataapi.rest.parser.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;

/**
 * Sends requests through a {@link Transport} and decodes the envelope.
 * <p>
 * I/O failures become {@link RequestTimeoutException} or {@link RequestException}; a
 * 401 whose body is not an envelope is reported as an expired token.
 * Message codes are left to the caller.
 * </p>
 */
public class ServiceCaller {

    private static final Logger logger = LoggerFactory.getLogger(ServiceCaller.class);

    private final Transport transport;

    public ServiceCaller(Transport transport) {
        this.transport = transport;
    }

    /**
     * Executes a request and returns the raw response.
     *
     * @throws RequestTimeoutException If the timeout elapsed
     * @throws RequestException If the exchange failed otherwise
     */
    public HttpResult send(HttpUriRequestBase request) {
        try {
            return transport.execute(request);
        } catch (InterruptedIOException e) {
            logger.debug("{} {} timed out", request.getMethod(), request.getRequestUri());
            throw new RequestTimeoutException(
                    "Request " + request.getMethod() + " " + request.getRequestUri() + " timed out", e);
        } catch (IOException e) {
            throw new RequestException(
                    "Request " + request.getMethod() + " " + request.getRequestUri() + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Executes a request and decodes the response envelope.
     *
     * @throws ResponseParseException If the body is not an envelope
     * @throws TokenExpiredException If the server answered 401 without an envelope
     */
    public Envelope call(HttpUriRequestBase request) {
        return decode(send(request));
    }

    public static Envelope decode(HttpResult result) {
        try {
            return Envelope.of(result);
        } catch (ResponseParseException e) {
            if (result.getStatusCode() == HttpStatus.SC_UNAUTHORIZED) {
                throw new TokenExpiredException(ServiceException.NO_CODE, "HTTP 401 Unauthorized");
            }
            throw e;
        }
    }
}
