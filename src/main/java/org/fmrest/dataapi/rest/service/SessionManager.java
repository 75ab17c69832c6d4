package org.fmrest.dataapi.rest.service;

import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.core5.http.Method;
import org.fmrest.dataapi.model.Credentials;
import org.fmrest.dataapi.model.DataSource;
import org.fmrest.dataapi.rest.HttpResult;
import org.fmrest.dataapi.rest.SessionState;
import org.fmrest.dataapi.rest.exception.AuthException;
import org.fmrest.dataapi.rest.exception.FileMakerException;
import org.fmrest.dataapi.rest.exception.NotAuthenticatedException;
import org.fmrest.dataapi.rest.exception.RequestTimeoutException;
import org.fmrest.dataapi.rest.parser.Envelope;
import org.fmrest.dataapi.rest.parser.ResponseParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns the credentials and the session token of one client.
 *
 * <p>State transitions:</p>
 * <ul>
 *   <li>{@code NO_TOKEN -> VALID} on a successful {@link #login()}</li>
 *   <li>{@code VALID -> NO_TOKEN} on {@link #logout()} (whatever the server answers) and on
 *   {@link #invalidate()} after the server rejected the token</li>
 *   <li>any state {@code -> INVALIDATED} on {@link #close()}; no login is accepted afterwards</li>
 * </ul>
 *
 * <p>Not thread safe.</p>
 */
public class SessionManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

    private final HttpRequestBuilder requestBuilder;
    private final ServiceCaller caller;
    private final Credentials credentials;
    private final List<DataSource> dataSources;

    private String token;
    private SessionState state = SessionState.NO_TOKEN;

    public SessionManager(HttpRequestBuilder requestBuilder, ServiceCaller caller, Credentials credentials,
                          List<DataSource> dataSources) {
        this.requestBuilder = requestBuilder;
        this.caller = caller;
        this.credentials = credentials;
        this.dataSources = dataSources == null ? Collections.emptyList() : new ArrayList<>(dataSources);
    }

    /**
     * Opens a session with Basic authentication.
     * <p>
     * When a session is already open, its token is dropped first and revoked on the
     * server on a best-effort basis.
     * </p>
     *
     * @return The new token
     * @throws AuthException If the server rejected the credentials or could not be reached
     * @throws RequestTimeoutException If the server did not answer in time
     * @throws IllegalStateException If the client was closed
     */
    public String login() {
        if (state == SessionState.INVALIDATED) {
            throw new IllegalStateException("Client is closed, cannot log in again");
        }
        if (state == SessionState.VALID) {
            String previous = token;
            clear();
            revokeQuietly(previous);
        }

        HttpUriRequestBase request = requestBuilder.buildRequest(Method.POST, ApiPath.SESSIONS,
                Collections.emptyMap(), Collections.emptyMap(), loginBody());
        HttpRequestBuilder.basic(request, credentials);

        String newToken;
        try {
            HttpResult result = caller.send(request);
            Envelope envelope = ServiceCaller.decode(result);
            if (!envelope.isSuccess()) {
                throw new AuthException(envelope.getCode(), envelope.getMessage());
            }
            newToken = ResponseParser.parseToken(envelope, result.getHeaders());
        } catch (RequestTimeoutException e) {
            throw e;
        } catch (FileMakerException e) {
            throw AuthException.buildAuthException(e);
        }

        token = newToken;
        state = SessionState.VALID;
        logger.info("Logged in to database {} as {}", requestBuilder.getDatabase(), credentials.getUser());
        return token;
    }

    /**
     * Closes the session on the server. The local token is dropped before the call, so the
     * session is {@code NO_TOKEN} afterwards even if the call fails. Does nothing without a token.
     *
     * @throws AuthException If the server could not close the session
     */
    public void logout() {
        if (token == null) {
            return;
        }
        String previous = token;
        clear();
        try {
            revoke(previous);
        } catch (FileMakerException e) {
            throw AuthException.buildAuthException(e);
        }
        logger.info("Logged out of database {}", requestBuilder.getDatabase());
    }

    /**
     * @return Token to send as Bearer authorization
     * @throws NotAuthenticatedException If there is no valid session
     */
    public String currentToken() {
        if (state == SessionState.INVALIDATED) {
            throw new NotAuthenticatedException("Client is closed");
        }
        if (state != SessionState.VALID || token == null) {
            throw new NotAuthenticatedException("Not logged in, call login() first");
        }
        return token;
    }

    /**
     * Drops the token after the server reported it invalid. No request is sent.
     */
    public void invalidate() {
        if (state == SessionState.VALID) {
            logger.info("Session token of database {} is no longer valid", requestBuilder.getDatabase());
            clear();
        }
    }

    /**
     * Adds the Basic authorization used by endpoints that take no token.
     */
    public void authorizeBasic(HttpUriRequestBase request) {
        HttpRequestBuilder.basic(request, credentials);
    }

    public SessionState getState() {
        return state;
    }

    public boolean isLoggedIn() {
        return state == SessionState.VALID;
    }

    /**
     * Logs out if a session is open, then refuses any further login.
     * A failed logout is logged and does not prevent closing.
     */
    @Override
    public void close() {
        if (state == SessionState.INVALIDATED) {
            return;
        }
        try {
            logout();
        } catch (FileMakerException e) {
            logger.warn("Logout on close failed: {}", e.getMessage());
        } finally {
            token = null;
            state = SessionState.INVALIDATED;
        }
    }

    private Map<String, Object> loginBody() {
        Map<String, Object> body = new LinkedHashMap<>();
        if (!dataSources.isEmpty()) {
            List<Map<String, String>> sources = new ArrayList<>();
            for (DataSource dataSource : dataSources) {
                Map<String, String> source = new LinkedHashMap<>();
                source.put("database", dataSource.getDatabase());
                source.put("username", dataSource.getUsername());
                source.put("password", dataSource.getPassword());
                sources.add(source);
            }
            body.put("fmDataSource", sources);
        }
        return body;
    }

    private void revoke(String revokedToken) {
        HttpUriRequestBase request = requestBuilder.buildRequest(Method.DELETE, ApiPath.SESSION,
                Collections.singletonMap("token", revokedToken), Collections.emptyMap(), null);
        Envelope envelope = caller.call(request);
        if (!envelope.isSuccess()) {
            throw new AuthException(envelope.getCode(), envelope.getMessage());
        }
    }

    private void revokeQuietly(String revokedToken) {
        try {
            revoke(revokedToken);
        } catch (FileMakerException e) {
            logger.warn("Could not revoke previous session token: {}", e.getMessage());
        }
    }

    private void clear() {
        token = null;
        if (state == SessionState.VALID) {
            state = SessionState.NO_TOKEN;
        }
    }
}
