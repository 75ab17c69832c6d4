package org.fmrest.dataapi.rest;

/**
 * Lifecycle of the session token held by a client.
 */
public enum SessionState {
    /** No token: the client must log in before any data call. */
    NO_TOKEN,
    /** Token obtained from a successful login. */
    VALID,
    /** Client closed; no further login is accepted. */
    INVALIDATED
}
