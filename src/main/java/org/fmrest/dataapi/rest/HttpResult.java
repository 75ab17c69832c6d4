package org.fmrest.dataapi.rest;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Raw HTTP response as returned by a {@link org.fmrest.dataapi.rest.interfaces.Transport}:
 * status, headers and body, before any interpretation.
 */
@AllArgsConstructor
@Getter
public class HttpResult {

    private final int statusCode;
    /** Header name -> value; the last value wins for repeated headers */
    private final Map<String, String> headers;
    private final byte[] body;

    public String getBodyAsString() {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
