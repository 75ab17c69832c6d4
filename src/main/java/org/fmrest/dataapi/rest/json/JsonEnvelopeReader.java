package org.fmrest.dataapi.rest.json;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;

/**
 * Reads values out of a Data API response body with JsonPath.
 * <p>
 * The body is parsed once; lookups of absent paths return {@code null} instead of
 * failing, so callers decide which parts of the envelope are mandatory.
 * </p>
 */
public class JsonEnvelopeReader {

    private final DocumentContext document;

    /**
     * @param json Response body
     * @throws com.jayway.jsonpath.InvalidJsonException If the body is not JSON
     * @throws IllegalArgumentException If the body is empty
     */
    public JsonEnvelopeReader(String json) {
        this.document = JsonPath.parse(json);
    }

    /**
     * @return Parsed document root (a Map for JSON objects)
     */
    public Object root() {
        return document.json();
    }

    /**
     * Reads a value using a JsonPath expression.
     *
     * @param path Path expression; {@code $.} is prepended when missing
     * @return The value at the path, or {@code null} if not present
     */
    public Object read(String path) {
        try {
            String jsonPath = path.startsWith("$") ? path : "$." + path;
            return document.read(jsonPath);
        } catch (PathNotFoundException e) {
            return null;
        }
    }
}
