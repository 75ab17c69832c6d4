package org.fmrest.dataapi.rest.parser;

import com.jayway.jsonpath.InvalidJsonException;
import lombok.Getter;
import org.fmrest.dataapi.rest.FileMakerErrorCode;
import org.fmrest.dataapi.rest.HttpResult;
import org.fmrest.dataapi.rest.exception.ResponseParseException;
import org.fmrest.dataapi.rest.json.JsonEnvelopeReader;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Decoded Data API response: the first message ({@code code}, {@code message}) and
 * the {@code response} object.
 *
 * <pre>
 * {
 *   "response": { "data": [ ... ], "dataInfo": { ... } },
 *   "messages": [ { "code": "0", "message": "OK" } ]
 * }
 * </pre>
 */
@Getter
public class Envelope {

    private final int statusCode;
    private final int code;
    private final String message;
    private final Map<String, Object> response;

    private Envelope(int statusCode, int code, String message, Map<String, Object> response) {
        this.statusCode = statusCode;
        this.code = code;
        this.message = message;
        this.response = response;
    }

    public boolean isSuccess() {
        return isSuccessCode(code);
    }

    /**
     * Reads a member of the {@code response} object. Member names may contain dots
     * ({@code scriptResult.presort}), so this is a plain map lookup.
     */
    public Object get(String member) {
        return response.get(member);
    }

    /**
     * Decodes an HTTP response into an envelope.
     *
     * @param result Raw HTTP response
     * @return The envelope; its code may be an error code
     * @throws ResponseParseException If the body is not JSON, or the messages or response sections are
     *                                missing or malformed
     */
    @SuppressWarnings("unchecked")
    public static Envelope of(HttpResult result) {
        JsonEnvelopeReader reader;
        try {
            reader = new JsonEnvelopeReader(result.getBodyAsString());
        } catch (InvalidJsonException | IllegalArgumentException e) {
            throw ResponseParseException.buildResponseParseException(result.getStatusCode(), e);
        }
        if (!(reader.root() instanceof Map)) {
            throw new ResponseParseException("Response body is not a JSON object (http " + result.getStatusCode() + ")");
        }

        Object messages = reader.read("$.messages");
        if (!(messages instanceof List) || ((List<?>) messages).isEmpty()
                || !(((List<?>) messages).get(0) instanceof Map)) {
            throw new ResponseParseException("Response has no messages section (http " + result.getStatusCode() + ")");
        }
        Map<String, Object> first = (Map<String, Object>) ((List<?>) messages).get(0);
        int code = parseCode(first.get("code"));
        Object message = first.get("message");

        Object response = reader.read("$.response");
        if (response != null && !(response instanceof Map)) {
            throw new ResponseParseException("Response section is not an object");
        }
        if (response == null && isSuccessCode(code)) {
            throw new ResponseParseException("Successful response has no response section");
        }
        return new Envelope(result.getStatusCode(), code,
                message == null ? "Unknown error" : message.toString(),
                response == null ? Collections.emptyMap() : (Map<String, Object>) response);
    }

    private static boolean isSuccessCode(int code) {
        return code == FileMakerErrorCode.SUCCESS.getCode();
    }

    private static int parseCode(Object code) {
        if (code instanceof Number) {
            return ((Number) code).intValue();
        }
        if (code != null) {
            try {
                return Integer.parseInt(code.toString().trim());
            } catch (NumberFormatException e) {
                throw new ResponseParseException("Message code is not numeric: " + code, e);
            }
        }
        throw new ResponseParseException("Message has no code");
    }
}
