package org.fmrest.dataapi.rest;

import java.util.HashMap;
import java.util.Map;

/**
 * Data API message codes the client reacts to.
 * <p>
 * Any code not listed here is reported as a generic
 * {@link org.fmrest.dataapi.rest.exception.ServiceException}.
 * </p>
 */
public enum FileMakerErrorCode {

    SUCCESS(0),
    RECORD_MISSING(101),
    INVALID_USER_PASSWORD(212),
    MODIFICATION_ID_MISMATCH(306),
    NO_RECORDS_MATCH(401),
    INVALID_DAPI_TOKEN(952);

    private final int code;

    /** Fast lookup: numeric code -> enum constant */
    private static final Map<Integer, FileMakerErrorCode> MAP = new HashMap<>();

    static {
        for (FileMakerErrorCode value : values()) {
            MAP.put(value.code, value);
        }
    }

    FileMakerErrorCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Looks up a known error code.
     *
     * @param code Numeric message code.
     * @return Matching constant, or null if the client has no special handling for it.
     */
    public static FileMakerErrorCode of(int code) {
        return MAP.get(code);
    }
}
