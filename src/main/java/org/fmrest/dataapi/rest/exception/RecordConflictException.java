package org.fmrest.dataapi.rest.exception;

import lombok.Getter;

/**
 * An edit was rejected because the record's modification id on the server differs
 * from the one sent (code 306). The local record is left untouched.
 */
@Getter
public class RecordConflictException extends ServiceException {

    /** Id of the record that could not be edited. */
    private final long recordId;

    /** Modification id the edit was based on. */
    private final long modificationId;

    public RecordConflictException(int code, String serviceMessage, long recordId, long modificationId) {
        super(code, serviceMessage,
                "Record " + recordId + " was modified on the server (local modId " + modificationId + "): " + serviceMessage,
                null);
        this.recordId = recordId;
        this.modificationId = modificationId;
    }
}
