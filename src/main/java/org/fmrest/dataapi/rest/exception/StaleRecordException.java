package org.fmrest.dataapi.rest.exception;

/**
 * Operation on a record that can no longer reach the server: it was deleted, it is a
 * read-only portal row, or the client it came from is gone.
 */
public class StaleRecordException extends FileMakerException {

    public StaleRecordException(String message) {
        super(message);
    }
}
