package org.fmrest.dataapi.rest.interfaces;

import org.fmrest.dataapi.rest.Record;

import java.util.Map;

/**
 * Server operations a {@link Record} needs to commit, reload and delete itself.
 */
public interface RecordGateway {

    /**
     * Edits a record.
     *
     * @param layout         Layout the record was read from.
     * @param recordId       Record id.
     * @param modificationId Modification id the edit is based on.
     * @param fieldData      Field name -> typed value of the changed fields.
     * @return               New modification id.
     */
    long editRecord(String layout, long recordId, long modificationId, Map<String, ?> fieldData);

    /**
     * Reads a record.
     *
     * @param layout   Layout to read through.
     * @param recordId Record id.
     * @return         Fresh record.
     */
    Record getRecord(String layout, long recordId);

    /**
     * Deletes a record.
     *
     * @param layout   Layout to delete through.
     * @param recordId Record id.
     */
    void deleteRecord(String layout, long recordId);

}
