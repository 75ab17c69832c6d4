package org.fmrest.dataapi.rest.exception;

import lombok.Getter;

/**
 * Lookup or assignment of a field that is not part of the record.
 */
@Getter
public class FieldNotFoundException extends FileMakerException {

    private final String fieldName;

    public FieldNotFoundException(String fieldName) {
        super("No field named " + fieldName + ". Note that the Data API only returns fields placed on your layout.");
        this.fieldName = fieldName;
    }
}
