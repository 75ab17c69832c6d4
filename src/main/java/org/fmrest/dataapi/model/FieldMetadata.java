package org.fmrest.dataapi.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Field descriptor as published by the layout metadata endpoint.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FieldMetadata {
    private String name;
    /** normal, calculation or summary */
    private String type;
    private String displayType;
    /** text, number, date, time, timeStamp or container */
    private String result;
    private boolean global;
    private int maxRepeat = 1;
}
