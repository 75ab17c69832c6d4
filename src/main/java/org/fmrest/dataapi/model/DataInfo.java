package org.fmrest.dataapi.model;

import lombok.Data;

/**
 * Counts the server reports next to a page of records ({@code dataInfo} section).
 */
@Data
public class DataInfo {
    private String database;
    private String layout;
    private String table;
    private int totalRecordCount;
    private int foundCount;
    private int returnedCount;
}
