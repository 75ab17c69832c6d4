package org.fmrest.dataapi.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Credentials of an additional database file the session must be authenticated against
 * (sent as {@code fmDataSource} on login).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DataSource {
    private String database;
    private String username;
    @ToString.Exclude
    private String password;
}
