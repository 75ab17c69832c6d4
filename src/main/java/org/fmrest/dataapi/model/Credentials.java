package org.fmrest.dataapi.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Account used to open a Data API session. The password is never printed.
 */
@Getter
@AllArgsConstructor
public class Credentials {
    private final String user;
    private final String password;

    @Override
    public String toString() {
        return "Credentials(user=" + user + ", password=****)";
    }
}
