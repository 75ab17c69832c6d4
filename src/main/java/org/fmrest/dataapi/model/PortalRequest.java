package org.fmrest.dataapi.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Selects a portal to include in a response, with its own row window.
 * Offsets are 1-based like record offsets.
 */
@Data
@AllArgsConstructor
public class PortalRequest {
    private String name;
    private int offset;
    private int limit;

    public static PortalRequest of(String name) {
        return new PortalRequest(name, 1, 50);
    }
}
