package org.fmrest.dataapi.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Outcome of a script run by the server: its error code (0 when it succeeded)
 * and the text it returned with {@code Exit Script}, if any.
 */
@Data
@AllArgsConstructor
public class ScriptResult {
    private int error;
    private String result;
}
