package org.fmrest.dataapi.rest.config;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration backed by an in-memory map, for programmatic setup and tests.
 */
public class MapConfiguration implements ClientConfiguration {

    private final Map<String, String> values;

    public MapConfiguration(Map<String, String> values) {
        this.values = new HashMap<>(values);
    }

    @Override
    public String get(String key) {
        return values.get(key);
    }
}
