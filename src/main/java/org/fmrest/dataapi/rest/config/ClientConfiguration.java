package org.fmrest.dataapi.rest.config;

/**
 * Configuration source for client defaults.
 *
 * <p>Abstracts where settings come from (system properties, a map in tests, ...).</p>
 *
 * <p><b>Configuration keys:</b></p>
 * <ul>
 *   <li>{@value #API_VERSION} - Data API version segment of every path (default {@code vLatest})</li>
 *   <li>{@value #TIMEOUT} - request timeout in seconds (default 10)</li>
 *   <li>{@value #PAGE_SIZE} - records fetched per foundset page (default 100)</li>
 *   <li>{@value #TYPE_CONVERSION} - coerce field values using layout metadata (default true)</li>
 *   <li>{@value #DATE_FORMAT}, {@value #TIME_FORMAT}, {@value #TIMESTAMP_FORMAT} - override the
 *   formats reported by the server</li>
 * </ul>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * ClientConfiguration config = new SystemPropertyConfiguration();
 * int timeout = config.getInt(ClientConfiguration.TIMEOUT, 10);
 * }</pre>
 */
public interface ClientConfiguration {

    String API_VERSION = "fmrest.apiVersion";
    String TIMEOUT = "fmrest.timeout";
    String PAGE_SIZE = "fmrest.pageSize";
    String TYPE_CONVERSION = "fmrest.typeConversion";
    String DATE_FORMAT = "fmrest.dateFormat";
    String TIME_FORMAT = "fmrest.timeFormat";
    String TIMESTAMP_FORMAT = "fmrest.timestampFormat";

    /**
     * Gets configuration value by key.
     *
     * @param key Configuration key
     * @return Configuration value or null if not found
     */
    String get(String key);

    /**
     * Gets configuration value by key with default fallback.
     *
     * @param key Configuration key
     * @param defaultValue Default value if key not found
     * @return Configuration value or default value
     */
    default String get(String key, String defaultValue) {
        String value = get(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Gets an integer value.
     *
     * @param key Configuration key
     * @param defaultValue Default value if key not found
     * @return Parsed value or default value
     * @throws IllegalArgumentException If the value is not an integer
     */
    default int getInt(String key, int defaultValue) {
        String value = get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Configuration key " + key + " expects an integer, got: " + value, e);
        }
    }

    /**
     * Gets a boolean value.
     *
     * @param key Configuration key
     * @param defaultValue Default value if key not found
     * @return Parsed value or default value
     */
    default boolean getBoolean(String key, boolean defaultValue) {
        String value = get(key);
        return value != null ? Boolean.parseBoolean(value.trim()) : defaultValue;
    }

    /**
     * Checks if configuration key exists.
     *
     * @param key Configuration key
     * @return true if key exists, false otherwise
     */
    default boolean has(String key) {
        return get(key) != null;
    }
}
