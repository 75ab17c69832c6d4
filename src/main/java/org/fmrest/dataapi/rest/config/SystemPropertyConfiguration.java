package org.fmrest.dataapi.rest.config;

/**
 * Configuration implementation that reads from Java system properties.
 *
 * <p>Uses {@link System#getProperty(String)} to retrieve configuration values.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * // Set system property
 * System.setProperty("fmrest.timeout", "30");
 *
 * // Read via configuration
 * ClientConfiguration config = new SystemPropertyConfiguration();
 * int timeout = config.getInt(ClientConfiguration.TIMEOUT, 10);
 * }</pre>
 */
public class SystemPropertyConfiguration implements ClientConfiguration {

    @Override
    public String get(String key) {
        return System.getProperty(key);
    }
}
