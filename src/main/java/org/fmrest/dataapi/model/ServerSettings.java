package org.fmrest.dataapi.model;

import lombok.Data;
import org.fmrest.dataapi.rest.config.ClientConfiguration;
import org.fmrest.dataapi.rest.config.SystemPropertyConfiguration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Connection settings of a {@link org.fmrest.dataapi.rest.FileMakerServer}.
 */
@Data
public class ServerSettings {
    /** Server address without path, e.g. https://fms.example.com */
    private String url;
    private String database;
    private String layout;
    private String apiVersion = "vLatest";
    private Duration timeout = Duration.ofSeconds(10);
    private int pageSize = 100;
    private boolean typeConversion = true;

    // Null means: use the format reported by the server's product info.
    private String dateFormat;
    private String timeFormat;
    private String timestampFormat;

    private List<DataSource> dataSources = new ArrayList<>();

    public ServerSettings() {
    }

    public ServerSettings(String url, String database, String layout) {
        this.url = url;
        this.database = database;
        this.layout = layout;
    }

    /**
     * Builds settings with defaults taken from system properties.
     *
     * @see #fromConfiguration(String, String, String, ClientConfiguration)
     */
    public static ServerSettings fromSystemProperties(String url, String database, String layout) {
        return fromConfiguration(url, database, layout, new SystemPropertyConfiguration());
    }

    /**
     * Builds settings for a database and layout, reading the tunables from a configuration source.
     *
     * @param url Server address
     * @param database Database name without extension
     * @param layout Layout to work with
     * @param configuration Source of the {@code fmrest.*} keys
     * @return Populated settings
     */
    public static ServerSettings fromConfiguration(String url, String database, String layout,
                                                   ClientConfiguration configuration) {
        ServerSettings settings = new ServerSettings(url, database, layout);
        settings.setApiVersion(configuration.get(ClientConfiguration.API_VERSION, settings.getApiVersion()));
        settings.setTimeout(Duration.ofSeconds(configuration.getInt(ClientConfiguration.TIMEOUT, 10)));
        settings.setPageSize(configuration.getInt(ClientConfiguration.PAGE_SIZE, settings.getPageSize()));
        settings.setTypeConversion(configuration.getBoolean(ClientConfiguration.TYPE_CONVERSION, true));
        settings.setDateFormat(configuration.get(ClientConfiguration.DATE_FORMAT));
        settings.setTimeFormat(configuration.get(ClientConfiguration.TIME_FORMAT));
        settings.setTimestampFormat(configuration.get(ClientConfiguration.TIMESTAMP_FORMAT));
        return settings;
    }
}
