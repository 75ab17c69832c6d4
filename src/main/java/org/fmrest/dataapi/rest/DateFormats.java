package org.fmrest.dataapi.rest;

import lombok.Getter;
import org.apache.commons.lang3.time.FastDateFormat;

import java.util.TimeZone;

/**
 * Date, time and timestamp formats used by a server on the wire.
 * <p>
 * Values carry no zone: patterns are applied in GMT and converted to local
 * date/time types, so no offset is ever added.
 * </p>
 */
@Getter
public class DateFormats {

    static final TimeZone GMT = TimeZone.getTimeZone("GMT");

    public static final String DEFAULT_DATE_FORMAT = "MM/dd/yyyy";
    public static final String DEFAULT_TIME_FORMAT = "HH:mm:ss";
    public static final String DEFAULT_TIMESTAMP_FORMAT = "MM/dd/yyyy HH:mm:ss";

    private final FastDateFormat dateFormat;
    private final FastDateFormat timeFormat;
    private final FastDateFormat timestampFormat;

    public DateFormats(String datePattern, String timePattern, String timestampPattern) {
        this.dateFormat = FastDateFormat.getInstance(orDefault(datePattern, DEFAULT_DATE_FORMAT), GMT);
        this.timeFormat = FastDateFormat.getInstance(orDefault(timePattern, DEFAULT_TIME_FORMAT), GMT);
        this.timestampFormat = FastDateFormat.getInstance(orDefault(timestampPattern, DEFAULT_TIMESTAMP_FORMAT), GMT);
    }

    public static DateFormats defaults() {
        return new DateFormats(null, null, null);
    }

    private static String orDefault(String pattern, String defaultPattern) {
        return pattern == null || pattern.isEmpty() ? defaultPattern : pattern;
    }
}
