package org.fmrest.dataapi.rest;

import org.apache.commons.lang3.time.FastDateFormat;

import java.math.BigDecimal;
import java.text.ParseException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Date;

/**
 * Converts field values between their wire representation and typed values based on {@link FieldType}.
 *
 * <p>Handles conversion from:</p>
 * <ul>
 *   <li>JSON strings and numbers to {@link BigDecimal}</li>
 *   <li>Server formatted date/time strings to {@link LocalDate}, {@link LocalTime}, {@link LocalDateTime}</li>
 *   <li>Container URLs to {@link ContainerReference}</li>
 * </ul>
 *
 * <p>An empty string is the wire form of "no value" for every type but text.</p>
 */
public class FieldValueConverter {

    private FieldValueConverter() {
    }

    /**
     * Converts a wire value to the typed value of a field.
     *
     * @param raw Value as found in the JSON response (String, Number or null)
     * @param fieldType Declared type of the field
     * @param formats Server date formats
     * @return Converted typed value
     * @throws IllegalArgumentException If the wire value does not match the type
     */
    public static Object fromWire(Object raw, FieldType fieldType, DateFormats formats) {
        if (raw == null) {
            return null;
        }
        if (fieldType == FieldType.TEXT) {
            return raw.toString();
        }
        String text = raw.toString();
        if (text.isEmpty()) {
            return null;
        }

        try {
            switch (fieldType) {
                case NUMBER:
                    return new BigDecimal(text.trim());

                case DATE:
                    return toLocalDateTime(formats.getDateFormat().parse(text)).toLocalDate();

                case TIME:
                    return toLocalDateTime(formats.getTimeFormat().parse(text)).toLocalTime();

                case TIMESTAMP:
                    return toLocalDateTime(formats.getTimestampFormat().parse(text));

                case CONTAINER:
                    return new ContainerReference(text);

                default:
                    return text;
            }
        } catch (ParseException | NumberFormatException e) {
            throw new IllegalArgumentException("Failed to parse value: " + raw + " as " + fieldType, e);
        }
    }

    /**
     * Converts a typed value to what is sent in {@code fieldData}.
     * <p>
     * Strings are accepted for every type as long as they parse, and are sent unchanged.
     * </p>
     *
     * @param value Typed value, a String in wire format, or null to clear the field
     * @param fieldType Declared type of the field
     * @param formats Server date formats
     * @return String or Number to put in the request body
     * @throws IllegalArgumentException If the value cannot be stored in a field of that type
     */
    public static Object toWire(Object value, FieldType fieldType, DateFormats formats) {
        if (value == null) {
            return "";
        }
        if (value instanceof String) {
            if (fieldType != FieldType.TEXT) {
                // validate only, the server receives the string as typed
                fromWire(value, fieldType, formats);
            }
            return value;
        }

        switch (fieldType) {
            case TEXT:
                return value.toString();

            case NUMBER:
                if (value instanceof Number) {
                    return value;
                }
                break;

            case DATE:
                if (value instanceof LocalDate) {
                    return format(formats.getDateFormat(), ((LocalDate) value).atStartOfDay());
                }
                if (value instanceof Date) {
                    return formats.getDateFormat().format((Date) value);
                }
                break;

            case TIME:
                if (value instanceof LocalTime) {
                    return format(formats.getTimeFormat(), ((LocalTime) value).atDate(LocalDate.EPOCH));
                }
                break;

            case TIMESTAMP:
                if (value instanceof LocalDateTime) {
                    return format(formats.getTimestampFormat(), (LocalDateTime) value);
                }
                if (value instanceof Date) {
                    return formats.getTimestampFormat().format((Date) value);
                }
                break;

            case CONTAINER:
                if (value instanceof ContainerReference) {
                    return ((ContainerReference) value).getUrl();
                }
                break;

            default:
                break;
        }
        throw new IllegalArgumentException("Value " + value + " of type " + value.getClass().getSimpleName()
                + " cannot be stored in a " + fieldType + " field");
    }

    private static LocalDateTime toLocalDateTime(Date date) {
        return LocalDateTime.ofInstant(date.toInstant(), ZoneOffset.UTC);
    }

    private static String format(FastDateFormat format, LocalDateTime value) {
        return format.format(Date.from(value.toInstant(ZoneOffset.UTC)));
    }
}
