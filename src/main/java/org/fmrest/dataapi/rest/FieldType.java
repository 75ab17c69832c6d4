package org.fmrest.dataapi.rest;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps the result type a layout declares for a field to the Java type the client exposes.
 */
public enum FieldType {

    TEXT(String.class, "text"),
    NUMBER(BigDecimal.class, "number"),
    DATE(LocalDate.class, "date"),
    TIME(LocalTime.class, "time"),
    TIMESTAMP(LocalDateTime.class, "timestamp"),
    CONTAINER(ContainerReference.class, "container");

    /** Java class of coerced values */
    private final Class<?> clazz;
    /** Lower-case result name used by the layout metadata */
    private final String simpleName;

    /** Fast lookup: result name -> FieldType */
    private static final Map<String, FieldType> MAP = new HashMap<>();

    static {
        for (FieldType value : values()) {
            MAP.put(value.simpleName, value);
        }
    }

    FieldType(Class<?> clazz, String simpleName) {
        this.clazz = clazz;
        this.simpleName = simpleName;
    }

    public Class<?> getJavaClass() {
        return clazz;
    }

    /**
     * Looks up the field type by its metadata name ("text", "number", "timeStamp", ...).
     * @param result Result name, case-insensitive
     * @return Matching FieldType, or null if not found.
     */
    public static FieldType of(String result) {
        return result == null ? null : MAP.get(result.toLowerCase(Locale.ROOT));
    }
}
