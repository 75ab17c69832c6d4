package org.fmrest.dataapi.rest;

import org.fmrest.dataapi.model.FieldMetadata;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Field coercion table of one layout (or of one portal on it).
 * <p>
 * Resolves a field name to its declared metadata and converts values in both directions.
 * Repeating fields appear on the wire as {@code name(2)}, {@code name(3)}, ...; those keys
 * resolve to the metadata of {@code name}. Fields without metadata pass through untouched.
 * </p>
 */
public class FieldCoercion {

    private static final Pattern REPETITION = Pattern.compile("^(.+)\\((\\d{1,9})\\)$");

    private static final FieldCoercion PASS_THROUGH = new FieldCoercion(Collections.emptyList(), DateFormats.defaults());

    /** Map: field name -> metadata */
    private final Map<String, FieldMetadata> metadata;
    private final DateFormats formats;

    public FieldCoercion(Collection<FieldMetadata> fields, DateFormats formats) {
        this.metadata = new LinkedHashMap<>();
        for (FieldMetadata field : fields) {
            this.metadata.put(field.getName(), field);
        }
        this.formats = formats;
    }

    /**
     * Table without metadata: every value is passed through as read from the wire.
     */
    public static FieldCoercion passThrough() {
        return PASS_THROUGH;
    }

    /**
     * Finds the metadata of a field, resolving repetition suffixes.
     *
     * @param fieldName Name as it appears on the wire
     * @return Metadata, or null for unknown fields
     */
    public FieldMetadata lookup(String fieldName) {
        FieldMetadata field = metadata.get(fieldName);
        if (field != null) {
            return field;
        }
        Matcher matcher = REPETITION.matcher(fieldName);
        if (matcher.matches()) {
            FieldMetadata base = metadata.get(matcher.group(1));
            if (base != null && Integer.parseInt(matcher.group(2)) <= Math.max(base.getMaxRepeat(), 1)) {
                return base;
            }
        }
        return null;
    }

    /**
     * @return Declared type of the field, or null if it is unknown or of an unknown type
     */
    public FieldType typeOf(String fieldName) {
        FieldMetadata field = lookup(fieldName);
        return field == null ? null : FieldType.of(field.getResult());
    }

    public Object fromWire(String fieldName, Object raw) {
        FieldType fieldType = typeOf(fieldName);
        if (fieldType == null) {
            return raw;
        }
        return FieldValueConverter.fromWire(raw, fieldType, formats);
    }

    public Object toWire(String fieldName, Object value) {
        FieldType fieldType = typeOf(fieldName);
        if (fieldType == null) {
            if (value == null) {
                return "";
            }
            return value instanceof String || value instanceof Number ? value : value.toString();
        }
        return FieldValueConverter.toWire(value, fieldType, formats);
    }

    /**
     * Converts a whole {@code fieldData} map for a request body.
     */
    public Map<String, Object> toWire(Map<String, ?> values) {
        Map<String, Object> wire = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            wire.put(entry.getKey(), toWire(entry.getKey(), entry.getValue()));
        }
        return wire;
    }

    public DateFormats getFormats() {
        return formats;
    }
}
