package org.fmrest.dataapi.rest.parser;

import com.google.common.base.Suppliers;
import org.fmrest.dataapi.model.DataInfo;
import org.fmrest.dataapi.model.FieldMetadata;
import org.fmrest.dataapi.model.LayoutMetadata;
import org.fmrest.dataapi.model.ProductInfo;
import org.fmrest.dataapi.model.ScriptResult;
import org.fmrest.dataapi.rest.FieldCoercion;
import org.fmrest.dataapi.rest.Foundset;
import org.fmrest.dataapi.rest.Record;
import org.fmrest.dataapi.rest.exception.ResponseParseException;
import org.fmrest.dataapi.rest.interfaces.RecordGateway;
import org.fmrest.dataapi.rest.interfaces.SchemaProvider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Turns decoded Data API envelopes into records, pages and metadata.
 *
 * <p>Record format:</p>
 * <pre>
 * {
 *   "fieldData": { "name": "Alice", "age": "30" },
 *   "portalData": { "Orders": [ { "recordId": "7", "modId": "0", "Orders::total": 12 } ] },
 *   "recordId": "1",
 *   "modId": "3"
 * }
 * </pre>
 *
 * <p>Known fields are coerced with the layout's {@link FieldCoercion}; fields without
 * metadata are passed through. Portal rows are built on first access.</p>
 */
public class ResponseParser {

    static final String TOKEN_HEADER = "X-FM-Data-Access-Token";

    private static final String[] SCRIPT_PHASES = {"prerequest", "presort", "after"};

    private final SchemaProvider schema;
    private final RecordGateway gateway;

    /**
     * @param schema  Supplies the coercion tables of layouts and portals
     * @param gateway Operations records use to commit, reload and delete themselves
     */
    public ResponseParser(SchemaProvider schema, RecordGateway gateway) {
        this.schema = schema;
        this.gateway = gateway;
    }

    /**
     * Parses the records and counts of a record, list or find response.
     */
    public Foundset.Page parsePage(Envelope envelope, String layout) {
        return new Foundset.Page(parseRecords(envelope, layout), parseDataInfo(envelope));
    }

    public List<Record> parseRecords(Envelope envelope, String layout) {
        Object data = envelope.get("data");
        if (data == null) {
            return Collections.emptyList();
        }
        if (!(data instanceof List)) {
            throw new ResponseParseException("Response data is not an array");
        }
        FieldCoercion coercion = schema.layoutFields(layout);
        List<Record> records = new ArrayList<>();
        for (Object item : (List<?>) data) {
            records.add(parseRecord(asMap(item, "record"), layout, coercion));
        }
        return records;
    }

    /**
     * Parses a single-record response.
     *
     * @throws ResponseParseException If the response holds no record
     */
    public Record parseSingleRecord(Envelope envelope, String layout) {
        List<Record> records = parseRecords(envelope, layout);
        if (records.isEmpty()) {
            throw new ResponseParseException("Response contains no record");
        }
        return records.get(0);
    }

    Record parseRecord(Map<String, Object> raw, String layout, FieldCoercion coercion) {
        long recordId = toLong(raw.get("recordId"), "recordId");
        long modificationId = toLong(raw.get("modId"), "modId");
        Map<String, Object> fields = coerce(asMap(raw.getOrDefault("fieldData", Collections.emptyMap()), "fieldData"),
                coercion);

        Map<String, Supplier<List<Record>>> portals = new LinkedHashMap<>();
        Object portalData = raw.get("portalData");
        if (portalData != null) {
            for (Map.Entry<String, Object> portal : asMap(portalData, "portalData").entrySet()) {
                String portalName = portal.getKey();
                Object rows = portal.getValue();
                FieldCoercion portalCoercion = schema.portalFields(layout, portalName);
                portals.put(portalName,
                        Suppliers.memoize(() -> parsePortalRows(layout, portalName, rows, portalCoercion)));
            }
        }
        return new Record(layout, recordId, modificationId, fields, portals, coercion, gateway);
    }

    /**
     * Static so the memoized supplier holding it references neither this parser nor the client behind it.
     */
    private static List<Record> parsePortalRows(String layout, String portalName, Object rows,
                                                FieldCoercion coercion) {
        if (!(rows instanceof List)) {
            throw new ResponseParseException("Portal " + portalName + " is not an array");
        }
        List<Record> records = new ArrayList<>();
        for (Object item : (List<?>) rows) {
            Map<String, Object> row = new LinkedHashMap<>(asMap(item, "portal row"));
            long recordId = toLong(row.remove("recordId"), "recordId");
            long modificationId = toLong(row.remove("modId"), "modId");
            records.add(Record.portalRow(layout, portalName, recordId, modificationId, coerce(row, coercion), coercion));
        }
        return Collections.unmodifiableList(records);
    }

    private static Map<String, Object> coerce(Map<String, Object> raw, FieldCoercion coercion) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            try {
                fields.put(entry.getKey(), coercion.fromWire(entry.getKey(), entry.getValue()));
            } catch (IllegalArgumentException e) {
                throw new ResponseParseException("Cannot read field " + entry.getKey() + ": " + e.getMessage(), e);
            }
        }
        return fields;
    }

    /**
     * @return Counts of the {@code dataInfo} section, or null if the response has none
     */
    public DataInfo parseDataInfo(Envelope envelope) {
        Object section = envelope.get("dataInfo");
        if (section == null) {
            return null;
        }
        Map<String, Object> map = asMap(section, "dataInfo");
        DataInfo dataInfo = new DataInfo();
        dataInfo.setDatabase(asString(map.get("database")));
        dataInfo.setLayout(asString(map.get("layout")));
        dataInfo.setTable(asString(map.get("table")));
        dataInfo.setTotalRecordCount((int) toLong(map.get("totalRecordCount"), "totalRecordCount"));
        dataInfo.setFoundCount((int) toLong(map.get("foundCount"), "foundCount"));
        dataInfo.setReturnedCount((int) toLong(map.get("returnedCount"), "returnedCount"));
        return dataInfo;
    }

    /**
     * Extracts the results of the scripts run with a request.
     *
     * @return Map: phase ({@code prerequest}, {@code presort}, {@code after}) -> result,
     *         only for phases that ran
     */
    public static Map<String, ScriptResult> parseScriptResults(Envelope envelope) {
        Map<String, ScriptResult> results = new LinkedHashMap<>();
        for (String phase : SCRIPT_PHASES) {
            String suffix = "after".equals(phase) ? "" : "." + phase;
            Object error = envelope.get("scriptError" + suffix);
            if (error == null) {
                continue;
            }
            results.put(phase, new ScriptResult((int) toLong(error, "scriptError" + suffix),
                    asString(envelope.get("scriptResult" + suffix))));
        }
        return results;
    }

    /**
     * Reads the session token from the body, falling back to the token header.
     */
    public static String parseToken(Envelope envelope, Map<String, String> headers) {
        String token = asString(envelope.get("token"));
        if (token == null || token.isEmpty()) {
            token = headers.get(TOKEN_HEADER);
        }
        if (token == null || token.isEmpty()) {
            throw new ResponseParseException("Login response contains no token");
        }
        return token;
    }

    public static long parseRecordId(Envelope envelope) {
        return toLong(envelope.get("recordId"), "recordId");
    }

    public static long parseModificationId(Envelope envelope) {
        return toLong(envelope.get("modId"), "modId");
    }

    public static ProductInfo parseProductInfo(Envelope envelope) {
        Map<String, Object> map = asMap(envelope.get("productInfo"), "productInfo");
        ProductInfo info = new ProductInfo();
        info.setName(asString(map.get("name")));
        info.setVersion(asString(map.get("version")));
        info.setBuildDate(asString(map.get("buildDate")));
        info.setDateFormat(asString(map.get("dateFormat")));
        info.setTimeFormat(asString(map.get("timeFormat")));
        info.setTimeStampFormat(asString(map.get("timeStampFormat")));
        return info;
    }

    public static List<String> parseDatabases(Envelope envelope) {
        List<String> names = new ArrayList<>();
        for (Object item : asList(envelope.get("databases"), "databases")) {
            names.add(asString(asMap(item, "database").get("name")));
        }
        return names;
    }

    /**
     * @return Layout names with folders flattened, in server order
     */
    public static List<String> parseLayouts(Envelope envelope) {
        List<String> names = new ArrayList<>();
        flattenFolders(asList(envelope.get("layouts"), "layouts"), "folderLayoutNames", names);
        return names;
    }

    /**
     * @return Script names with folders flattened, in server order
     */
    public static List<String> parseScripts(Envelope envelope) {
        List<String> names = new ArrayList<>();
        flattenFolders(asList(envelope.get("scripts"), "scripts"), "folderScriptNames", names);
        return names;
    }

    private static void flattenFolders(List<?> items, String childrenKey, List<String> names) {
        for (Object item : items) {
            Map<String, Object> entry = asMap(item, childrenKey);
            if (Boolean.TRUE.equals(entry.get("isFolder")) || "true".equals(asString(entry.get("isFolder")))) {
                Object children = entry.get(childrenKey);
                if (children != null) {
                    flattenFolders(asList(children, childrenKey), childrenKey, names);
                }
            } else {
                names.add(asString(entry.get("name")));
            }
        }
    }

    public static LayoutMetadata parseLayoutMetadata(Envelope envelope, String layout) {
        LayoutMetadata metadata = new LayoutMetadata();
        metadata.setLayout(layout);
        Object fields = envelope.get("fieldMetaData");
        if (fields != null) {
            metadata.setFields(parseFieldMetadata(asList(fields, "fieldMetaData")));
        }
        Object portals = envelope.get("portalMetaData");
        if (portals != null) {
            for (Map.Entry<String, Object> portal : asMap(portals, "portalMetaData").entrySet()) {
                metadata.getPortals().put(portal.getKey(), parseFieldMetadata(asList(portal.getValue(), portal.getKey())));
            }
        }
        return metadata;
    }

    private static List<FieldMetadata> parseFieldMetadata(List<?> items) {
        List<FieldMetadata> fields = new ArrayList<>();
        for (Object item : items) {
            Map<String, Object> map = asMap(item, "field metadata");
            FieldMetadata field = new FieldMetadata();
            field.setName(asString(map.get("name")));
            field.setType(asString(map.get("type")));
            field.setDisplayType(asString(map.get("displayType")));
            field.setResult(asString(map.get("result")));
            field.setGlobal(Boolean.TRUE.equals(map.get("global")) || "true".equals(asString(map.get("global"))));
            Object maxRepeat = map.get("maxRepeat");
            field.setMaxRepeat(maxRepeat == null ? 1 : (int) toLong(maxRepeat, "maxRepeat"));
            fields.add(field);
        }
        return fields;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String what) {
        if (!(value instanceof Map)) {
            throw new ResponseParseException("Expected an object for " + what + ", got " + value);
        }
        return (Map<String, Object>) value;
    }

    private static List<?> asList(Object value, String what) {
        if (!(value instanceof List)) {
            throw new ResponseParseException("Expected an array for " + what + ", got " + value);
        }
        return (List<?>) value;
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    /**
     * The Data API sends ids and counts as strings or numbers.
     */
    private static long toLong(Object value, String what) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value == null) {
            throw new ResponseParseException("Missing " + what);
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ResponseParseException("Invalid " + what + ": " + value, e);
        }
    }
}
