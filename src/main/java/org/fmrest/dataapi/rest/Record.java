package org.fmrest.dataapi.rest;

import org.fmrest.dataapi.rest.exception.FieldNotFoundException;
import org.fmrest.dataapi.rest.exception.StaleRecordException;
import org.fmrest.dataapi.rest.interfaces.RecordGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.WeakReference;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * One record of a layout, as returned by the server.
 * <p>
 * Field values are coerced to Java types according to the layout metadata. Changes made
 * with {@link #set(String, Object)} stay local until {@link #commit()} sends them in one
 * edit request, together with the modification id the record was read with.
 * </p>
 * <p>
 * Structural attributes ({@link #getRecordId()}, {@link #getModificationId()}) never mix
 * with field values: a field literally named {@code recordId} is read with
 * {@code field("recordId")}.
 * </p>
 * <p>
 * The record keeps only a weak reference to the client it came from. Portal rows are
 * read-only snapshots. Instances are not thread safe.
 * </p>
 */
public class Record {

    private static final Logger logger = LoggerFactory.getLogger(Record.class);

    private final String layout;
    private final long recordId;
    private long modificationId;
    /** Map: field name -> typed value, in server order */
    private Map<String, Object> fields;
    private final Set<String> dirtyFields = new LinkedHashSet<>();
    /** Map: portal name -> rows, built on first access */
    private Map<String, Supplier<List<Record>>> portals;
    private FieldCoercion coercion;
    private final WeakReference<RecordGateway> gateway;
    /** Portal this row belongs to, null for layout records */
    private final String portalName;
    private boolean deleted;

    /**
     * Creates a layout record. Used by the response parser.
     *
     * @param layout         Layout the record was read through
     * @param recordId       Server-assigned id
     * @param modificationId Modification id at read time
     * @param fields         Typed field values
     * @param portals        Portal name -> supplier of its rows
     * @param coercion       Coercion table of the layout, used to validate writes
     * @param gateway        Operations used to commit, reload and delete
     */
    public Record(String layout, long recordId, long modificationId, Map<String, Object> fields,
                  Map<String, Supplier<List<Record>>> portals, FieldCoercion coercion, RecordGateway gateway) {
        this(layout, recordId, modificationId, fields, portals, coercion, gateway, null);
    }

    private Record(String layout, long recordId, long modificationId, Map<String, Object> fields,
                   Map<String, Supplier<List<Record>>> portals, FieldCoercion coercion, RecordGateway gateway,
                   String portalName) {
        this.layout = layout;
        this.recordId = recordId;
        this.modificationId = modificationId;
        this.fields = new LinkedHashMap<>(fields);
        this.portals = new LinkedHashMap<>(portals);
        this.coercion = coercion;
        this.gateway = new WeakReference<>(gateway);
        this.portalName = portalName;
    }

    /**
     * Creates a read-only row of a portal.
     *
     * @param layout         Layout of the parent record
     * @param portalName     Portal the row was listed in
     * @param recordId       Id of the related record
     * @param modificationId Modification id of the related record
     * @param fields         Typed field values ({@code Table::field} names)
     * @param coercion       Coercion table of the portal
     */
    public static Record portalRow(String layout, String portalName, long recordId, long modificationId,
                                   Map<String, Object> fields, FieldCoercion coercion) {
        return new Record(layout, recordId, modificationId, fields, Collections.emptyMap(), coercion, null, portalName);
    }

    public String getLayout() {
        return layout;
    }

    public long getRecordId() {
        return recordId;
    }

    public long getModificationId() {
        return modificationId;
    }

    /**
     * @return Name of the portal this row belongs to, or null for a layout record
     */
    public String getPortalName() {
        return portalName;
    }

    public boolean isPortalRow() {
        return portalName != null;
    }

    public boolean isDeleted() {
        return deleted;
    }

    /**
     * Returns the value of a field. Never calls the server.
     *
     * @param fieldName Field name as placed on the layout
     * @return Typed value, possibly null
     * @throws FieldNotFoundException If the record has no such field
     */
    public Object field(String fieldName) {
        if (!fields.containsKey(fieldName)) {
            throw new FieldNotFoundException(fieldName);
        }
        return fields.get(fieldName);
    }

    /**
     * Same as {@link #field(String)}.
     */
    public Object get(String fieldName) {
        return field(fieldName);
    }

    /**
     * Returns the value of a field cast to the expected type.
     *
     * @throws ClassCastException If the value has another type
     */
    public <T> T get(String fieldName, Class<T> type) {
        return type.cast(field(fieldName));
    }

    public Set<String> getFieldNames() {
        return Collections.unmodifiableSet(fields.keySet());
    }

    public boolean hasField(String fieldName) {
        return fields.containsKey(fieldName);
    }

    /**
     * Changes a field locally and marks it dirty. Setting the current value again does
     * not mark the field. Nothing is sent until {@link #commit()}.
     *
     * @param fieldName Existing field of the record
     * @param value     New value: a typed value matching the field, a wire-format String, or null.
     *                  Wire strings of typed fields are stored as typed values
     * @throws FieldNotFoundException   If the record has no such field
     * @throws IllegalArgumentException If the value does not fit the field's declared type, or the field is a container
     * @throws StaleRecordException     If the record was deleted or is a portal row
     */
    public void set(String fieldName, Object value) {
        if (isPortalRow()) {
            throw new StaleRecordException("Rows of portal " + portalName + " are read-only");
        }
        if (deleted) {
            throw new StaleRecordException("Record " + recordId + " was deleted");
        }
        if (!fields.containsKey(fieldName)) {
            throw new FieldNotFoundException(fieldName);
        }
        if (coercion.typeOf(fieldName) == FieldType.CONTAINER) {
            throw new IllegalArgumentException("Container field " + fieldName + " is written with an upload, not with set");
        }
        coercion.toWire(fieldName, value);
        Object typed = value;
        FieldType fieldType = coercion.typeOf(fieldName);
        if (value instanceof String && fieldType != null && fieldType != FieldType.TEXT) {
            typed = coercion.fromWire(fieldName, value);
        }

        if (sameValue(fields.get(fieldName), typed)) {
            return;
        }
        fields.put(fieldName, typed);
        dirtyFields.add(fieldName);
    }

    private static boolean sameValue(Object current, Object value) {
        if (current instanceof BigDecimal && value instanceof BigDecimal) {
            return ((BigDecimal) current).compareTo((BigDecimal) value) == 0;
        }
        return Objects.equals(current, value);
    }

    public boolean isDirty() {
        return !dirtyFields.isEmpty();
    }

    public Set<String> getDirtyFields() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(dirtyFields));
    }

    /**
     * @return Field name -> new value of every field changed since the last read or commit
     */
    public Map<String, Object> getModifications() {
        Map<String, Object> modifications = new LinkedHashMap<>();
        for (String fieldName : dirtyFields) {
            modifications.put(fieldName, fields.get(fieldName));
        }
        return modifications;
    }

    /**
     * Sends the dirty fields to the server in one edit.
     * <p>
     * Does nothing when no field is dirty. On success the dirty set is cleared and the
     * modification id is taken from the server. On any failure, including
     * {@link org.fmrest.dataapi.rest.exception.RecordConflictException}, the record is
     * left as it was so the caller can reload and decide.
     * </p>
     */
    public void commit() {
        RecordGateway recordGateway = requireGateway();
        if (dirtyFields.isEmpty()) {
            return;
        }
        long newModificationId = recordGateway.editRecord(layout, recordId, modificationId, getModifications());
        logger.debug("Committed {} field(s) of record {}, modId {} -> {}",
                dirtyFields.size(), recordId, modificationId, newModificationId);
        modificationId = Math.max(modificationId, newModificationId);
        dirtyFields.clear();
    }

    /**
     * Re-reads the record from the server. Uncommitted changes are discarded.
     */
    public void reload() {
        RecordGateway recordGateway = requireGateway();
        Record fresh = recordGateway.getRecord(layout, recordId);
        if (!dirtyFields.isEmpty()) {
            logger.debug("Reload of record {} discards changes to {}", recordId, dirtyFields);
        }
        fields = new LinkedHashMap<>(fresh.fields);
        portals = new LinkedHashMap<>(fresh.portals);
        coercion = fresh.coercion;
        modificationId = fresh.modificationId;
        dirtyFields.clear();
    }

    /**
     * Deletes the record on the server. Afterwards the record can no longer be committed,
     * reloaded or deleted.
     */
    public void delete() {
        RecordGateway recordGateway = requireGateway();
        recordGateway.deleteRecord(layout, recordId);
        deleted = true;
        dirtyFields.clear();
    }

    /**
     * Returns the rows of a portal, building them on first access.
     *
     * @param name Portal object name (or related table name if the portal has none)
     * @return Rows in server order
     * @throws IllegalArgumentException If the response contained no such portal
     */
    public List<Record> getPortal(String name) {
        Supplier<List<Record>> rows = portals.get(name);
        if (rows == null) {
            throw new IllegalArgumentException("No portal named " + name + " on record " + recordId
                    + ". Available portals: " + portals.keySet());
        }
        return rows.get();
    }

    public Set<String> getPortalNames() {
        return Collections.unmodifiableSet(portals.keySet());
    }

    /**
     * Copies the field values into a map.
     *
     * @param includePortals Whether to add each portal as a list of row maps under its name
     */
    public Map<String, Object> toMap(boolean includePortals) {
        Map<String, Object> map = new LinkedHashMap<>(fields);
        if (includePortals) {
            for (String name : portals.keySet()) {
                map.put(name, getPortal(name).stream()
                        .map(row -> row.toMap(false))
                        .collect(Collectors.toList()));
            }
        }
        return map;
    }

    private RecordGateway requireGateway() {
        if (isPortalRow()) {
            throw new StaleRecordException("Rows of portal " + portalName + " are read-only");
        }
        if (deleted) {
            throw new StaleRecordException("Record " + recordId + " was deleted");
        }
        RecordGateway recordGateway = gateway.get();
        if (recordGateway == null) {
            throw new StaleRecordException("The client record " + recordId + " was read with is no longer available");
        }
        return recordGateway;
    }

    @Override
    public String toString() {
        return "Record(id=" + recordId + ", modId=" + modificationId
                + (isPortalRow() ? ", portal=" + portalName : "")
                + (dirtyFields.isEmpty() ? "" : ", dirty=" + dirtyFields) + ")";
    }
}
