package org.fmrest.dataapi.rest.service;

import com.google.common.base.Preconditions;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.core5.http.Method;
import org.fmrest.dataapi.model.FindQuery;
import org.fmrest.dataapi.model.LayoutMetadata;
import org.fmrest.dataapi.model.PortalRequest;
import org.fmrest.dataapi.model.ProductInfo;
import org.fmrest.dataapi.model.ScriptResult;
import org.fmrest.dataapi.model.Scripts;
import org.fmrest.dataapi.model.ServerSettings;
import org.fmrest.dataapi.model.SortOrder;
import org.fmrest.dataapi.rest.ContainerReference;
import org.fmrest.dataapi.rest.FieldCoercion;
import org.fmrest.dataapi.rest.FileMakerErrorCode;
import org.fmrest.dataapi.rest.Foundset;
import org.fmrest.dataapi.rest.HttpResult;
import org.fmrest.dataapi.rest.Record;
import org.fmrest.dataapi.rest.exception.RecordConflictException;
import org.fmrest.dataapi.rest.exception.ResponseParseException;
import org.fmrest.dataapi.rest.exception.ServiceException;
import org.fmrest.dataapi.rest.exception.TokenExpiredException;
import org.fmrest.dataapi.rest.interfaces.PageFetcher;
import org.fmrest.dataapi.rest.interfaces.RecordGateway;
import org.fmrest.dataapi.rest.interfaces.SchemaProvider;
import org.fmrest.dataapi.rest.parser.Envelope;
import org.fmrest.dataapi.rest.parser.ResponseParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One method per Data API operation.
 *
 * <p>Every call:</p>
 * <ol>
 *   <li>takes the token from the {@link SessionManager} (no request is sent without one)</li>
 *   <li>renders path and body</li>
 *   <li>sends the request with the configured timeout</li>
 *   <li>maps message codes to exceptions; an invalid token resets the session</li>
 *   <li>hands the envelope to the {@link ResponseParser}</li>
 * </ol>
 *
 * <p>Nothing is retried. Not thread safe.</p>
 */
public class RequestDispatcher implements RecordGateway {

    private static final Logger logger = LoggerFactory.getLogger(RequestDispatcher.class);

    private final ServerSettings settings;
    private final HttpRequestBuilder requestBuilder;
    private final ServiceCaller caller;
    private final SessionManager session;
    private final SchemaProvider schema;
    private final ResponseParser parser;

    private int lastErrorCode = ServiceException.NO_CODE;
    private Map<String, ScriptResult> lastScriptResults = Collections.emptyMap();

    public RequestDispatcher(ServerSettings settings, HttpRequestBuilder requestBuilder, ServiceCaller caller,
                             SessionManager session) {
        this.settings = settings;
        this.requestBuilder = requestBuilder;
        this.caller = caller;
        this.session = session;
        this.schema = settings.isTypeConversion()
                ? new LayoutSchemaCache(layout -> loadLayoutMetadata(layout, false), () -> loadProductInfo(false), settings)
                : SchemaProvider.PASS_THROUGH;
        this.parser = new ResponseParser(schema, this);
    }

    // Records

    /**
     * Reads one record.
     *
     * @param layout Layout to read through
     * @param recordId Record id
     * @param portals Portals to include, all portals when null or empty
     * @param scripts Scripts to run, may be null
     */
    public Record getRecord(String layout, long recordId, List<PortalRequest> portals, Scripts scripts) {
        Map<String, String> parameters = new LinkedHashMap<>(RequestParameters.portalQueryParameters(portals));
        parameters.putAll(RequestParameters.scriptParameters(scripts));

        HttpUriRequestBase request = requestBuilder.buildRequest(Method.GET, ApiPath.RECORD,
                recordVariables(layout, recordId), parameters, null);
        Envelope envelope = executeChecked(request);
        return parser.parseSingleRecord(envelope, layout);
    }

    @Override
    public Record getRecord(String layout, long recordId) {
        return getRecord(layout, recordId, null, null);
    }

    /**
     * Lists the records of a layout. Further pages are requested while the foundset is read.
     *
     * @param layout Layout to read through
     * @param offset 1-based offset of the first record
     * @param limit Page size; the configured page size when not positive
     * @param sort Sort criteria, may be empty
     * @param portals Portals to include, may be null
     * @param scripts Scripts to run with the first page, may be null
     */
    public Foundset getRecords(String layout, int offset, int limit, List<SortOrder> sort,
                               List<PortalRequest> portals, Scripts scripts) {
        Preconditions.checkArgument(offset >= 1, "offset must be >= 1, got %s", offset);
        int pageSize = limit > 0 ? limit : settings.getPageSize();

        List<SortOrder> sortSnapshot = snapshot(sort);
        List<PortalRequest> portalsSnapshot = snapshot(portals);
        PageFetcher nextPages = pageOffset ->
                fetchRecordsPage(layout, pageOffset, pageSize, sortSnapshot, portalsSnapshot, null);
        Foundset.Page firstPage = fetchRecordsPage(layout, offset, pageSize, sortSnapshot, portalsSnapshot, scripts);
        return new Foundset(firstPage, offset, pageSize, nextPages);
    }

    private Foundset.Page fetchRecordsPage(String layout, int offset, int limit, List<SortOrder> sort,
                                           List<PortalRequest> portals, Scripts scripts) {
        Map<String, String> parameters = new LinkedHashMap<>(RequestParameters.listParameters(offset, limit, sort));
        parameters.putAll(RequestParameters.portalQueryParameters(portals));
        parameters.putAll(RequestParameters.scriptParameters(scripts));

        HttpUriRequestBase request = requestBuilder.buildRequest(Method.GET, ApiPath.RECORDS,
                layoutVariables(layout), parameters, null);
        return recordsPage(execute(request, true, true), layout);
    }

    /**
     * Runs a find request. A find that matches nothing gives an empty foundset.
     *
     * @param layout Layout to search through
     * @param query Find requests, at least one
     * @param sort Sort criteria, may be empty
     * @param offset 1-based offset of the first record
     * @param limit Page size; the configured page size when not positive
     * @param portals Portals to include, may be null
     * @param scripts Scripts to run with the first page, may be null
     */
    public Foundset find(String layout, FindQuery query, List<SortOrder> sort, int offset, int limit,
                         List<PortalRequest> portals, Scripts scripts) {
        Preconditions.checkArgument(query != null && !query.isEmpty(), "find query needs at least one request");
        Preconditions.checkArgument(offset >= 1, "offset must be >= 1, got %s", offset);
        int pageSize = limit > 0 ? limit : settings.getPageSize();

        FindQuery querySnapshot = query.copy();
        List<SortOrder> sortSnapshot = snapshot(sort);
        List<PortalRequest> portalsSnapshot = snapshot(portals);
        PageFetcher nextPages = pageOffset ->
                fetchFindPage(layout, querySnapshot, sortSnapshot, pageOffset, pageSize, portalsSnapshot, null);
        Foundset.Page firstPage = fetchFindPage(layout, querySnapshot, sortSnapshot, offset, pageSize,
                portalsSnapshot, scripts);
        if (firstPage.getRecords().isEmpty()) {
            return Foundset.empty(firstPage.getDataInfo());
        }
        return new Foundset(firstPage, offset, pageSize, nextPages);
    }

    private Foundset.Page fetchFindPage(String layout, FindQuery query, List<SortOrder> sort, int offset, int limit,
                                        List<PortalRequest> portals, Scripts scripts) {
        HttpUriRequestBase request = requestBuilder.buildRequest(Method.POST, ApiPath.FIND, layoutVariables(layout),
                Collections.emptyMap(), RequestParameters.findBody(query, sort, offset, limit, portals, scripts));
        return recordsPage(execute(request, true, true), layout);
    }

    private Foundset.Page recordsPage(Envelope envelope, String layout) {
        if (envelope.getCode() == FileMakerErrorCode.NO_RECORDS_MATCH.getCode()) {
            logger.debug("No records match on layout {}", layout);
            return Foundset.Page.empty();
        }
        checkSuccess(envelope);
        return parser.parsePage(envelope, layout);
    }

    /**
     * Creates a record.
     *
     * @param layout Layout to create through
     * @param fieldData Field name -> typed value or wire string
     * @param portalData Portal name -> rows to create in it, may be null
     * @param scripts Scripts to run, may be null
     * @return Id of the new record
     */
    public long createRecord(String layout, Map<String, ?> fieldData, Map<String, List<Map<String, ?>>> portalData,
                             Scripts scripts) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("fieldData", schema.layoutFields(layout).toWire(fieldData));
        if (portalData != null && !portalData.isEmpty()) {
            Map<String, Object> portals = new LinkedHashMap<>();
            for (Map.Entry<String, List<Map<String, ?>>> portal : portalData.entrySet()) {
                FieldCoercion coercion = schema.portalFields(layout, portal.getKey());
                List<Map<String, Object>> rows = new ArrayList<>();
                for (Map<String, ?> row : portal.getValue()) {
                    rows.add(coercion.toWire(row));
                }
                portals.put(portal.getKey(), rows);
            }
            body.put("portalData", portals);
        }
        body.putAll(RequestParameters.scriptParameters(scripts));

        HttpUriRequestBase request = requestBuilder.buildRequest(Method.POST, ApiPath.RECORDS,
                layoutVariables(layout), Collections.emptyMap(), body);
        long recordId = ResponseParser.parseRecordId(executeChecked(request));
        logger.debug("Created record {} on layout {}", recordId, layout);
        return recordId;
    }

    /**
     * Edits a record. The edit is refused when the record was modified on the server
     * since {@code modificationId}.
     *
     * @return The record's new modification id
     * @throws RecordConflictException If the modification id does not match
     */
    public long editRecord(String layout, long recordId, long modificationId, Map<String, ?> fieldData,
                           Scripts scripts) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("fieldData", schema.layoutFields(layout).toWire(fieldData));
        body.put("modId", String.valueOf(modificationId));
        body.putAll(RequestParameters.scriptParameters(scripts));

        HttpUriRequestBase request = requestBuilder.buildRequest(Method.PATCH, ApiPath.RECORD,
                recordVariables(layout, recordId), Collections.emptyMap(), body);
        Envelope envelope = execute(request, true, true);
        if (envelope.getCode() == FileMakerErrorCode.MODIFICATION_ID_MISMATCH.getCode()) {
            throw new RecordConflictException(envelope.getCode(), envelope.getMessage(), recordId, modificationId);
        }
        checkSuccess(envelope);
        return ResponseParser.parseModificationId(envelope);
    }

    @Override
    public long editRecord(String layout, long recordId, long modificationId, Map<String, ?> fieldData) {
        return editRecord(layout, recordId, modificationId, fieldData, null);
    }

    public void deleteRecord(String layout, long recordId, Scripts scripts) {
        HttpUriRequestBase request = requestBuilder.buildRequest(Method.DELETE, ApiPath.RECORD,
                recordVariables(layout, recordId), RequestParameters.scriptParameters(scripts), null);
        executeChecked(request);
        logger.debug("Deleted record {} on layout {}", recordId, layout);
    }

    @Override
    public void deleteRecord(String layout, long recordId) {
        deleteRecord(layout, recordId, null);
    }

    // Scripts and globals

    /**
     * Runs a script in the context of a layout.
     *
     * @param layout Layout the script runs on
     * @param name Script name
     * @param parameter Script parameter, may be null
     * @return Script error (0 when the script succeeded) and result
     */
    public ScriptResult callScript(String layout, String name, String parameter) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (parameter != null) {
            body.put("script.param", parameter);
        }
        Map<String, Object> variables = layoutVariables(layout);
        variables.put("script", name);

        HttpUriRequestBase request = requestBuilder.buildRequest(Method.POST, ApiPath.SCRIPT, variables,
                Collections.emptyMap(), body);
        executeChecked(request);
        ScriptResult result = lastScriptResults.get("after");
        if (result == null) {
            throw new ResponseParseException("Response of script " + name + " contains no script result");
        }
        return result;
    }

    /**
     * Sets global fields for the rest of the session.
     *
     * @param globals Fully qualified field name ({@code Table::field}) -> value
     */
    public void setGlobals(Map<String, ?> globals) {
        Preconditions.checkArgument(globals != null && !globals.isEmpty(), "no global fields given");
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("globalFields", FieldCoercion.passThrough().toWire(globals));

        HttpUriRequestBase request = requestBuilder.buildRequest(Method.PATCH, ApiPath.GLOBALS,
                Collections.emptyMap(), Collections.emptyMap(), body);
        executeChecked(request);
    }

    // Containers

    /**
     * Uploads a file into a container field.
     *
     * @return The record's new modification id
     */
    public long uploadContainer(String layout, long recordId, String field, int repetition, String fileName,
                                byte[] content) {
        Preconditions.checkArgument(repetition >= 1, "repetition must be >= 1, got %s", repetition);
        Map<String, Object> variables = recordVariables(layout, recordId);
        variables.put("field", field);
        variables.put("repetition", repetition);

        HttpUriRequestBase request = requestBuilder.buildUpload(ApiPath.CONTAINER, variables, "upload", fileName, content);
        return ResponseParser.parseModificationId(executeChecked(request));
    }

    /**
     * Downloads the content of a container field.
     *
     * @throws ServiceException If the server does not deliver the file
     */
    public byte[] fetchContainer(ContainerReference container) {
        HttpResult result = caller.send(requestBuilder.buildGet(container.getUrl()));
        if (!result.isSuccessful()) {
            throw new ServiceException(ServiceException.NO_CODE,
                    "Container " + container.getFileName() + " could not be fetched, HTTP " + result.getStatusCode());
        }
        return result.getBody();
    }

    // Metadata

    public ProductInfo productInfo() {
        return loadProductInfo(true);
    }

    /**
     * Lists the databases the account can see. Uses Basic authentication, no session needed.
     */
    public List<String> listDatabases() {
        HttpUriRequestBase request = requestBuilder.buildRequest(Method.GET, ApiPath.DATABASES,
                Collections.emptyMap(), Collections.emptyMap(), null);
        session.authorizeBasic(request);
        return ResponseParser.parseDatabases(checkSuccess(execute(request, false, true)));
    }

    public List<String> listLayouts() {
        HttpUriRequestBase request = requestBuilder.buildRequest(Method.GET, ApiPath.LAYOUTS,
                Collections.emptyMap(), Collections.emptyMap(), null);
        return ResponseParser.parseLayouts(executeChecked(request));
    }

    public List<String> listScripts() {
        HttpUriRequestBase request = requestBuilder.buildRequest(Method.GET, ApiPath.SCRIPTS,
                Collections.emptyMap(), Collections.emptyMap(), null);
        return ResponseParser.parseScripts(executeChecked(request));
    }

    public LayoutMetadata layoutMetadata(String layout) {
        return loadLayoutMetadata(layout, true);
    }

    private ProductInfo loadProductInfo(boolean track) {
        HttpUriRequestBase request = requestBuilder.buildRequest(Method.GET, ApiPath.PRODUCT_INFO,
                Collections.emptyMap(), Collections.emptyMap(), null);
        return ResponseParser.parseProductInfo(checkSuccess(execute(request, false, track)));
    }

    private LayoutMetadata loadLayoutMetadata(String layout, boolean track) {
        HttpUriRequestBase request = requestBuilder.buildRequest(Method.GET, ApiPath.LAYOUT,
                layoutVariables(layout), Collections.emptyMap(), null);
        return ResponseParser.parseLayoutMetadata(checkSuccess(execute(request, true, track)), layout);
    }

    /**
     * @return Message code of the last response, {@link ServiceException#NO_CODE} before the first call
     */
    public int getLastErrorCode() {
        return lastErrorCode;
    }

    /**
     * @return Script results of the last response: phase ({@code prerequest}, {@code presort},
     *         {@code after}) -> result
     */
    public Map<String, ScriptResult> getLastScriptResults() {
        return lastScriptResults;
    }

    public SessionManager getSession() {
        return session;
    }

    public SchemaProvider getSchema() {
        return schema;
    }

    /**
     * Sends a request and decodes the envelope.
     *
     * @param authenticated Whether to send the session token
     * @param track Whether the response becomes the "last" error code and script results;
     *              metadata loaded for type conversion is not tracked
     */
    private Envelope execute(HttpUriRequestBase request, boolean authenticated, boolean track) {
        if (authenticated) {
            HttpRequestBuilder.bearer(request, session.currentToken());
        }

        Envelope envelope;
        try {
            envelope = caller.call(request);
        } catch (TokenExpiredException e) {
            session.invalidate();
            throw e;
        }

        if (track) {
            lastErrorCode = envelope.getCode();
            lastScriptResults = ResponseParser.parseScriptResults(envelope);
        }
        if (envelope.getCode() == FileMakerErrorCode.INVALID_DAPI_TOKEN.getCode()) {
            session.invalidate();
            throw new TokenExpiredException(envelope.getCode(), envelope.getMessage());
        }
        return envelope;
    }

    private Envelope executeChecked(HttpUriRequestBase request) {
        return checkSuccess(execute(request, true, true));
    }

    private static Envelope checkSuccess(Envelope envelope) {
        if (!envelope.isSuccess()) {
            throw ServiceException.buildServiceException(envelope.getCode(), envelope.getMessage());
        }
        return envelope;
    }

    /** Later pages must be requested with the arguments of the first one. */
    private static <T> List<T> snapshot(List<T> list) {
        return list == null ? null : new ArrayList<>(list);
    }

    private static Map<String, Object> layoutVariables(String layout) {
        Preconditions.checkArgument(layout != null && !layout.isEmpty(), "layout is required");
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("layout", layout);
        return variables;
    }

    private static Map<String, Object> recordVariables(String layout, long recordId) {
        Map<String, Object> variables = layoutVariables(layout);
        variables.put("recordId", recordId);
        return variables;
    }
}
