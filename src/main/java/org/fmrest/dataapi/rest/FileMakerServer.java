package org.fmrest.dataapi.rest;

import com.google.common.base.Preconditions;
import org.fmrest.dataapi.model.Credentials;
import org.fmrest.dataapi.model.FindQuery;
import org.fmrest.dataapi.model.LayoutMetadata;
import org.fmrest.dataapi.model.PortalRequest;
import org.fmrest.dataapi.model.ProductInfo;
import org.fmrest.dataapi.model.ScriptResult;
import org.fmrest.dataapi.model.Scripts;
import org.fmrest.dataapi.model.ServerSettings;
import org.fmrest.dataapi.model.SortOrder;
import org.fmrest.dataapi.rest.interfaces.Transport;
import org.fmrest.dataapi.rest.service.HttpRequestBuilder;
import org.fmrest.dataapi.rest.service.HttpRequestExecutor;
import org.fmrest.dataapi.rest.service.RequestDispatcher;
import org.fmrest.dataapi.rest.service.ServiceCaller;
import org.fmrest.dataapi.rest.service.SessionManager;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Client for one database on a FileMaker Server, working on a current layout.
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * ServerSettings settings = new ServerSettings("https://fms.example.com", "Contacts", "Contacts");
 * try (FileMakerServer fms = new FileMakerServer(settings, new Credentials("admin", "secret"))) {
 *     fms.login();
 *     Record record = fms.getRecord(1);
 *     record.set("name", "Alice");
 *     record.commit();
 *
 *     for (Record match : fms.find(new FindQuery().request(Map.of("city", "Hamburg")))) {
 *         System.out.println(match.field("name"));
 *     }
 * }
 * }</pre>
 *
 * <p>One session per instance. Instances are not thread safe.</p>
 */
public class FileMakerServer implements AutoCloseable {

    private final ServerSettings settings;
    private final HttpRequestBuilder requestBuilder;
    private final SessionManager session;
    private final RequestDispatcher dispatcher;
    private String layout;

    public FileMakerServer(ServerSettings settings, Credentials credentials) {
        this(settings, credentials, new HttpRequestExecutor());
    }

    /**
     * @param settings Server address, database, layout and tunables
     * @param credentials Account to log in with
     * @param transport Sends the HTTP requests
     */
    public FileMakerServer(ServerSettings settings, Credentials credentials, Transport transport) {
        Preconditions.checkNotNull(settings.getDatabase(), "database is required");
        this.settings = settings;
        this.layout = settings.getLayout();
        this.requestBuilder = new HttpRequestBuilder(settings);
        ServiceCaller caller = new ServiceCaller(transport);
        this.session = new SessionManager(requestBuilder, caller, credentials, settings.getDataSources());
        this.dispatcher = new RequestDispatcher(settings, requestBuilder, caller, session);
    }

    // Session

    public String login() {
        return session.login();
    }

    public void logout() {
        session.logout();
    }

    /**
     * Logs out and disables the client.
     */
    @Override
    public void close() {
        session.close();
    }

    public SessionState getSessionState() {
        return session.getState();
    }

    public boolean isLoggedIn() {
        return session.isLoggedIn();
    }

    public Duration getTimeout() {
        return requestBuilder.getTimeout();
    }

    /**
     * Sets the timeout of every following request.
     */
    public void setTimeout(Duration timeout) {
        requestBuilder.setTimeout(timeout);
    }

    public String getLayout() {
        return layout;
    }

    /**
     * Changes the layout the record operations work on.
     */
    public void setLayout(String layout) {
        this.layout = layout;
    }

    public ServerSettings getSettings() {
        return settings;
    }

    // Records

    public Record getRecord(long recordId) {
        return dispatcher.getRecord(currentLayout(), recordId);
    }

    public Record getRecord(long recordId, List<PortalRequest> portals, Scripts scripts) {
        return dispatcher.getRecord(currentLayout(), recordId, portals, scripts);
    }

    public Foundset getRecords() {
        return getRecords(1, settings.getPageSize());
    }

    public Foundset getRecords(int offset, int limit) {
        return getRecords(offset, limit, Collections.emptyList());
    }

    public Foundset getRecords(int offset, int limit, List<SortOrder> sort) {
        return dispatcher.getRecords(currentLayout(), offset, limit, sort, null, null);
    }

    public Foundset getRecords(int offset, int limit, List<SortOrder> sort, List<PortalRequest> portals,
                               Scripts scripts) {
        return dispatcher.getRecords(currentLayout(), offset, limit, sort, portals, scripts);
    }

    public Foundset find(FindQuery query) {
        return find(query, Collections.emptyList());
    }

    public Foundset find(FindQuery query, List<SortOrder> sort) {
        return find(query, sort, 1, settings.getPageSize());
    }

    public Foundset find(FindQuery query, List<SortOrder> sort, int offset, int limit) {
        return dispatcher.find(currentLayout(), query, sort, offset, limit, null, null);
    }

    public Foundset find(FindQuery query, List<SortOrder> sort, int offset, int limit, List<PortalRequest> portals,
                         Scripts scripts) {
        return dispatcher.find(currentLayout(), query, sort, offset, limit, portals, scripts);
    }

    /**
     * @return Id of the new record
     */
    public long createRecord(Map<String, ?> fieldData) {
        return dispatcher.createRecord(currentLayout(), fieldData, null, null);
    }

    public long createRecord(Map<String, ?> fieldData, Map<String, List<Map<String, ?>>> portalData,
                             Scripts scripts) {
        return dispatcher.createRecord(currentLayout(), fieldData, portalData, scripts);
    }

    /**
     * @return New modification id
     */
    public long editRecord(long recordId, long modificationId, Map<String, ?> fieldData) {
        return dispatcher.editRecord(currentLayout(), recordId, modificationId, fieldData, null);
    }

    public void deleteRecord(long recordId) {
        dispatcher.deleteRecord(currentLayout(), recordId, null);
    }

    public void deleteRecord(long recordId, Scripts scripts) {
        dispatcher.deleteRecord(currentLayout(), recordId, scripts);
    }

    // Scripts, globals, containers

    public ScriptResult performScript(String name, String parameter) {
        return dispatcher.callScript(currentLayout(), name, parameter);
    }

    public void setGlobals(Map<String, ?> globals) {
        dispatcher.setGlobals(globals);
    }

    public long uploadContainer(long recordId, String field, String fileName, byte[] content) {
        return uploadContainer(recordId, field, 1, fileName, content);
    }

    public long uploadContainer(long recordId, String field, int repetition, String fileName, byte[] content) {
        return dispatcher.uploadContainer(currentLayout(), recordId, field, repetition, fileName, content);
    }

    public byte[] fetchContainer(ContainerReference container) {
        return dispatcher.fetchContainer(container);
    }

    // Metadata

    public ProductInfo getProductInfo() {
        return dispatcher.productInfo();
    }

    public List<String> getDatabases() {
        return dispatcher.listDatabases();
    }

    public List<String> getLayouts() {
        return dispatcher.listLayouts();
    }

    public List<String> getScripts() {
        return dispatcher.listScripts();
    }

    public LayoutMetadata getLayoutMetadata() {
        return dispatcher.layoutMetadata(currentLayout());
    }

    public LayoutMetadata getLayoutMetadata(String layoutName) {
        return dispatcher.layoutMetadata(layoutName);
    }

    /**
     * @return Message code of the last response
     */
    public int getLastErrorCode() {
        return dispatcher.getLastErrorCode();
    }

    public Map<String, ScriptResult> getLastScriptResults() {
        return dispatcher.getLastScriptResults();
    }

    private String currentLayout() {
        Preconditions.checkState(layout != null, "No layout selected, call setLayout() first");
        return layout;
    }
}
