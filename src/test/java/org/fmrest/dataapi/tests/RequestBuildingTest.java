package org.fmrest.dataapi.tests;

import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.core5.http.Method;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.fmrest.dataapi.freemarker.exception.FreeMarkerFormatException;
import org.fmrest.dataapi.model.Credentials;
import org.fmrest.dataapi.model.FindQuery;
import org.fmrest.dataapi.model.PortalRequest;
import org.fmrest.dataapi.model.Scripts;
import org.fmrest.dataapi.model.ServerSettings;
import org.fmrest.dataapi.model.SortOrder;
import org.fmrest.dataapi.rest.service.ApiPath;
import org.fmrest.dataapi.rest.service.HttpRequestBuilder;
import org.fmrest.dataapi.rest.service.RequestParameters;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Paths, query parameters and bodies, checked without sending anything.
 */
public class RequestBuildingTest {

    private static Map<String, Object> variables(Object... keyValues) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("version", "vLatest");
        variables.put("database", "Contacts");
        for (int i = 0; i < keyValues.length; i += 2) {
            variables.put((String) keyValues[i], keyValues[i + 1]);
        }
        return variables;
    }

    @Test
    @DisplayName("Paths: names are percent-encoded, ids rendered without grouping")
    public void testPathRendering() {
        assertEquals("/fmi/data/vLatest/databases/Contacts/layouts/My%20Layout%2F2",
            ApiPath.LAYOUT.render(variables("layout", "My Layout/2")));
        assertEquals("/fmi/data/vLatest/databases/Contacts/layouts/Contacts/records/1234567",
            ApiPath.RECORD.render(variables("layout", "Contacts", "recordId", 1234567L)));
        assertEquals("/fmi/data/vLatest/databases/Contacts/layouts/Contacts/records/3/containers/photo/2",
            ApiPath.CONTAINER.render(variables("layout", "Contacts", "recordId", 3, "field", "photo", "repetition", 2)));
        assertEquals("/fmi/data/vLatest/productInfo", ApiPath.PRODUCT_INFO.render(variables()));
    }

    @Test
    @DisplayName("Paths: a missing variable is a template error")
    public void testMissingVariable() {
        assertThrows(FreeMarkerFormatException.class, () -> ApiPath.RECORDS.render(variables()));
    }

    @Test
    @DisplayName("Builder: address, query string, JSON body and timeout")
    @SuppressWarnings("deprecation")
    public void testBuildRequest() throws Exception {
        ServerSettings settings = new ServerSettings("https://fms.example.com/", "Contacts", "Contacts");
        settings.setTimeout(Duration.ofSeconds(3));
        HttpRequestBuilder builder = new HttpRequestBuilder(settings);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("fieldData", Map.of("name", "Alice"));
        HttpUriRequestBase request = builder.buildRequest(Method.PATCH, ApiPath.RECORD,
            Map.of("layout", "Contacts", "recordId", 5), Map.of("script", "Done"), body);

        assertEquals("PATCH", request.getMethod());
        assertEquals("https://fms.example.com/fmi/data/vLatest/databases/Contacts/layouts/Contacts/records/5?script=Done",
            request.getUri().toString());
        assertEquals("{\"fieldData\":{\"name\":\"Alice\"}}", EntityUtils.toString(request.getEntity()));
        assertTrue(request.getEntity().getContentType().startsWith("application/json"));
        assertEquals(3000, request.getConfig().getResponseTimeout().toMilliseconds());
        assertEquals(3000, request.getConfig().getConnectTimeout().toMilliseconds());
        assertEquals(3000, request.getConfig().getConnectionRequestTimeout().toMilliseconds());
    }

    @Test
    @DisplayName("Builder: server url is required")
    public void testUrlRequired() {
        assertThrows(IllegalArgumentException.class,
            () -> new HttpRequestBuilder(new ServerSettings(null, "Contacts", "Contacts")));
    }

    @Test
    @DisplayName("Authorization headers")
    public void testAuthorization() throws Exception {
        HttpRequestBuilder builder = new HttpRequestBuilder(new ServerSettings("http://fms", "Contacts", null));
        HttpUriRequestBase request = builder.buildRequest(Method.POST, ApiPath.SESSIONS,
            Collections.emptyMap(), Collections.emptyMap(), Collections.emptyMap());

        HttpRequestBuilder.basic(request, new Credentials("admin", "secret"));
        assertEquals("Basic YWRtaW46c2VjcmV0", request.getFirstHeader("Authorization").getValue());

        HttpRequestBuilder.bearer(request, "abc");
        assertEquals("Bearer abc", request.getFirstHeader("Authorization").getValue());
        assertEquals(1, request.getHeaders("Authorization").length);
    }

    @Test
    @DisplayName("List parameters: offset, limit and sort as JSON")
    public void testListParameters() {
        Map<String, String> parameters = RequestParameters.listParameters(101, 50,
            List.of(SortOrder.ascending("name"), new SortOrder("age", null)));

        assertEquals("101", parameters.get("_offset"));
        assertEquals("50", parameters.get("_limit"));
        assertEquals("[{\"fieldName\":\"name\",\"sortOrder\":\"ascend\"},{\"fieldName\":\"age\",\"sortOrder\":\"ascend\"}]",
            parameters.get("_sort"));
        assertFalse(RequestParameters.listParameters(1, 10, List.of()).containsKey("_sort"));
    }

    @Test
    @DisplayName("Portal parameters: query string and body forms")
    public void testPortalParameters() {
        List<PortalRequest> portals = List.of(PortalRequest.of("Orders"), new PortalRequest("Notes", 3, 10));

        Map<String, String> query = RequestParameters.portalQueryParameters(portals);
        assertEquals("[\"Orders\", \"Notes\"]", query.get("portal"));
        assertEquals("1", query.get("_offset.Orders"));
        assertEquals("50", query.get("_limit.Orders"));
        assertEquals("3", query.get("_offset.Notes"));
        assertEquals("10", query.get("_limit.Notes"));

        Map<String, Object> body = RequestParameters.portalBodyMembers(portals);
        assertEquals(List.of("Orders", "Notes"), body.get("portal"));
        assertEquals("10", body.get("limit.Notes"));

        assertTrue(RequestParameters.portalQueryParameters(null).isEmpty());
    }

    @Test
    @DisplayName("Script parameters: only phases with a script, parameters only when given")
    public void testScriptParameters() {
        Scripts scripts = new Scripts();
        scripts.setPresort("Prepare");
        scripts.setAfter("Done");
        scripts.setAfterParam("x");

        Map<String, String> parameters = RequestParameters.scriptParameters(scripts);

        assertEquals(List.of("script.presort", "script", "script.param"), List.copyOf(parameters.keySet()));
        assertEquals("x", parameters.get("script.param"));
        assertTrue(RequestParameters.scriptParameters(null).isEmpty());
    }

    @Test
    @DisplayName("FindQuery.of reads omit flags from plain maps")
    public void testFindQueryOf() {
        FindQuery query = FindQuery.of(List.of(
            Map.of("city", "Hamburg"),
            Map.of("name", "Bob", "omit", "true"),
            Map.of("name", "Eve", "_omit", "false")));

        List<FindQuery.QueryRequest> requests = query.getRequests();
        assertEquals(3, requests.size());
        assertFalse(requests.get(0).isOmit());
        assertTrue(requests.get(1).isOmit());
        assertEquals(Map.of("name", "Bob"), requests.get(1).getCriteria());
        assertFalse(requests.get(2).isOmit());
        assertEquals(Map.of("name", "Eve"), requests.get(2).getCriteria());
    }

    @Test
    @DisplayName("Find body: criteria stringified, window omitted when not set")
    public void testFindBody() {
        FindQuery query = new FindQuery().request(Map.of("age", 42)).omit(Map.of("city", "Kiel"));

        Map<String, Object> body = RequestParameters.findBody(query, null, 0, 0, null, null);

        assertEquals(List.of("query"), List.copyOf(body.keySet()));
        assertEquals(List.of(Map.of("age", "42"), Map.of("city", "Kiel", "omit", "true")), body.get("query"));
    }
}
