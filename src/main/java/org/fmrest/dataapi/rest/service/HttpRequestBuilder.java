package org.fmrest.dataapi.rest.service;

import net.minidev.json.JSONValue;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.entity.mime.MultipartEntityBuilder;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.Method;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.net.URIBuilder;
import org.fmrest.dataapi.model.Credentials;
import org.fmrest.dataapi.model.ServerSettings;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Builds HTTP requests for the Data API.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Render endpoint paths from {@link ApiPath} templates</li>
 *   <li>Add query parameters and JSON or multipart bodies</li>
 *   <li>Configure request timeouts</li>
 *   <li>Add Bearer or Basic authorization</li>
 * </ul>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * HttpRequestBuilder builder = new HttpRequestBuilder(settings);
 * HttpUriRequestBase request = builder.buildRequest(
 *     Method.GET,
 *     ApiPath.RECORD,
 *     Map.of("layout", "Contacts", "recordId", 12),
 *     Collections.emptyMap(),
 *     null
 * );
 * HttpRequestBuilder.bearer(request, token);
 * }</pre>
 */
public class HttpRequestBuilder {

    private final String address;
    private final String apiVersion;
    private final String database;
    private volatile Duration timeout;

    public HttpRequestBuilder(ServerSettings settings) {
        String url = settings.getUrl();
        if (url == null || url.isEmpty()) {
            throw new IllegalArgumentException("Server url is required");
        }
        this.address = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.apiVersion = settings.getApiVersion();
        this.database = settings.getDatabase();
        this.timeout = settings.getTimeout();
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Changes the timeout of every request built from now on.
     */
    public void setTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        this.timeout = timeout;
    }

    public String getDatabase() {
        return database;
    }

    /**
     * Builds a Data API request.
     *
     * @param method HTTP method
     * @param path Endpoint template
     * @param pathVariables Template variables besides {@code version} and {@code database}
     * @param queryParameters Query string parameters, in order
     * @param jsonBody Body serialized as JSON, or null for none
     * @return Configured request without authorization
     */
    public HttpUriRequestBase buildRequest(
            Method method,
            ApiPath path,
            Map<String, ?> pathVariables,
            Map<String, String> queryParameters,
            Map<String, ?> jsonBody) {

        HttpUriRequestBase request = new HttpUriRequestBase(method.name(), buildUri(path, pathVariables, queryParameters));

        if (jsonBody != null) {
            request.setEntity(new StringEntity(JSONValue.toJSONString(jsonBody), ContentType.APPLICATION_JSON));
        }
        configure(request);
        return request;
    }

    /**
     * Builds a multipart upload with a single file part.
     *
     * @param path Endpoint template
     * @param pathVariables Template variables
     * @param partName Form part name
     * @param fileName File name sent with the part
     * @param content File content
     * @return Configured POST request without authorization
     */
    public HttpUriRequestBase buildUpload(
            ApiPath path,
            Map<String, ?> pathVariables,
            String partName,
            String fileName,
            byte[] content) {

        HttpUriRequestBase request = new HttpUriRequestBase(Method.POST.name(),
                buildUri(path, pathVariables, Collections.emptyMap()));
        request.setEntity(MultipartEntityBuilder.create()
                .addBinaryBody(partName, content, ContentType.APPLICATION_OCTET_STREAM, fileName)
                .build());
        configure(request);
        return request;
    }

    /**
     * Builds a plain GET for an absolute URL, e.g. a container download.
     */
    public HttpUriRequestBase buildGet(String url) {
        HttpUriRequestBase request;
        try {
            request = new HttpUriRequestBase(Method.GET.name(), new URI(url));
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid url: " + url, e);
        }
        configure(request);
        return request;
    }

    public static void bearer(HttpUriRequestBase request, String token) {
        request.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token);
    }

    public static void basic(HttpUriRequestBase request, Credentials credentials) {
        String pair = credentials.getUser() + ":" + credentials.getPassword();
        request.setHeader(HttpHeaders.AUTHORIZATION,
                "Basic " + Base64.getEncoder().encodeToString(pair.getBytes(StandardCharsets.UTF_8)));
    }

    private URI buildUri(ApiPath path, Map<String, ?> pathVariables, Map<String, String> queryParameters) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("version", apiVersion);
        if (database != null) {
            variables.put("database", database);
        }
        variables.putAll(pathVariables);

        try {
            URIBuilder uriBuilder = new URIBuilder(address + path.render(variables));
            queryParameters.forEach(uriBuilder::addParameter);
            return uriBuilder.build();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid server url: " + address, e);
        }
    }

    /**
     * Applies the current timeout to pool lease, connect and response.
     */
    @SuppressWarnings("deprecation")
    private void configure(HttpUriRequestBase request) {
        long millis = timeout.toMillis();
        request.setConfig(RequestConfig.custom()
                .setConnectionRequestTimeout(millis, TimeUnit.MILLISECONDS)
                .setConnectTimeout(millis, TimeUnit.MILLISECONDS)
                .setResponseTimeout(millis, TimeUnit.MILLISECONDS)
                .build());
    }
}
