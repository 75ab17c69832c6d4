package org.fmrest.dataapi.rest.service;

import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.fmrest.dataapi.rest.HttpResult;
import org.fmrest.dataapi.rest.interfaces.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Executes HTTP requests against the Data API with Apache HttpClient.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Execute HTTP requests (GET, POST, PATCH, DELETE)</li>
 *   <li>Log request/response details for debugging, with credentials masked</li>
 *   <li>Return status, headers and body of every response, successful or not</li>
 * </ul>
 *
 * <p>The Data API reports errors in a JSON envelope that also comes with 4xx/5xx
 * statuses, so status codes are left to the caller.</p>
 *
 * <p><b>Note:</b> Uses a shared HttpClient instance unless one is supplied, for
 * connection pooling and resource efficiency.</p>
 */
public class HttpRequestExecutor implements Transport {

    private static final Logger logger = LoggerFactory.getLogger(HttpRequestExecutor.class);

    /**
     * Shared HttpClient instance for connection pooling and reuse.
     */
    private static final CloseableHttpClient SHARED_HTTP_CLIENT = HttpClientBuilder.create().build();

    private static final Pattern PASSWORD_IN_BODY = Pattern.compile("(\"password\"\\s*:\\s*\")[^\"]*(\")");
    private static final Pattern TOKEN_IN_BODY = Pattern.compile("(\"token\"\\s*:\\s*\")[^\"]*(\")");

    private final CloseableHttpClient httpClient;

    public HttpRequestExecutor() {
        this(SHARED_HTTP_CLIENT);
    }

    public HttpRequestExecutor(CloseableHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * Executes an HTTP request and returns the raw response.
     *
     * @param request Configured HTTP request to execute
     * @return Status, headers and body
     * @throws IOException If request execution fails or times out
     */
    @Override
    public HttpResult execute(HttpUriRequestBase request) throws IOException {
        if (logger.isDebugEnabled()) {
            logRequest(request);
        }

        return httpClient.execute(request, response -> {
            int statusCode = response.getCode();

            Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
            for (Header header : response.getHeaders()) {
                headers.put(header.getName(), header.getValue());
            }

            HttpEntity entity = response.getEntity();
            byte[] body = entity == null ? new byte[0] : EntityUtils.toByteArray(entity);

            if (logger.isDebugEnabled()) {
                logResponse(statusCode, headers, body);
            }
            return new HttpResult(statusCode, headers, body);
        });
    }

    /**
     * Logs HTTP request details for debugging.
     *
     * @param request HTTP request to log
     */
    private void logRequest(HttpUriRequestBase request) {
        logger.debug("=== HTTP REQUEST ===");
        logger.debug("Method: {}", request.getMethod());
        logger.debug("URI: {}", request.getRequestUri());
        logger.debug("Headers:");
        for (Header header : request.getHeaders()) {
            logger.debug("  {}: {}", header.getName(), maskHeader(header));
        }

        HttpEntity entity = request.getEntity();
        if (entity == null) {
            logger.debug("Request Body: <none>");
        } else if (entity.isRepeatable() && entity.getContentType() != null
                && entity.getContentType().startsWith("application/json")) {
            try {
                String requestBody = EntityUtils.toString(entity, StandardCharsets.UTF_8);
                logger.debug("Request Body:");
                logger.debug("{}", PASSWORD_IN_BODY.matcher(requestBody).replaceAll("$1****$2"));
            } catch (Exception e) {
                logger.warn("Could not log request body: {}", e.getMessage());
            }
        } else {
            logger.debug("Request Body: <{}>", entity.getContentType());
        }
    }

    /**
     * Logs HTTP response details for debugging.
     */
    private void logResponse(int statusCode, Map<String, String> headers, byte[] body) {
        logger.debug("=== HTTP RESPONSE ===");
        logger.debug("Status Code: {}", statusCode);
        logger.debug("Response Headers:");
        headers.forEach((name, value) -> logger.debug("  {}: {}", name,
                "X-FM-Data-Access-Token".equalsIgnoreCase(name) ? "****" : value));
        String contentType = headers.get(HttpHeaders.CONTENT_TYPE);
        if (contentType != null && contentType.contains("json")) {
            logger.debug("Response Body:");
            logger.debug("{}", TOKEN_IN_BODY.matcher(new String(body, StandardCharsets.UTF_8)).replaceAll("$1****$2"));
        } else {
            logger.debug("Response Body: <{} bytes>", body.length);
        }
    }

    private static String maskHeader(Header header) {
        if (!HttpHeaders.AUTHORIZATION.equalsIgnoreCase(header.getName())) {
            return header.getValue();
        }
        String value = header.getValue();
        int space = value.indexOf(' ');
        return space > 0 ? value.substring(0, space) + " ****" : "****";
    }
}
