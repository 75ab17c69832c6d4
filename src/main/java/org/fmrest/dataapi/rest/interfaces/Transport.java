package org.fmrest.dataapi.rest.interfaces;

import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.fmrest.dataapi.rest.HttpResult;

import java.io.IOException;

/**
 * Sends one HTTP request and hands back status, headers and body.
 * <p>
 * Implementations neither retry nor interpret status codes: any status is a result,
 * only I/O failures are exceptions. Timeouts are carried by the request's
 * {@link org.apache.hc.client5.http.config.RequestConfig} and surface as
 * {@link java.io.InterruptedIOException}.
 * </p>
 */
public interface Transport {

    /**
     * Executes the request.
     *
     * @param request Fully configured request (URI, headers, entity, timeouts).
     * @return        Raw response.
     * @throws IOException If the exchange fails or times out.
     */
    HttpResult execute(HttpUriRequestBase request) throws IOException;

}
