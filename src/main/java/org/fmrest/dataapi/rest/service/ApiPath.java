package org.fmrest.dataapi.rest.service;

import org.fmrest.dataapi.freemarker.FreeMarkerEngine;

import java.util.Map;

/**
 * Endpoint path templates of the Data API.
 * <p>
 * Rendered with {@link FreeMarkerEngine}; every name segment is percent-encoded. The
 * variables are {@code version}, {@code database}, {@code layout}, {@code token},
 * {@code recordId}, {@code script}, {@code field} and {@code repetition}.
 * </p>
 */
public enum ApiPath {

    PRODUCT_INFO("/productInfo"),
    DATABASES("/databases"),
    SESSIONS("/databases/${database?url}/sessions"),
    SESSION("/databases/${database?url}/sessions/${token?url}"),
    LAYOUTS("/databases/${database?url}/layouts"),
    LAYOUT("/databases/${database?url}/layouts/${layout?url}"),
    SCRIPTS("/databases/${database?url}/scripts"),
    RECORDS("/databases/${database?url}/layouts/${layout?url}/records"),
    RECORD("/databases/${database?url}/layouts/${layout?url}/records/${recordId}"),
    CONTAINER("/databases/${database?url}/layouts/${layout?url}/records/${recordId}/containers/${field?url}/${repetition}"),
    FIND("/databases/${database?url}/layouts/${layout?url}/_find"),
    SCRIPT("/databases/${database?url}/layouts/${layout?url}/script/${script?url}"),
    GLOBALS("/databases/${database?url}/globals");

    private static final String PREFIX = "/fmi/data/${version?url}";

    private final String template;

    ApiPath(String template) {
        this.template = PREFIX + template;
    }

    public String getTemplate() {
        return template;
    }

    /**
     * Renders the path for the given variables.
     *
     * @param variables Template variables; numbers are rendered without grouping
     * @return Absolute path starting with {@code /fmi/data/}
     */
    public String render(Map<String, ?> variables) {
        return FreeMarkerEngine.getInstance().processValues(template, variables);
    }
}
