package org.fmrest.dataapi.rest.service;

import com.google.common.base.Joiner;
import net.minidev.json.JSONValue;
import org.fmrest.dataapi.model.FindQuery;
import org.fmrest.dataapi.model.PortalRequest;
import org.fmrest.dataapi.model.Scripts;
import org.fmrest.dataapi.model.SortOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the query string parameters and body members shared by record requests.
 * <p>
 * GET requests carry options as query parameters with a leading underscore
 * ({@code _offset}, {@code _limit.Portal}); POST bodies use the same names without it.
 * </p>
 */
public final class RequestParameters {

    private static final Joiner COMMA = Joiner.on(", ");

    private RequestParameters() {
    }

    /**
     * Query parameters of a record list request.
     *
     * @param offset 1-based offset of the first record
     * @param limit Maximum number of records
     * @param sort Sort criteria, may be empty
     */
    public static Map<String, String> listParameters(int offset, int limit, List<SortOrder> sort) {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("_offset", String.valueOf(offset));
        parameters.put("_limit", String.valueOf(limit));
        if (sort != null && !sort.isEmpty()) {
            parameters.put("_sort", JSONValue.toJSONString(sortMembers(sort)));
        }
        return parameters;
    }

    /**
     * Query parameters selecting portals: {@code portal=["P1", "P2"]} plus the row
     * window of each portal.
     */
    public static Map<String, String> portalQueryParameters(List<PortalRequest> portals) {
        Map<String, String> parameters = new LinkedHashMap<>();
        if (portals == null || portals.isEmpty()) {
            return parameters;
        }
        List<String> names = portals.stream()
                .map(portal -> JSONValue.toJSONString(portal.getName()))
                .collect(Collectors.toList());
        parameters.put("portal", "[" + COMMA.join(names) + "]");
        for (PortalRequest portal : portals) {
            parameters.put("_offset." + portal.getName(), String.valueOf(portal.getOffset()));
            parameters.put("_limit." + portal.getName(), String.valueOf(portal.getLimit()));
        }
        return parameters;
    }

    /**
     * Body members selecting portals, for find requests.
     */
    public static Map<String, Object> portalBodyMembers(List<PortalRequest> portals) {
        Map<String, Object> members = new LinkedHashMap<>();
        if (portals == null || portals.isEmpty()) {
            return members;
        }
        members.put("portal", portals.stream().map(PortalRequest::getName).collect(Collectors.toList()));
        for (PortalRequest portal : portals) {
            members.put("offset." + portal.getName(), String.valueOf(portal.getOffset()));
            members.put("limit." + portal.getName(), String.valueOf(portal.getLimit()));
        }
        return members;
    }

    /**
     * Script parameters; the same names are used in query strings and bodies.
     */
    public static Map<String, String> scriptParameters(Scripts scripts) {
        Map<String, String> parameters = new LinkedHashMap<>();
        if (scripts == null) {
            return parameters;
        }
        putScript(parameters, "script.prerequest", scripts.getPrerequest(), scripts.getPrerequestParam());
        putScript(parameters, "script.presort", scripts.getPresort(), scripts.getPresortParam());
        putScript(parameters, "script", scripts.getAfter(), scripts.getAfterParam());
        return parameters;
    }

    private static void putScript(Map<String, String> parameters, String key, String name, String param) {
        if (name == null) {
            return;
        }
        parameters.put(key, name);
        if (param != null) {
            parameters.put(key + ".param", param);
        }
    }

    /**
     * Sort criteria as sent in bodies: {@code [{"fieldName": ..., "sortOrder": ...}]}.
     */
    public static List<Map<String, String>> sortMembers(List<SortOrder> sort) {
        List<Map<String, String>> members = new ArrayList<>();
        for (SortOrder order : sort) {
            Map<String, String> member = new LinkedHashMap<>();
            member.put("fieldName", order.getFieldName());
            member.put("sortOrder", order.getSortOrder() == null ? "ascend" : order.getSortOrder());
            members.add(member);
        }
        return members;
    }

    /**
     * Find requests as sent in the {@code query} member; omit requests carry
     * {@code "omit": "true"}.
     */
    public static List<Map<String, String>> queryMembers(FindQuery query) {
        List<Map<String, String>> members = new ArrayList<>();
        for (FindQuery.QueryRequest request : query.getRequests()) {
            Map<String, String> member = new LinkedHashMap<>(request.getCriteria());
            if (request.isOmit()) {
                member.put("omit", "true");
            }
            members.add(member);
        }
        return members;
    }

    /**
     * Body of a find request. Members without a value are left out.
     */
    public static Map<String, Object> findBody(FindQuery query, List<SortOrder> sort, int offset, int limit,
                                               List<PortalRequest> portals, Scripts scripts) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", queryMembers(query));
        if (sort != null && !sort.isEmpty()) {
            body.put("sort", sortMembers(sort));
        }
        if (offset > 0) {
            body.put("offset", String.valueOf(offset));
        }
        if (limit > 0) {
            body.put("limit", String.valueOf(limit));
        }
        body.putAll(portalBodyMembers(portals));
        body.putAll(scriptParameters(scripts));
        return body;
    }
}
