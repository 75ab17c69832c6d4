package org.fmrest.dataapi.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Query-by-example for the {@code _find} endpoint.
 * <p>
 * A query is a list of requests combined with OR. Each request is a set of
 * field criteria combined with AND; a request flagged as omit removes its matches
 * from the found set instead of adding them.
 * </p>
 *
 * <pre>{@code
 * FindQuery query = new FindQuery()
 *     .request(Map.of("city", "Hamburg"))
 *     .omit(Map.of("name", "John"));
 * }</pre>
 */
public class FindQuery {

    /** Keys that mark a request as omit when {@link #of(List)} reads plain maps. */
    private static final List<String> OMIT_KEYS = List.of("omit", "_omit");

    private final List<QueryRequest> requests = new ArrayList<>();

    /**
     * Single find request: AND-combined criteria plus omit flag.
     */
    @Data
    @AllArgsConstructor
    public static class QueryRequest {
        private Map<String, String> criteria;
        private boolean omit;
    }

    public FindQuery request(Map<String, ?> criteria) {
        return add(criteria, false);
    }

    public FindQuery omit(Map<String, ?> criteria) {
        return add(criteria, true);
    }

    public List<QueryRequest> getRequests() {
        return Collections.unmodifiableList(requests);
    }

    public boolean isEmpty() {
        return requests.isEmpty();
    }

    /**
     * @return Independent copy; later changes to either query do not affect the other
     */
    public FindQuery copy() {
        FindQuery copy = new FindQuery();
        for (QueryRequest request : requests) {
            copy.add(request.getCriteria(), request.isOmit());
        }
        return copy;
    }

    /**
     * Builds a query from plain maps, the shape the Data API documents.
     * An {@code omit} (or {@code _omit}) entry with value {@code "true"} turns the
     * request into an omit request.
     *
     * @param requests OR-combined requests.
     * @return The equivalent FindQuery.
     */
    public static FindQuery of(List<? extends Map<String, ?>> requests) {
        FindQuery query = new FindQuery();
        for (Map<String, ?> request : requests) {
            Map<String, Object> criteria = new LinkedHashMap<>(request);
            boolean omit = false;
            for (String omitKey : OMIT_KEYS) {
                Object flag = criteria.remove(omitKey);
                if (flag != null && Boolean.parseBoolean(flag.toString())) {
                    omit = true;
                }
            }
            query.add(criteria, omit);
        }
        return query;
    }

    private FindQuery add(Map<String, ?> criteria, boolean omit) {
        Map<String, String> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : criteria.entrySet()) {
            copy.put(entry.getKey(), entry.getValue() == null ? "" : entry.getValue().toString());
        }
        requests.add(new QueryRequest(copy, omit));
        return this;
    }
}
