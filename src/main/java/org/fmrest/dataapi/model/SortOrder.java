package org.fmrest.dataapi.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One sort criterion: field name plus {@code ascend}, {@code descend} or a value list name.
 */
@Data
@AllArgsConstructor
public class SortOrder {
    private String fieldName;
    private String sortOrder;

    public static SortOrder ascending(String fieldName) {
        return new SortOrder(fieldName, "ascend");
    }

    public static SortOrder descending(String fieldName) {
        return new SortOrder(fieldName, "descend");
    }
}
