package org.fmrest.dataapi.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fields of a layout and of each portal placed on it.
 */
@Data
public class LayoutMetadata {
    private String layout;
    private List<FieldMetadata> fields = new ArrayList<>();
    /** portal name -> fields of the related table shown in the portal */
    private Map<String, List<FieldMetadata>> portals = new LinkedHashMap<>();
}
