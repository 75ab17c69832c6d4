package org.fmrest.dataapi.model;

import lombok.Data;

/**
 * Server product information, including the date formats used on the wire.
 */
@Data
public class ProductInfo {
    private String name;
    private String version;
    private String buildDate;
    private String dateFormat;
    private String timeFormat;
    private String timeStampFormat;
}
