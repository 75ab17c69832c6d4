package org.fmrest.dataapi.rest.service;

import org.apache.commons.lang3.ObjectUtils;
import org.fmrest.dataapi.model.LayoutMetadata;
import org.fmrest.dataapi.model.ProductInfo;
import org.fmrest.dataapi.model.ServerSettings;
import org.fmrest.dataapi.rest.DateFormats;
import org.fmrest.dataapi.rest.FieldCoercion;
import org.fmrest.dataapi.rest.interfaces.SchemaProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Field coercion tables built from layout metadata.
 * <p>
 * Each layout's metadata is requested once and kept for the lifetime of the client.
 * Date formats come from the settings when all three are configured, otherwise from
 * the server's product info, also requested once.
 * </p>
 */
public class LayoutSchemaCache implements SchemaProvider {

    private static final Logger logger = LoggerFactory.getLogger(LayoutSchemaCache.class);

    private final Function<String, LayoutMetadata> metadataLoader;
    private final Supplier<ProductInfo> productInfoLoader;
    private final ServerSettings settings;

    /** Map: layout name -> metadata */
    private final Map<String, LayoutMetadata> layouts = new HashMap<>();
    /** Map: layout name -> coercion of its own fields */
    private final Map<String, FieldCoercion> layoutCoercions = new HashMap<>();
    /** Map: layout name + portal name -> coercion of the portal fields */
    private final Map<String, FieldCoercion> portalCoercions = new HashMap<>();
    private DateFormats formats;

    /**
     * @param metadataLoader    Fetches the metadata of a layout
     * @param productInfoLoader Fetches the server product info
     * @param settings          Source of format overrides
     */
    public LayoutSchemaCache(Function<String, LayoutMetadata> metadataLoader, Supplier<ProductInfo> productInfoLoader,
                             ServerSettings settings) {
        this.metadataLoader = metadataLoader;
        this.productInfoLoader = productInfoLoader;
        this.settings = settings;
    }

    @Override
    public FieldCoercion layoutFields(String layout) {
        FieldCoercion coercion = layoutCoercions.get(layout);
        if (coercion == null) {
            coercion = new FieldCoercion(metadata(layout).getFields(), formats());
            layoutCoercions.put(layout, coercion);
        }
        return coercion;
    }

    @Override
    public FieldCoercion portalFields(String layout, String portal) {
        String key = layout + "\u0000" + portal;
        FieldCoercion coercion = portalCoercions.get(key);
        if (coercion == null) {
            coercion = new FieldCoercion(metadata(layout).getPortals().getOrDefault(portal, Collections.emptyList()),
                    formats());
            portalCoercions.put(key, coercion);
        }
        return coercion;
    }

    /**
     * Returns the cached metadata of a layout, fetching it on first use.
     */
    public LayoutMetadata metadata(String layout) {
        LayoutMetadata metadata = layouts.get(layout);
        if (metadata == null) {
            logger.debug("Loading metadata of layout {}", layout);
            metadata = metadataLoader.apply(layout);
            layouts.put(layout, metadata);
        }
        return metadata;
    }

    /**
     * Returns the formats used to read and write dates, fetching product info on first use
     * unless every format is configured.
     */
    public DateFormats formats() {
        if (formats == null) {
            if (settings.getDateFormat() != null && settings.getTimeFormat() != null
                    && settings.getTimestampFormat() != null) {
                formats = new DateFormats(settings.getDateFormat(), settings.getTimeFormat(),
                        settings.getTimestampFormat());
            } else {
                ProductInfo productInfo = productInfoLoader.get();
                formats = new DateFormats(
                        ObjectUtils.firstNonNull(settings.getDateFormat(), productInfo.getDateFormat()),
                        ObjectUtils.firstNonNull(settings.getTimeFormat(), productInfo.getTimeFormat()),
                        ObjectUtils.firstNonNull(settings.getTimestampFormat(), productInfo.getTimeStampFormat()));
            }
        }
        return formats;
    }

    /**
     * Forgets every cached layout, e.g. after the layouts were changed on the server.
     */
    public void clear() {
        layouts.clear();
        layoutCoercions.clear();
        portalCoercions.clear();
    }
}
