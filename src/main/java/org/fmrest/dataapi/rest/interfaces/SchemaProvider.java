package org.fmrest.dataapi.rest.interfaces;

import org.fmrest.dataapi.rest.FieldCoercion;

/**
 * Supplies the field coercion tables used to read and write record values.
 */
public interface SchemaProvider {

    /** Provider without metadata: values travel as read from the wire. */
    SchemaProvider PASS_THROUGH = new SchemaProvider() {
        @Override
        public FieldCoercion layoutFields(String layout) {
            return FieldCoercion.passThrough();
        }

        @Override
        public FieldCoercion portalFields(String layout, String portal) {
            return FieldCoercion.passThrough();
        }
    };

    /**
     * @param layout Layout name
     * @return Coercion table for the fields of the layout
     */
    FieldCoercion layoutFields(String layout);

    /**
     * @param layout Layout the portal is placed on
     * @param portal Portal object name (or related table name)
     * @return Coercion table for the related fields shown in the portal
     */
    FieldCoercion portalFields(String layout, String portal);

}
