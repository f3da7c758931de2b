package com.osman.picking.core.sheet;

/**
 * Logical field names shared by the schemas and the readers that turn sheet rows into model records.
 */
public final class InputFields {
    public static final String ITEM_CODE = "itemCode";
    public static final String QUANTITY = "quantity";
    public static final String SHIP_DATE = "shipDate";
    public static final String CLIENT_CODE = "clientCode";
    public static final String ORDER_NUMBER = "orderNumber";
    public static final String LOCATION = "location";
    public static final String NOTICE = "notice";
    public static final String ITEM_TYPE = "itemType";
    public static final String DESCRIPTION = "description";
    public static final String UNIT = "unit";

    public static final String PARENT_ITEM_CODE = "parentItemCode";
    public static final String COMPONENT_ITEM_CODE = "componentItemCode";
    public static final String QUANTITY_PER_PARENT = "quantityPerParent";
    public static final String SEQUENCE = "sequence";
    public static final String COMPONENT_NAME = "componentName";
    public static final String COMPONENT_TYPE = "componentType";

    private InputFields() {
    }
}
