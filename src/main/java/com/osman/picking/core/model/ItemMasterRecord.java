package com.osman.picking.core.model;

import java.util.Objects;

/**
 * Reference attributes of one item, keyed by its unique item code.
 */
public record ItemMasterRecord(String itemCode,
                               String description,
                               String unit,
                               String location,
                               String itemType,
                               String orderNumber,
                               String notice) {

    public ItemMasterRecord {
        Objects.requireNonNull(itemCode, "itemCode");
        description = description == null ? "" : description;
        unit = unit == null ? "" : unit;
        location = location == null ? "" : location;
        itemType = itemType == null ? "" : itemType;
        orderNumber = orderNumber == null ? "" : orderNumber;
        notice = notice == null ? "" : notice;
    }
}
