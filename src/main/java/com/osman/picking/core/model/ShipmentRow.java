package com.osman.picking.core.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One line of the shipment plan, or a component line derived from it by BOM expansion.
 *
 * @param sourceRow  1-based row number in the shipment sheet
 * @param lineNumber 1-based position among shipment lines, shared by the components of a line
 * @param itemCode   join key against the item master
 * @param quantity   quantity to pick
 * @param lineage    BOM origin for component lines, {@code null} for plain shipment lines
 */
public record ShipmentRow(int sourceRow,
                          int lineNumber,
                          String itemCode,
                          BigDecimal quantity,
                          String shipDate,
                          String clientCode,
                          String orderNumber,
                          String location,
                          String notice,
                          String itemType,
                          BomLineage lineage) {

    public ShipmentRow {
        Objects.requireNonNull(itemCode, "itemCode");
        Objects.requireNonNull(quantity, "quantity");
        shipDate = nullToEmpty(shipDate);
        clientCode = nullToEmpty(clientCode);
        orderNumber = nullToEmpty(orderNumber);
        location = nullToEmpty(location);
        notice = nullToEmpty(notice);
        itemType = nullToEmpty(itemType);
    }

    public boolean isComponent() {
        return lineage != null;
    }

    /**
     * Number printed on the slot: {@code 3} for a shipment line, {@code 3-2} for its second component.
     */
    public String displayNumber() {
        return lineage == null ? String.valueOf(lineNumber) : lineNumber + "-" + lineage.componentIndex();
    }

    /**
     * Derives the component line that replaces (or follows) this line.
     */
    public ShipmentRow toComponent(String componentCode, BigDecimal componentQuantity, BomLineage componentLineage) {
        return new ShipmentRow(sourceRow, lineNumber, componentCode, componentQuantity, shipDate, clientCode,
            orderNumber, "", notice, itemType, componentLineage);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    /**
     * @param parentItemCode item the component was expanded from
     * @param componentIndex 1-based position within the parent's component list
     * @param componentName  name from the BOM, may be empty
     * @param unit           unit from the BOM, may be empty
     * @param componentType  procurement type from the BOM, may be empty
     * @param quantityNote   multiplication shown next to the quantity, e.g. {@code 2 × 3}
     */
    public record BomLineage(String parentItemCode,
                             int componentIndex,
                             String componentName,
                             String unit,
                             String componentType,
                             String quantityNote) {
    }
}
