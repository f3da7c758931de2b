package com.osman.picking.core.model;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * A shipment line joined with its item master attributes, ready to occupy one label slot.
 * <p>
 * The code image (or the reason it could not be generated) is attached exactly once after the join;
 * everything else is fixed at construction.
 */
public final class PickingRow {
    private final int sequence;
    private final ShipmentRow shipment;
    private final String description;
    private final String unit;
    private final String location;
    private final String itemType;
    private final String orderNumber;
    private final String notice;

    private CodeArtifact codeArtifact;
    private String codeFailure;

    public PickingRow(int sequence,
                      ShipmentRow shipment,
                      String description,
                      String unit,
                      String location,
                      String itemType,
                      String orderNumber,
                      String notice) {
        this.sequence = sequence;
        this.shipment = Objects.requireNonNull(shipment, "shipment");
        this.description = Objects.requireNonNullElse(description, "");
        this.unit = Objects.requireNonNullElse(unit, "");
        this.location = Objects.requireNonNullElse(location, "");
        this.itemType = Objects.requireNonNullElse(itemType, "");
        this.orderNumber = Objects.requireNonNullElse(orderNumber, "");
        this.notice = Objects.requireNonNullElse(notice, "");
    }

    public int sequence() {
        return sequence;
    }

    public ShipmentRow shipment() {
        return shipment;
    }

    public String itemCode() {
        return shipment.itemCode();
    }

    public String displayNumber() {
        return shipment.displayNumber();
    }

    public BigDecimal quantity() {
        return shipment.quantity();
    }

    /**
     * Quantity as printed: no trailing zeros, no exponent.
     */
    public String quantityText() {
        return formatQuantity(shipment.quantity());
    }

    public String quantityNote() {
        return shipment.isComponent() ? shipment.lineage().quantityNote() : "";
    }

    public boolean isComponent() {
        return shipment.isComponent();
    }

    public String description() {
        return description;
    }

    public String unit() {
        return unit;
    }

    public String location() {
        return location;
    }

    public String itemType() {
        return itemType;
    }

    public String orderNumber() {
        return orderNumber;
    }

    public String notice() {
        return notice;
    }

    public String shipDate() {
        return shipment.shipDate();
    }

    public String clientCode() {
        return shipment.clientCode();
    }

    public synchronized void attachCode(CodeArtifact artifact) {
        Objects.requireNonNull(artifact, "artifact");
        ensureUnattached();
        this.codeArtifact = artifact;
    }

    public synchronized void markCodeFailure(String reason) {
        Objects.requireNonNull(reason, "reason");
        ensureUnattached();
        this.codeFailure = reason;
    }

    public synchronized Optional<CodeArtifact> codeArtifact() {
        return Optional.ofNullable(codeArtifact);
    }

    public synchronized Optional<String> codeFailure() {
        return Optional.ofNullable(codeFailure);
    }

    public static String formatQuantity(BigDecimal value) {
        if (value == null) {
            return "";
        }
        if (value.signum() == 0) {
            return "0";
        }
        return value.stripTrailingZeros().toPlainString();
    }

    private void ensureUnattached() {
        if (codeArtifact != null || codeFailure != null) {
            throw new IllegalStateException("Code already attached to row " + displayNumber());
        }
    }

    @Override
    public String toString() {
        return "PickingRow[" + sequence + " " + displayNumber() + " " + itemCode() + " x" + quantityText() + "]";
    }
}
