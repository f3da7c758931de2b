package com.osman.picking.core.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One parent/component relation of the bill of materials.
 */
public record BomEntry(String parentItemCode,
                       String componentItemCode,
                       BigDecimal quantityPerParent,
                       String sequence,
                       String componentName,
                       String unit,
                       String componentType) {

    public BomEntry {
        Objects.requireNonNull(parentItemCode, "parentItemCode");
        Objects.requireNonNull(componentItemCode, "componentItemCode");
        Objects.requireNonNull(quantityPerParent, "quantityPerParent");
        sequence = sequence == null ? "" : sequence;
        componentName = componentName == null ? "" : componentName;
        unit = unit == null ? "" : unit;
        componentType = componentType == null ? "" : componentType;
    }
}
