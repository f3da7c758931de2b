package com.osman.picking.core.bom;

import com.osman.picking.core.model.BomEntry;
import com.osman.picking.core.model.PickingRow;
import com.osman.picking.core.model.ShipmentRow;
import com.osman.picking.core.model.ShipmentRow.BomLineage;
import com.osman.picking.core.model.UnresolvedReference;
import com.osman.picking.logging.AppLogger;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Replaces shipment lines of assembled items with one line per component, in place.
 * <p>
 * Expansion is single level: a component that is itself a BOM parent is not expanded further but reported
 * as a {@link UnresolvedReference.Reason#NESTED_BOM} reference.
 */
public class BomExpander {
    private static final Logger LOGGER = AppLogger.get();

    private final boolean keepParentRow;

    public BomExpander() {
        this(false);
    }

    /**
     * @param keepParentRow print the shipment line itself in front of its components
     */
    public BomExpander(boolean keepParentRow) {
        this.keepParentRow = keepParentRow;
    }

    public BomExpansion expand(List<ShipmentRow> rows, BomTable table) {
        Objects.requireNonNull(rows, "rows");
        if (table == null || table.isEmpty()) {
            return new BomExpansion(rows, List.of());
        }

        List<ShipmentRow> expanded = new ArrayList<>(rows.size());
        List<UnresolvedReference> nested = new ArrayList<>();
        int expandedParents = 0;
        for (ShipmentRow row : rows) {
            List<BomEntry> components = table.componentsOf(row.itemCode());
            if (components.isEmpty()) {
                expanded.add(row);
                continue;
            }
            expandedParents++;
            if (keepParentRow) {
                expanded.add(row);
            }
            int index = 0;
            for (BomEntry entry : components) {
                index++;
                ShipmentRow component = toComponent(row, entry, index);
                if (table.isParent(entry.componentItemCode())) {
                    LOGGER.warning("Row %s: component %s is itself an assembly; multi-level BOMs are not expanded"
                        .formatted(component.displayNumber(), entry.componentItemCode()));
                    nested.add(new UnresolvedReference(row.sourceRow(), component.displayNumber(),
                        entry.componentItemCode(), UnresolvedReference.Reason.NESTED_BOM));
                    continue;
                }
                expanded.add(component);
            }
        }
        LOGGER.info("BOM expansion: %d of %d lines expanded into %d rows"
            .formatted(expandedParents, rows.size(), expanded.size()));
        return new BomExpansion(expanded, nested);
    }

    private static ShipmentRow toComponent(ShipmentRow parent, BomEntry entry, int index) {
        BigDecimal quantity = parent.quantity().multiply(entry.quantityPerParent());
        String note = PickingRow.formatQuantity(parent.quantity()) + " × " + PickingRow.formatQuantity(entry.quantityPerParent());
        BomLineage lineage = new BomLineage(parent.itemCode(), index, entry.componentName(), entry.unit(),
            entry.componentType(), note);
        return parent.toComponent(entry.componentItemCode(), quantity, lineage);
    }
}
