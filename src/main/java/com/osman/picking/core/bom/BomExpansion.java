package com.osman.picking.core.bom;

import com.osman.picking.core.model.ShipmentRow;
import com.osman.picking.core.model.UnresolvedReference;

import java.util.List;

/**
 * Result of BOM expansion: the rows to join and the component lines dropped as nested BOM parents.
 */
public record BomExpansion(List<ShipmentRow> rows, List<UnresolvedReference> nested) {

    public BomExpansion {
        rows = List.copyOf(rows);
        nested = List.copyOf(nested);
    }
}
