package com.osman.picking.core.join;

import com.osman.picking.core.model.PickingRow;
import com.osman.picking.core.model.UnresolvedReference;

import java.util.List;

/**
 * Rows that resolved against the item master, and the ones that did not, both in shipment order.
 */
public record JoinResult(List<PickingRow> rows, List<UnresolvedReference> unresolved) {

    public JoinResult {
        rows = List.copyOf(rows);
        unresolved = List.copyOf(unresolved);
    }
}
