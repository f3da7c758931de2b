package com.osman.picking.core.join;

import com.osman.picking.core.model.ItemMasterRecord;
import com.osman.picking.core.model.PickingRow;
import com.osman.picking.core.model.ShipmentRow;
import com.osman.picking.core.model.ShipmentRow.BomLineage;
import com.osman.picking.core.model.UnresolvedReference;
import com.osman.picking.logging.AppLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Joins shipment lines with the item master on the exact, case-sensitive item code.
 * <p>
 * A line whose code is unknown is never printed with partial data: it is left out and reported instead,
 * and the remaining lines carry on.
 */
public class EnrichmentEngine {
    private static final Logger LOGGER = AppLogger.get();

    public JoinResult join(List<ShipmentRow> rows, Map<String, ItemMasterRecord> master) {
        Objects.requireNonNull(rows, "rows");
        Objects.requireNonNull(master, "master");

        List<PickingRow> resolved = new ArrayList<>(rows.size());
        List<UnresolvedReference> unresolved = new ArrayList<>();
        int sequence = 1;
        for (ShipmentRow row : rows) {
            ItemMasterRecord record = master.get(row.itemCode());
            if (record == null) {
                LOGGER.warning("Row %d (no. %s): item code '%s' not found in item master"
                    .formatted(row.sourceRow(), row.displayNumber(), row.itemCode()));
                unresolved.add(new UnresolvedReference(row.sourceRow(), row.displayNumber(), row.itemCode(),
                    UnresolvedReference.Reason.MISSING_MASTER));
                continue;
            }
            resolved.add(enrich(sequence++, row, record));
        }
        LOGGER.info("Join: %d rows resolved, %d unresolved".formatted(resolved.size(), unresolved.size()));
        return new JoinResult(resolved, unresolved);
    }

    static PickingRow enrich(int sequence, ShipmentRow row, ItemMasterRecord record) {
        BomLineage lineage = row.lineage();
        String description = record.description();
        String unit = record.unit();
        String itemType = firstNonBlank(record.itemType(), row.itemType());
        if (lineage != null) {
            description = firstNonBlank(lineage.componentName(), description);
            unit = firstNonBlank(lineage.unit(), unit);
            itemType = firstNonBlank(lineage.componentType(), itemType);
        }
        return new PickingRow(
            sequence,
            row,
            description,
            unit,
            firstNonBlank(record.location(), row.location()),
            itemType,
            firstNonBlank(record.orderNumber(), row.orderNumber()),
            firstNonBlank(record.notice(), row.notice()));
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred == null || preferred.isBlank() ? (fallback == null ? "" : fallback) : preferred;
    }
}
