package com.osman.picking.core.bom;

import com.osman.picking.core.model.BomEntry;
import com.osman.picking.core.sheet.SheetRow;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.osman.picking.core.sheet.InputFields.COMPONENT_ITEM_CODE;
import static com.osman.picking.core.sheet.InputFields.COMPONENT_NAME;
import static com.osman.picking.core.sheet.InputFields.COMPONENT_TYPE;
import static com.osman.picking.core.sheet.InputFields.PARENT_ITEM_CODE;
import static com.osman.picking.core.sheet.InputFields.QUANTITY_PER_PARENT;
import static com.osman.picking.core.sheet.InputFields.SEQUENCE;
import static com.osman.picking.core.sheet.InputFields.UNIT;

/**
 * Builds a {@link BomTable} from loaded BOM rows.
 */
public final class BomTableReader {

    /** Numeric sequences first in numeric order, then the rest alphabetically; ties keep file order. */
    static final Comparator<BomEntry> SEQUENCE_ORDER = Comparator
        .comparing((BomEntry entry) -> numericSequence(entry) == null)
        .thenComparing(entry -> numericSequence(entry) == null ? 0L : numericSequence(entry))
        .thenComparing(entry -> numericSequence(entry) == null ? entry.sequence() : "");

    private BomTableReader() {
    }

    public static BomTable read(List<SheetRow> rows) {
        Map<String, List<BomEntry>> grouped = new LinkedHashMap<>();
        for (SheetRow row : rows) {
            String parent = row.text(PARENT_ITEM_CODE);
            String component = row.text(COMPONENT_ITEM_CODE);
            if (parent.isEmpty() || component.isEmpty() || row.decimal(QUANTITY_PER_PARENT) == null) {
                continue;
            }
            BomEntry entry = new BomEntry(
                parent,
                component,
                row.decimal(QUANTITY_PER_PARENT),
                row.text(SEQUENCE),
                row.text(COMPONENT_NAME),
                row.text(UNIT),
                row.text(COMPONENT_TYPE));
            grouped.computeIfAbsent(parent, key -> new ArrayList<>()).add(entry);
        }
        grouped.values().forEach(entries -> entries.sort(SEQUENCE_ORDER));
        return new BomTable(grouped);
    }

    private static Long numericSequence(BomEntry entry) {
        String raw = entry.sequence().trim();
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
