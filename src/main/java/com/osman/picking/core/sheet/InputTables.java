package com.osman.picking.core.sheet;

import com.osman.picking.core.model.ItemMasterRecord;
import com.osman.picking.core.model.ShipmentRow;
import com.osman.picking.logging.AppLogger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static com.osman.picking.core.sheet.InputFields.CLIENT_CODE;
import static com.osman.picking.core.sheet.InputFields.DESCRIPTION;
import static com.osman.picking.core.sheet.InputFields.ITEM_CODE;
import static com.osman.picking.core.sheet.InputFields.ITEM_TYPE;
import static com.osman.picking.core.sheet.InputFields.LOCATION;
import static com.osman.picking.core.sheet.InputFields.NOTICE;
import static com.osman.picking.core.sheet.InputFields.ORDER_NUMBER;
import static com.osman.picking.core.sheet.InputFields.QUANTITY;
import static com.osman.picking.core.sheet.InputFields.SHIP_DATE;
import static com.osman.picking.core.sheet.InputFields.UNIT;

/**
 * Converts loaded sheet rows into shipment lines and the item master index.
 */
public final class InputTables {
    private static final Logger LOGGER = AppLogger.get();

    private InputTables() {
    }

    public static List<ShipmentRow> toShipmentRows(List<SheetRow> rows) {
        List<ShipmentRow> shipment = new ArrayList<>(rows.size());
        int lineNumber = 1;
        for (SheetRow row : rows) {
            shipment.add(new ShipmentRow(
                row.rowNumber(),
                lineNumber++,
                row.text(ITEM_CODE),
                row.decimal(QUANTITY),
                row.text(SHIP_DATE),
                row.text(CLIENT_CODE),
                row.text(ORDER_NUMBER),
                row.text(LOCATION),
                row.text(NOTICE),
                row.text(ITEM_TYPE),
                null));
        }
        return shipment;
    }

    /**
     * Indexes master rows by item code in file order. Rows without a code are ignored; for a repeated code
     * the first row wins.
     */
    public static Map<String, ItemMasterRecord> toMasterIndex(List<SheetRow> rows) {
        Map<String, ItemMasterRecord> index = new LinkedHashMap<>();
        for (SheetRow row : rows) {
            String code = row.text(ITEM_CODE);
            if (code.isEmpty()) {
                continue;
            }
            ItemMasterRecord record = new ItemMasterRecord(
                code,
                row.text(DESCRIPTION),
                row.text(UNIT),
                row.text(LOCATION),
                row.text(ITEM_TYPE),
                row.text(ORDER_NUMBER),
                row.text(NOTICE));
            if (index.putIfAbsent(code, record) != null) {
                LOGGER.warning("Item master row %d repeats item code %s; keeping the first occurrence"
                    .formatted(row.rowNumber(), code));
            }
        }
        return Collections.unmodifiableMap(index);
    }
}
