package com.osman.picking;

import com.osman.picking.core.model.ItemMasterRecord;
import com.osman.picking.core.model.PickingRow;
import com.osman.picking.core.model.ShipmentRow;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds input spreadsheets and model rows for tests.
 */
public final class PickingFixtures {

    public static final List<Object> SHIPMENT_HEADER =
        List.of("Ship Date", "Client", "Item Code", "Quantity", "Location", "Notes");
    public static final List<Object> MASTER_HEADER =
        List.of("Item Code", "Description", "Unit", "Picking Location", "Item Type");

    private PickingFixtures() {
    }

    /**
     * Writes a single-sheet workbook; {@code null} cells are left empty, numbers become numeric cells.
     */
    public static Path writeXlsx(Path file, List<List<Object>> rows) throws IOException {
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("Sheet1");
            for (int r = 0; r < rows.size(); r++) {
                Row row = sheet.createRow(r);
                List<Object> cells = rows.get(r);
                for (int c = 0; c < cells.size(); c++) {
                    Object value = cells.get(c);
                    if (value == null) {
                        continue;
                    }
                    if (value instanceof Number number) {
                        row.createCell(c).setCellValue(number.doubleValue());
                    } else {
                        row.createCell(c).setCellValue(value.toString());
                    }
                }
            }
            Files.createDirectories(file.toAbsolutePath().getParent());
            try (OutputStream out = Files.newOutputStream(file)) {
                workbook.write(out);
            }
        }
        return file;
    }

    public static Path writeDelimited(Path file, char delimiter, List<List<Object>> rows) throws IOException {
        List<String> lines = new ArrayList<>();
        for (List<Object> row : rows) {
            StringBuilder line = new StringBuilder();
            for (int c = 0; c < row.size(); c++) {
                if (c > 0) {
                    line.append(delimiter);
                }
                line.append(row.get(c) == null ? "" : row.get(c));
            }
            lines.add(line.toString());
        }
        Files.createDirectories(file.toAbsolutePath().getParent());
        Files.write(file, lines, StandardCharsets.UTF_8);
        return file;
    }

    /**
     * Shipment sheet with one row per item code, quantity {@code index + 1}.
     */
    public static Path shipment(Path file, List<String> itemCodes) throws IOException {
        List<List<Object>> rows = new ArrayList<>();
        rows.add(SHIPMENT_HEADER);
        for (int i = 0; i < itemCodes.size(); i++) {
            rows.add(List.of("2025-10-01", "C01", itemCodes.get(i), i + 1, "", ""));
        }
        return writeXlsx(file, rows);
    }

    public static Path master(Path file, List<String> itemCodes) throws IOException {
        List<List<Object>> rows = new ArrayList<>();
        rows.add(MASTER_HEADER);
        for (String code : itemCodes) {
            rows.add(List.of(code, "Item " + code, "pcs", "R-" + code, "part"));
        }
        return writeXlsx(file, rows);
    }

    public static ShipmentRow shipmentRow(int lineNumber, String itemCode, String quantity) {
        return new ShipmentRow(lineNumber + 1, lineNumber, itemCode, new BigDecimal(quantity), "2025-10-01", "C01",
            "", "", "", "", null);
    }

    public static ItemMasterRecord masterRecord(String itemCode) {
        return new ItemMasterRecord(itemCode, "Item " + itemCode, "pcs", "R-" + itemCode, "part", "", "");
    }

    public static PickingRow pickingRow(int sequence, String itemCode, String quantity) {
        return new PickingRow(sequence, shipmentRow(sequence, itemCode, quantity), "Item " + itemCode, "pcs",
            "R-" + itemCode, "part", "", "");
    }

    public static List<String> codes(String prefix, int count) {
        List<String> codes = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            codes.add(prefix + i);
        }
        return codes;
    }
}
