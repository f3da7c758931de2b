package com.osman.picking.core.sheet;

import com.osman.picking.PickingFixtures;
import com.osman.picking.config.PipelineConfig;
import com.osman.picking.core.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpreadsheetLoaderTest {

    @TempDir
    Path tempDir;

    private final SpreadsheetLoader loader = new SpreadsheetLoader();
    private final ColumnSchema shipmentSchema = PipelineConfig.builtIn().shipmentSchema();

    @Test
    void findsHeaderBelowTitleBlockAndSkipsBlankRows() throws Exception {
        Path file = PickingFixtures.writeXlsx(tempDir.resolve("shipment.xlsx"), List.of(
            List.of("Shipment plan October"),
            List.of(),
            PickingFixtures.SHIPMENT_HEADER,
            List.of("2025-10-01", "C01", "A-1", 2, "", "fragile"),
            List.of(),
            List.of("2025-10-02", "C02", "B-2", "1,200", "", "")));

        List<SheetRow> rows = loader.load(file, shipmentSchema);

        assertEquals(2, rows.size());
        assertEquals(4, rows.get(0).rowNumber());
        assertEquals("A-1", rows.get(0).text(InputFields.ITEM_CODE));
        assertEquals(0, new BigDecimal("2").compareTo(rows.get(0).decimal(InputFields.QUANTITY)));
        assertEquals("fragile", rows.get(0).text(InputFields.NOTICE));
        assertEquals(6, rows.get(1).rowNumber());
        assertEquals(0, new BigDecimal("1200").compareTo(rows.get(1).decimal(InputFields.QUANTITY)));
    }

    @Test
    void readsJapaneseHeadersFromTabSeparatedExport() throws Exception {
        Path file = PickingFixtures.writeDelimited(tempDir.resolve("shipment.tsv"), '\t', List.of(
            List.of("出荷予定日", "客先略号", "品目コード", "出荷数量"),
            List.of("2025-10-01", "C01", "X-9", "2.50")));

        List<SheetRow> rows = loader.load(file, shipmentSchema);

        assertEquals(1, rows.size());
        assertEquals("X-9", rows.get(0).text(InputFields.ITEM_CODE));
        assertEquals("2.5", rows.get(0).text(InputFields.QUANTITY));
    }

    @Test
    void missingRequiredColumnIsSchemaError() throws Exception {
        Path file = PickingFixtures.writeXlsx(tempDir.resolve("shipment.xlsx"), List.of(
            List.of("Item Code", "Client"),
            List.of("A-1", "C01")));

        SchemaException error = assertThrows(SchemaException.class, () -> loader.load(file, shipmentSchema));

        assertEquals(ErrorKind.SCHEMA, error.kind());
        assertEquals(1, error.missingFields().size());
        assertTrue(error.missingFields().get(0).startsWith(InputFields.QUANTITY));
    }

    @Test
    void nonNumericQuantityIsParseErrorNamingTheRow() throws Exception {
        Path file = PickingFixtures.writeDelimited(tempDir.resolve("shipment.csv"), ',', List.of(
            List.of("item_code", "quantity", "client_code"),
            List.of("A-1", "3", "C01"),
            List.of("A-2", "three", "C01")));

        CellParseException error = assertThrows(CellParseException.class, () -> loader.load(file, shipmentSchema));

        assertEquals(ErrorKind.PARSE, error.kind());
        assertEquals(3, error.rowNumber());
        assertEquals("three", error.rawValue());
        assertEquals(List.of("3"), error.affectedRows());
    }

    @Test
    void blankRequiredQuantityIsParseError() throws Exception {
        Path file = PickingFixtures.writeDelimited(tempDir.resolve("shipment.csv"), ',', List.of(
            List.of("item_code", "quantity", "client_code"),
            List.of("A-1", "", "C01")));

        assertThrows(CellParseException.class, () -> loader.load(file, shipmentSchema));
    }

    @Test
    void missingFileIsReportedAsIoFailure() {
        assertThrows(NoSuchFileException.class, () -> loader.load(tempDir.resolve("absent.xlsx"), shipmentSchema));
    }

    @Test
    void repeatedHeadersAreAddressableWithSuffix() throws Exception {
        ColumnSchema bomSchema = PipelineConfig.builtIn().bomSchema();
        Path file = PickingFixtures.writeDelimited(tempDir.resolve("bom.tsv"), '\t', List.of(
            List.of("★◎製造工程品目コード", "★◎明細番号", "★◎製造工程品目コード", "★○数量"),
            List.of("KIT-1", "10", "P-1", "2")));

        List<SheetRow> rows = loader.load(file, bomSchema);

        assertEquals("KIT-1", rows.get(0).text(InputFields.PARENT_ITEM_CODE));
        assertEquals("P-1", rows.get(0).text(InputFields.COMPONENT_ITEM_CODE));
        assertEquals("10", rows.get(0).text(InputFields.SEQUENCE));
    }

    @Test
    void headerNormalizationFoldsWidthAndWhitespace() {
        assertEquals("ItemCode", SpreadsheetLoader.normalizeHeader(" Item　Code "));
        assertEquals("ABC123", SpreadsheetLoader.normalizeHeader("ＡＢＣ１２３"));
        assertEquals("", SpreadsheetLoader.normalizeHeader(null));
    }

    @Test
    void splitLineHonoursQuotedDelimiters() {
        assertEquals(List.of("A", "1,200", "say \"hi\""), SpreadsheetLoader.splitLine("A,\"1,200\",\"say \"\"hi\"\"\"", ','));
        assertEquals(List.of("", "x", ""), SpreadsheetLoader.splitLine(",x,", ','));
    }

    @Test
    void headerSearchIsLimitedToLeadingRows() {
        List<List<String>> grid = new ArrayList<>();
        for (int i = 0; i < SpreadsheetLoader.HEADER_SEARCH_ROWS; i++) {
            grid.add(List.of("title " + i));
        }
        grid.add(Arrays.asList("Item Code", "Quantity", "Client"));

        assertEquals(0, SpreadsheetLoader.detectHeaderRow(grid, shipmentSchema));
    }
}
