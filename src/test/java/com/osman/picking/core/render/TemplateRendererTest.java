package com.osman.picking.core.render;

import com.osman.picking.PickingFixtures;
import com.osman.picking.config.GridSpec;
import com.osman.picking.core.ErrorKind;
import com.osman.picking.core.layout.Paginator;
import com.osman.picking.core.model.CodeArtifact;
import com.osman.picking.core.model.Page;
import com.osman.picking.core.model.PickingRow;
import com.osman.picking.core.model.ShipmentRow;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TemplateRendererTest {
    private static final String SVG_NS = "http://www.w3.org/2000/svg";

    private final TemplateRenderer renderer = new TemplateRenderer(GridSpec.defaults());

    @Test
    void oneSvgSheetPerPageWithPaddedSlots() throws Exception {
        List<PickingRow> rows = withCodes(7);

        Document markup = parse(renderer.renderDocument(Paginator.paginate(rows, 6)));

        NodeList sheets = markup.getElementsByTagNameNS(SVG_NS, "svg");
        assertEquals(2, sheets.getLength());
        Element first = (Element) sheets.item(0);
        assertEquals("210mm", first.getAttribute("width"));
        assertEquals("0 0 210 297", first.getAttribute("viewBox"));
        Element second = (Element) sheets.item(1);
        assertEquals(6, second.getElementsByTagNameNS(SVG_NS, "g").getLength());
        assertEquals(1, second.getElementsByTagNameNS(SVG_NS, "image").getLength());
        assertEquals(7, markup.getElementsByTagNameNS(SVG_NS, "image").getLength());
    }

    @Test
    void slotShowsHeaderFieldsAndCodeImage() throws Exception {
        PickingRow row = withCodes(1).get(0);

        String page = renderer.renderPage(new Page<>(1, 6, List.of(row)));

        assertTrue(page.contains(">No. 1 | 2025-10-01 | C01</text>"));
        assertTrue(page.contains(">Item</text>"));
        assertTrue(page.contains(">I1</text>"));
        assertTrue(page.contains(">1 pcs</text>"));
        assertTrue(page.contains("xlink:href=\"codes/I1.png\""));
        assertTrue(page.contains("data-no=\"1\""));
    }

    @Test
    void codeImageSitsInsidePrintableAreaAtRightEdge() throws Exception {
        Document markup = parse(renderer.renderDocument(Paginator.paginate(withCodes(6), 6)));

        NodeList images = markup.getElementsByTagNameNS(SVG_NS, "image");
        for (int i = 0; i < images.getLength(); i++) {
            Element image = (Element) images.item(i);
            double x = Double.parseDouble(image.getAttribute("x"));
            double y = Double.parseDouble(image.getAttribute("y"));
            double width = Double.parseDouble(image.getAttribute("width"));
            double height = Double.parseDouble(image.getAttribute("height"));
            assertEquals(30.0, width, 0.01);
            assertEquals(width, height, 0.01);
            assertEquals(210 - 5 - 2, x + width, 0.01);
            assertTrue(y >= 5 && y + height <= 297 - 5, "image " + i + " outside printable area");
            assertTrue(y >= i * 49.5 && y + height <= (i + 1) * 49.5, "image " + i + " outside its slot");
        }
    }

    @Test
    void componentRowShowsQuantityNote() throws Exception {
        ShipmentRow parent = PickingFixtures.shipmentRow(3, "KIT", "2");
        ShipmentRow component = parent.toComponent("P-1", new BigDecimal("6"),
            new ShipmentRow.BomLineage("KIT", 2, "Hinge", "set", "", "2 × 3"));
        PickingRow row = new PickingRow(1, component, "Hinge", "set", "", "", "", "");
        row.attachCode(new CodeArtifact("P-1", "codes/P-1.png", 240, 240));

        String page = renderer.renderPage(new Page<>(1, 6, List.of(row)));

        assertTrue(page.contains(">No. 3-2 | 2025-10-01 | C01</text>"));
        assertTrue(page.contains(">6 set (2 × 3)</text>"));
    }

    @Test
    void markupCharactersAreEscaped() throws Exception {
        ShipmentRow shipment = new ShipmentRow(2, 1, "A<&>\"'", BigDecimal.ONE, "", "C&D", "", "", "", "", null);
        PickingRow row = new PickingRow(1, shipment, "<script>", "pcs", "", "", "", "");
        row.markCodeFailure("test");

        String page = renderer.renderPage(new Page<>(1, 6, List.of(row)));

        assertFalse(page.contains("<script>"));
        assertTrue(page.contains("&lt;script&gt;"));
        assertTrue(page.contains("A&lt;&amp;&gt;&quot;&apos;"));
        parse("<html xmlns=\"http://www.w3.org/1999/xhtml\"><body>" + page + "</body></html>");
    }

    @Test
    void rowWithoutCodeShowsPlaceholder() throws Exception {
        PickingRow row = PickingFixtures.pickingRow(1, "A", "1");
        row.markCodeFailure("unencodable");

        String page = renderer.renderPage(new Page<>(1, 6, List.of(row)));

        assertFalse(page.contains("<image"));
        assertTrue(page.contains(">" + TemplateRenderer.MISSING_CODE_TEXT + "</text>"));
    }

    @Test
    void longValuesAreTruncatedToFitTheTextColumn() throws Exception {
        ShipmentRow shipment = PickingFixtures.shipmentRow(1, "A", "1");
        PickingRow row = new PickingRow(1, shipment, "X".repeat(400), "pcs", "", "", "", "");
        row.markCodeFailure("none");

        String page = renderer.renderPage(new Page<>(1, 6, List.of(row)));

        assertFalse(page.contains("X".repeat(400)));
        assertTrue(page.contains("X" + TemplateRenderer.ELLIPSIS + "</text>"));
    }

    @Test
    void linesThatDoNotFitTheSlotAreDropped() throws Exception {
        GridSpec tight = new GridSpec(6, 210, 297, 12, 5, 1, 8, 11, 12, GridSpec.CodePosition.LEFT_EDGE);
        ShipmentRow shipment = new ShipmentRow(2, 1, "A", BigDecimal.ONE, "", "C01", "PO", "LOC", "fragile", "T",
            null);
        PickingRow row = new PickingRow(1, shipment, "desc", "pcs", "LOC", "T", "PO", "fragile");
        row.markCodeFailure("none");

        String page = new TemplateRenderer(tight).renderPage(new Page<>(1, 6, List.of(row)));

        assertFalse(page.contains(">Notice</text>"));
        assertTrue(page.contains(">No. 1 | C01</text>"));
    }

    @Test
    void missingRequiredFieldIsTemplateError() {
        PickingRow row = PickingFixtures.pickingRow(1, " ", "1");

        TemplateException error = assertThrows(TemplateException.class,
            () -> renderer.renderPage(new Page<>(1, 6, List.of(row))));

        assertEquals(ErrorKind.TEMPLATE, error.kind());
        assertEquals(List.of("1"), error.affectedRows());
    }

    @Test
    void emptyDocumentStillHasOneBlankSheet() throws Exception {
        Document markup = parse(renderer.renderDocument(List.of()));

        assertEquals(1, markup.getElementsByTagNameNS(SVG_NS, "svg").getLength());
        assertEquals(0, markup.getElementsByTagNameNS(SVG_NS, "g").getLength());
    }

    @Test
    void fitKeepsShortTextAndCountsWideCharactersAsFullEm() {
        assertEquals("abc", TemplateRenderer.fit("abc", 100, 3));
        assertEquals(6.0, TemplateRenderer.estimateWidth("部品", 3), 1e-9);
        assertEquals(3.3, TemplateRenderer.estimateWidth("AB", 3), 1e-9);
        assertEquals("", TemplateRenderer.fit("abcdef", 0.5, 3));
    }

    private static List<PickingRow> withCodes(int count) {
        List<PickingRow> rows = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            PickingRow row = PickingFixtures.pickingRow(i, "I" + i, String.valueOf(i));
            row.attachCode(new CodeArtifact("I" + i, "codes/I" + i + ".png", 240, 240));
            rows.add(row);
        }
        return rows;
    }

    private static Document parse(String xml) throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        return factory.newDocumentBuilder().parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }
}
