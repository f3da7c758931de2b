package com.osman.picking.core.render;

import com.osman.picking.config.GridSpec;
import com.osman.picking.core.model.CodeArtifact;
import com.osman.picking.core.model.Page;
import com.osman.picking.core.model.PickingRow;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns pages of picking rows into print markup: an XHTML document holding one inline SVG per sheet.
 * <p>
 * All geometry is expressed in millimetres through the SVG view box, so the same markup prints at the
 * physical size of {@link GridSpec} regardless of the backend. Rendering is pure: nothing is read or written.
 */
public class TemplateRenderer {
    public static final String FONT_FAMILY = "Helvetica, Arial, sans-serif";

    static final String ELLIPSIS = "...";
    static final String MISSING_CODE_TEXT = "NO CODE";

    private static final double LINE_SPACING = 1.35;
    private static final double LATIN_ADVANCE_EM = 0.55;
    private static final double LABEL_COLUMN_EM = 5.5;
    private static final double CUT_STROKE_MM = 0.2;

    private final GridSpec grid;

    public TemplateRenderer(GridSpec grid) {
        this.grid = Objects.requireNonNull(grid, "grid");
    }

    public GridSpec grid() {
        return grid;
    }

    /**
     * Complete XHTML document for all pages. With no pages, a single blank sheet is emitted so every backend
     * still produces a valid document.
     */
    public String renderDocument(List<Page<PickingRow>> pages) throws TemplateException {
        StringBuilder out = new StringBuilder(4096);
        out.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n")
            .append("<html xmlns=\"http://www.w3.org/1999/xhtml\">\n")
            .append("<head>\n")
            .append("<meta http-equiv=\"Content-Type\" content=\"text/html; charset=UTF-8\"/>\n")
            .append("<title>Picking list</title>\n")
            .append("<style type=\"text/css\">\n")
            .append("@page { size: ").append(mm(grid.sheetWidthMm())).append("mm ")
            .append(mm(grid.sheetHeightMm())).append("mm; margin: 0; }\n")
            .append("html, body { margin: 0; padding: 0; }\n")
            .append("svg.page { display: block; page-break-after: always; }\n")
            .append("svg.page:last-child { page-break-after: auto; }\n")
            .append("</style>\n")
            .append("</head>\n")
            .append("<body>\n");
        if (pages.isEmpty()) {
            out.append(openSheet(0)).append("</svg>\n");
        }
        for (Page<PickingRow> page : pages) {
            out.append(renderPage(page));
        }
        out.append("</body>\n</html>\n");
        return out.toString();
    }

    /**
     * One sheet as an SVG element. Padding slots are drawn as cut guides only.
     */
    public String renderPage(Page<PickingRow> page) throws TemplateException {
        if (page.capacity() > grid.slotsPerPage()) {
            throw new IllegalArgumentException("Page %d has %d slots, the grid only %d"
                .formatted(page.number(), page.capacity(), grid.slotsPerPage()));
        }
        StringBuilder out = new StringBuilder(openSheet(page.number()));
        for (int i = 0; i < page.capacity(); i++) {
            renderSlot(out, i, page.slot(i));
        }
        out.append("</svg>\n");
        return out.toString();
    }

    private String openSheet(int number) {
        return "<svg xmlns=\"http://www.w3.org/2000/svg\" xmlns:xlink=\"http://www.w3.org/1999/xlink\" class=\"page\""
            + " data-page=\"" + number + "\""
            + " width=\"" + mm(grid.sheetWidthMm()) + "mm\" height=\"" + mm(grid.sheetHeightMm()) + "mm\""
            + " viewBox=\"0 0 " + mm(grid.sheetWidthMm()) + " " + mm(grid.sheetHeightMm()) + "\">\n";
    }

    private void renderSlot(StringBuilder out, int index, PickingRow row) throws TemplateException {
        SlotGeometry box = SlotGeometry.of(grid, index);
        out.append("<g class=\"slot\" data-slot=\"").append(index + 1).append('"');
        if (row != null) {
            validate(row);
            out.append(" data-no=\"").append(escape(row.displayNumber())).append('"');
        }
        out.append(">\n");
        out.append("<rect class=\"cut\" x=\"").append(mm(box.left()))
            .append("\" y=\"").append(mm(box.slotTop()))
            .append("\" width=\"").append(mm(box.right() - box.left()))
            .append("\" height=\"").append(mm(box.slotBottom() - box.slotTop()))
            .append("\" fill=\"none\" stroke=\"#999999\" stroke-width=\"").append(mm(CUT_STROKE_MM))
            .append("\" stroke-dasharray=\"2 1\"/>\n");
        if (row != null) {
            renderText(out, box, row);
            renderCode(out, box, row);
        }
        out.append("</g>\n");
    }

    private void renderText(StringBuilder out, SlotGeometry box, PickingRow row) {
        double width = box.textRight() - box.textLeft();
        double headerFont = grid.headerFontMm();
        double labelFont = grid.labelFontMm();

        double baseline = box.contentTop() + headerFont;
        if (baseline > box.contentBottom()) {
            return;
        }
        String header = headerLine(row);
        text(out, "header", box.textLeft(), baseline, headerFont, true, fit(header, width, headerFont));
        baseline += headerFont * LINE_SPACING;

        double labelColumn = Math.min(labelFont * LABEL_COLUMN_EM, width / 2);
        double valueLeft = box.textLeft() + labelColumn;
        double valueWidth = box.textRight() - valueLeft;
        for (String[] line : labelLines(row)) {
            if (baseline > box.contentBottom()) {
                break;
            }
            text(out, "label", box.textLeft(), baseline, labelFont, true, fit(line[0], labelColumn, labelFont));
            text(out, "value", valueLeft, baseline, labelFont, false, fit(line[1], valueWidth, labelFont));
            baseline += labelFont * LINE_SPACING;
        }
    }

    private void renderCode(StringBuilder out, SlotGeometry box, PickingRow row) {
        if (box.codeSize() <= 0) {
            return;
        }
        CodeArtifact artifact = row.codeArtifact().orElse(null);
        if (artifact == null) {
            double font = grid.labelFontMm();
            double x = box.codeX();
            double y = box.codeY() + box.codeSize() / 2;
            out.append("<rect class=\"code-missing\" x=\"").append(mm(box.codeX()))
                .append("\" y=\"").append(mm(box.codeY()))
                .append("\" width=\"").append(mm(box.codeSize()))
                .append("\" height=\"").append(mm(box.codeSize()))
                .append("\" fill=\"none\" stroke=\"#000000\" stroke-width=\"").append(mm(CUT_STROKE_MM))
                .append("\"/>\n");
            text(out, "code-missing", x + font / 2, y, font, true, fit(MISSING_CODE_TEXT, box.codeSize() - font, font));
            return;
        }
        double size = box.codeSize();
        double width = size;
        double height = size;
        if (artifact.widthPx() > 0 && artifact.heightPx() > 0) {
            double ratio = (double) artifact.heightPx() / artifact.widthPx();
            if (ratio <= 1) {
                height = size * ratio;
            } else {
                width = size / ratio;
            }
        }
        double x = box.codeX() + (size - width) / 2;
        double y = box.codeY() + (size - height) / 2;
        out.append("<image class=\"code\" x=\"").append(mm(x))
            .append("\" y=\"").append(mm(y))
            .append("\" width=\"").append(mm(width))
            .append("\" height=\"").append(mm(height))
            .append("\" preserveAspectRatio=\"xMidYMid meet\" xlink:href=\"")
            .append(escape(artifact.reference())).append("\"/>\n");
    }

    private static void text(StringBuilder out, String cssClass, double x, double y, double fontMm, boolean bold,
                             String value) {
        if (value.isEmpty()) {
            return;
        }
        out.append("<text class=\"").append(cssClass).append("\" x=\"").append(mm(x))
            .append("\" y=\"").append(mm(y))
            .append("\" font-family=\"").append(FONT_FAMILY)
            .append("\" font-size=\"").append(mm(fontMm)).append('"');
        if (bold) {
            out.append(" font-weight=\"bold\"");
        }
        out.append('>').append(escape(value)).append("</text>\n");
    }

    static String headerLine(PickingRow row) {
        StringBuilder header = new StringBuilder("No. ").append(row.displayNumber());
        if (!isBlank(row.shipDate())) {
            header.append(" | ").append(row.shipDate());
        }
        if (!isBlank(row.clientCode())) {
            header.append(" | ").append(row.clientCode());
        }
        return header.toString();
    }

    static List<String[]> labelLines(PickingRow row) {
        List<String[]> lines = new ArrayList<>();
        lines.add(new String[]{"Item", row.itemCode()});
        lines.add(new String[]{"Name", row.description()});
        StringBuilder quantity = new StringBuilder(row.quantityText());
        if (!row.unit().isEmpty()) {
            quantity.append(' ').append(row.unit());
        }
        if (!row.quantityNote().isEmpty()) {
            quantity.append(" (").append(row.quantityNote()).append(')');
        }
        lines.add(new String[]{"Qty", quantity.toString()});
        addIfPresent(lines, "Location", row.location());
        addIfPresent(lines, "Order", row.orderNumber());
        addIfPresent(lines, "Type", row.itemType());
        addIfPresent(lines, "Notice", row.notice());
        return lines;
    }

    private static void addIfPresent(List<String[]> lines, String label, String value) {
        if (!isBlank(value)) {
            lines.add(new String[]{label, value});
        }
    }

    private static void validate(PickingRow row) throws TemplateException {
        String number = row.displayNumber();
        if (isBlank(number)) {
            throw new TemplateException(String.valueOf(row.sequence()), "display number is missing");
        }
        if (isBlank(row.itemCode())) {
            throw new TemplateException(number, "item code is missing");
        }
        if (row.quantity() == null) {
            throw new TemplateException(number, "quantity is missing");
        }
    }

    /**
     * Cuts {@code value} so its estimated width stays within {@code widthMm}, ending it with an ellipsis.
     */
    static String fit(String value, double widthMm, double fontMm) {
        if (value == null) {
            return "";
        }
        String flat = value.replaceAll("[\\t\\r\\n]+", " ").strip();
        if (estimateWidth(flat, fontMm) <= widthMm) {
            return flat;
        }
        double budget = widthMm - estimateWidth(ELLIPSIS, fontMm);
        StringBuilder kept = new StringBuilder();
        double used = 0;
        for (int i = 0; i < flat.length(); ) {
            int codePoint = flat.codePointAt(i);
            double advance = advance(codePoint, fontMm);
            if (used + advance > budget) {
                break;
            }
            kept.appendCodePoint(codePoint);
            used += advance;
            i += Character.charCount(codePoint);
        }
        return kept.length() == 0 ? "" : kept.toString().stripTrailing() + ELLIPSIS;
    }

    static double estimateWidth(String value, double fontMm) {
        double width = 0;
        for (int i = 0; i < value.length(); ) {
            int codePoint = value.codePointAt(i);
            width += advance(codePoint, fontMm);
            i += Character.charCount(codePoint);
        }
        return width;
    }

    // CJK and fullwidth forms take a full em
    private static double advance(int codePoint, double fontMm) {
        return codePoint >= 0x2E80 ? fontMm : fontMm * LATIN_ADVANCE_EM;
    }

    static String escape(String value) {
        StringBuilder out = new StringBuilder(value.length() + 16);
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&apos;");
                default -> {
                    if (ch >= 0x20 || ch == '\t' || ch == '\n' || ch == '\r') {
                        out.append(ch);
                    }
                }
            }
        }
        return out.toString();
    }

    static String mm(double value) {
        String formatted = String.format(Locale.ROOT, "%.2f", value);
        if (formatted.endsWith(".00")) {
            return formatted.substring(0, formatted.length() - 3);
        }
        return formatted;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
