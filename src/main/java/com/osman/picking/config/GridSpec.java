package com.osman.picking.config;

import java.util.Locale;

/**
 * Physical layout of a picking sheet. Immutable; handed to the template renderer explicitly.
 *
 * @param slotsPerPage    label slots stacked on one sheet
 * @param sheetWidthMm    sheet width
 * @param sheetHeightMm   sheet height
 * @param slotHeightMm    height of one slot; slots never exceed the sheet height together
 * @param printerMarginMm non-printable border of the printer on every edge
 * @param slotPaddingMm   inner padding of a slot
 * @param codeSizeMm      edge of the square box reserved for the code image
 * @param labelFontPx     font size of label and value lines
 * @param headerFontPx    font size of the slot header line
 * @param codePosition    slot edge the code image is anchored to
 */
public record GridSpec(int slotsPerPage,
                       double sheetWidthMm,
                       double sheetHeightMm,
                       double slotHeightMm,
                       double printerMarginMm,
                       double slotPaddingMm,
                       double codeSizeMm,
                       double labelFontPx,
                       double headerFontPx,
                       CodePosition codePosition) {

    /** CSS reference pixel: 1/96 inch. */
    public static final double MM_PER_PX = 25.4 / 96.0;

    private static final double TOLERANCE_MM = 0.01;

    public GridSpec {
        if (slotsPerPage < 1) {
            throw new IllegalArgumentException("slotsPerPage must be at least 1: " + slotsPerPage);
        }
        if (sheetWidthMm <= 0 || sheetHeightMm <= 0 || slotHeightMm <= 0) {
            throw new IllegalArgumentException("Sheet and slot dimensions must be positive");
        }
        if (slotHeightMm * slotsPerPage > sheetHeightMm + TOLERANCE_MM) {
            throw new IllegalArgumentException("%d slots of %.2f mm do not fit a %.2f mm sheet"
                .formatted(slotsPerPage, slotHeightMm, sheetHeightMm));
        }
        if (printerMarginMm < 0 || slotPaddingMm < 0 || codeSizeMm <= 0) {
            throw new IllegalArgumentException("Margins and padding must not be negative, code size must be positive");
        }
        if (printerMarginMm * 2 >= sheetWidthMm || printerMarginMm * 2 >= sheetHeightMm) {
            throw new IllegalArgumentException("Printer margin leaves no printable area");
        }
        if (labelFontPx <= 0 || headerFontPx <= 0) {
            throw new IllegalArgumentException("Font sizes must be positive");
        }
        if (codePosition == null) {
            codePosition = CodePosition.RIGHT_EDGE;
        }
    }

    /**
     * A4 portrait with six 49.5 mm slots.
     */
    public static GridSpec defaults() {
        return new GridSpec(6, 210.0, 297.0, 49.5, 5.0, 2.0, 30.0, 11.0, 12.0, CodePosition.RIGHT_EDGE);
    }

    /**
     * Slot height derived from the sheet: the sheet split evenly into {@code slots} slots.
     */
    public static double evenSlotHeight(double sheetHeightMm, int slots) {
        return sheetHeightMm / slots;
    }

    public double labelFontMm() {
        return labelFontPx * MM_PER_PX;
    }

    public double headerFontMm() {
        return headerFontPx * MM_PER_PX;
    }

    public enum CodePosition {
        RIGHT_EDGE("right-edge"),
        LEFT_EDGE("left-edge");

        private final String configName;

        CodePosition(String configName) {
            this.configName = configName;
        }

        public String configName() {
            return configName;
        }

        public static CodePosition fromConfig(String value) {
            if (value == null || value.isBlank()) {
                return RIGHT_EDGE;
            }
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
            for (CodePosition position : values()) {
                if (position.configName.equals(normalized)) {
                    return position;
                }
            }
            throw new IllegalArgumentException("Unknown code position '" + value + "'");
        }
    }
}
