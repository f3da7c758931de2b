package com.osman.picking.core.render;

import com.osman.picking.config.GridSpec;

/**
 * Millimetre boxes of one slot: the cut guide, the text column and the code image box.
 */
record SlotGeometry(double slotTop,
                    double slotBottom,
                    double left,
                    double right,
                    double contentTop,
                    double contentBottom,
                    double textLeft,
                    double textRight,
                    double codeX,
                    double codeY,
                    double codeSize) {

    static final double CODE_GAP_MM = 2.0;

    static SlotGeometry of(GridSpec grid, int slotIndex) {
        double nominalTop = slotIndex * grid.slotHeightMm();
        double nominalBottom = nominalTop + grid.slotHeightMm();
        double margin = grid.printerMarginMm();
        double top = Math.max(nominalTop, margin);
        double bottom = Math.min(nominalBottom, grid.sheetHeightMm() - margin);
        double left = margin;
        double right = grid.sheetWidthMm() - margin;

        double pad = grid.slotPaddingMm();
        double contentTop = top + pad;
        double contentBottom = Math.max(contentTop, bottom - pad);
        double contentLeft = left + pad;
        double contentRight = right - pad;
        double contentHeight = contentBottom - contentTop;

        double codeSize = Math.max(0, Math.min(grid.codeSizeMm(), Math.min(contentHeight, (contentRight - contentLeft) / 2)));
        double codeY = contentTop + (contentHeight - codeSize) / 2;
        double codeX;
        double textLeft;
        double textRight;
        if (grid.codePosition() == GridSpec.CodePosition.LEFT_EDGE) {
            codeX = contentLeft;
            textLeft = contentLeft + codeSize + CODE_GAP_MM;
            textRight = contentRight;
        } else {
            codeX = contentRight - codeSize;
            textLeft = contentLeft;
            textRight = codeX - CODE_GAP_MM;
        }
        return new SlotGeometry(top, bottom, left, right, contentTop, contentBottom, textLeft, textRight,
            codeX, codeY, codeSize);
    }
}
