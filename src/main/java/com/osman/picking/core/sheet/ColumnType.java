package com.osman.picking.core.sheet;

import java.math.BigDecimal;

/**
 * Semantic type of a logical spreadsheet column.
 */
public enum ColumnType {
    TEXT,
    INTEGER,
    DECIMAL;

    /**
     * Coerces a trimmed, non-blank cell value.
     *
     * @throws NumberFormatException when the value does not fit this type
     */
    Object coerce(String raw) {
        return switch (this) {
            case TEXT -> raw;
            case DECIMAL -> parseDecimal(raw);
            case INTEGER -> parseDecimal(raw).stripTrailingZeros().toBigIntegerExact().longValueExact();
        };
    }

    private static BigDecimal parseDecimal(String raw) {
        String text = raw.replace(",", "").trim();
        if (text.isEmpty()) {
            throw new NumberFormatException("empty");
        }
        return new BigDecimal(text);
    }
}
