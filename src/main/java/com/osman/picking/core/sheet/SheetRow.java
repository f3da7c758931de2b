package com.osman.picking.core.sheet;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One data row of a loaded table, holding coerced values keyed by logical field name.
 */
public final class SheetRow {
    private final int rowNumber;
    private final Map<String, Object> values;

    public SheetRow(int rowNumber, Map<String, Object> values) {
        this.rowNumber = rowNumber;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * 1-based row number inside the source sheet, header rows included.
     */
    public int rowNumber() {
        return rowNumber;
    }

    public boolean has(String field) {
        return values.get(field) != null;
    }

    public String text(String field) {
        Object value = values.get(field);
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }

    public BigDecimal decimal(String field) {
        Object value = values.get(field);
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Long number) {
            return BigDecimal.valueOf(number);
        }
        throw new IllegalStateException("Field '" + field + "' is not numeric");
    }

    public Map<String, Object> values() {
        return values;
    }

    @Override
    public String toString() {
        return "SheetRow[" + rowNumber + "]" + values;
    }
}
