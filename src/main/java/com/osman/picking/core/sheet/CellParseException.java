package com.osman.picking.core.sheet;

import com.osman.picking.core.ErrorKind;
import com.osman.picking.core.PickingException;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Raised when a cell cannot be coerced to the type its column declares.
 */
public final class CellParseException extends PickingException {
    private final int rowNumber;
    private final String column;
    private final String rawValue;

    public CellParseException(Path source, int rowNumber, String column, ColumnType type, String rawValue) {
        super(ErrorKind.PARSE, "%s row %d: column '%s' expects %s but holds '%s'"
                .formatted(source.getFileName(), rowNumber, column, type.name().toLowerCase(Locale.ROOT), rawValue),
            List.of(String.valueOf(rowNumber)), null);
        this.rowNumber = rowNumber;
        this.column = column;
        this.rawValue = rawValue;
    }

    public int rowNumber() {
        return rowNumber;
    }

    public String column() {
        return column;
    }

    public String rawValue() {
        return rawValue;
    }
}
