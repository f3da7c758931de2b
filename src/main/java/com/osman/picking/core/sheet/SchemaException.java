package com.osman.picking.core.sheet;

import com.osman.picking.core.ErrorKind;
import com.osman.picking.core.PickingException;

import java.nio.file.Path;
import java.util.List;

/**
 * Raised when an input table lacks one or more required columns.
 */
public final class SchemaException extends PickingException {
    private final String table;
    private final List<String> missingFields;

    public SchemaException(String table, Path source, List<String> missingFields) {
        super(ErrorKind.SCHEMA, "%s table %s is missing required columns: %s"
            .formatted(table, source.getFileName(), String.join(", ", missingFields)));
        this.table = table;
        this.missingFields = List.copyOf(missingFields);
    }

    public String table() {
        return table;
    }

    public List<String> missingFields() {
        return missingFields;
    }
}
