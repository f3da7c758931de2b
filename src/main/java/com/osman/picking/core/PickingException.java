package com.osman.picking.core;

import java.util.List;
import java.util.Objects;

/**
 * Base failure of the picking pipeline, tagged with its {@link ErrorKind} and the rows it concerns.
 */
public class PickingException extends Exception {
    private final ErrorKind kind;
    private final List<String> affectedRows;

    public PickingException(ErrorKind kind, String message) {
        this(kind, message, List.of(), null);
    }

    public PickingException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, List.of(), cause);
    }

    public PickingException(ErrorKind kind, String message, List<String> affectedRows, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.affectedRows = List.copyOf(affectedRows);
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Row identifiers (spreadsheet row numbers or display numbers) involved in the failure; may be empty.
     */
    public List<String> affectedRows() {
        return affectedRows;
    }
}
