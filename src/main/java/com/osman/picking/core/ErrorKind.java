package com.osman.picking.core;

/**
 * Failure categories surfaced by a pipeline run.
 * <p>
 * Item codes missing from the master are not failures: they are reported as
 * {@link com.osman.picking.core.model.UnresolvedReference}s in the run report.
 */
public enum ErrorKind {
    /** An input file is missing or unreadable, or an output file could not be written. */
    INPUT,
    /** A table lacks required columns. */
    SCHEMA,
    /** A cell could not be coerced to its declared type. */
    PARSE,
    /** An item code cannot be represented by the configured symbology; the row is printed without a code. */
    ENCODING,
    /** Enriched data reached the template without a field the grid needs. */
    TEMPLATE,
    /** No rendering backend produced a document. */
    RENDER
}
