package com.osman.picking.core.model;

/**
 * A shipment or component line left out of the document because its item code could not be resolved.
 */
public record UnresolvedReference(int sourceRow, String displayNumber, String itemCode, Reason reason) {

    public enum Reason {
        /** The item master has no record for the code. */
        MISSING_MASTER,
        /** The component is itself a BOM parent; only one level is expanded. */
        NESTED_BOM
    }
}
