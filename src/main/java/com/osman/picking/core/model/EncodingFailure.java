package com.osman.picking.core.model;

/**
 * An item code the code generator could not encode; its rows are printed without an image.
 */
public record EncodingFailure(String itemCode, String message) {
}
