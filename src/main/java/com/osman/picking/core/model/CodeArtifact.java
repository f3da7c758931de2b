package com.osman.picking.core.model;

/**
 * Generated code image for an item code.
 *
 * @param itemCode    encoded text
 * @param reference   location of the image relative to the output directory, using {@code /} separators
 * @param widthPx     image width
 * @param heightPx    image height
 */
public record CodeArtifact(String itemCode, String reference, int widthPx, int heightPx) {
}
