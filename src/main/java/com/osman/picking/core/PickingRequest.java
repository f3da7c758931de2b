package com.osman.picking.core;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Inputs of one run.
 *
 * @param shipment        shipment spreadsheet
 * @param master          item master spreadsheet
 * @param bom             bill of materials spreadsheet, {@code null} when no item is assembled
 * @param outputDirectory directory receiving the document, markup, code images and report
 */
public record PickingRequest(Path shipment, Path master, Path bom, Path outputDirectory) {

    public PickingRequest {
        Objects.requireNonNull(shipment, "shipment");
        Objects.requireNonNull(master, "master");
        Objects.requireNonNull(outputDirectory, "outputDirectory");
    }

    public Optional<Path> bomFile() {
        return Optional.ofNullable(bom);
    }
}
