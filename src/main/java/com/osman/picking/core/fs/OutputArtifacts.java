package com.osman.picking.core.fs;

import com.osman.picking.core.model.RunReport;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Every file a run produces goes through this abstraction, so the join, pagination and markup stages never
 * touch paths themselves.
 * <p>
 * Implementations keep the run's files out of their canonical locations until {@link #commit()}; closing
 * without a commit discards them.
 */
public interface OutputArtifacts extends AutoCloseable {

    String DOCUMENT_FILENAME = "picking.pdf";
    String MARKUP_FILENAME = "picking.xhtml";
    String CODES_DIRECTORY = "codes";

    /**
     * Reference (relative, {@code /} separated) under which the code image of {@code itemCode} is stored.
     * Deterministic: the same code always maps to the same reference.
     */
    String codeImageReference(String itemCode);

    void writeCodeImage(String reference, byte[] png) throws IOException;

    /**
     * Writes the markup and returns the file renderers should read; relative references inside the markup
     * resolve against its parent directory.
     */
    Path writeMarkup(String markup) throws IOException;

    /**
     * File the document renderer writes the final document into.
     */
    Path documentTarget();

    void writeReport(RunReport report) throws IOException;

    /**
     * Publishes every written file at its canonical location. The document is published last.
     */
    void commit() throws IOException;

    Path outputDirectory();

    @Override
    void close();
}
