package com.osman.picking.core.pdf;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Converts print markup into a paginated document.
 */
public interface RenderBackend {

    /**
     * Name used in configuration and in the run report.
     */
    String name();

    /**
     * Whether the backend can run in this environment. Unavailable backends are skipped without an attempt.
     */
    boolean isAvailable();

    /**
     * Renders {@code markup} into {@code target}. Relative image references resolve against the markup's directory.
     *
     * @throws IOException if rendering fails; {@code target} may then hold a partial file
     */
    void render(Path markup, Path target) throws IOException;
}
