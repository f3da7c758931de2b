package com.osman.picking.core.pdf;

import com.osman.picking.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Renders markup with the first backend that succeeds, falling back through the candidate list.
 */
public class DocumentRenderer {
    private static final Logger LOGGER = AppLogger.get();

    private final List<RenderBackend> candidates;

    public DocumentRenderer(List<RenderBackend> candidates) {
        this.candidates = List.copyOf(Objects.requireNonNull(candidates, "candidates"));
        if (this.candidates.isEmpty()) {
            throw new IllegalArgumentException("No rendering backend configured");
        }
    }

    /**
     * Tries each candidate in order. A failed attempt, checked or runtime, never leaves a partial
     * {@code target} behind and moves on to the next candidate.
     *
     * @throws RenderException when no candidate produced the document
     */
    public RenderOutcome render(Path markup, Path target) throws RenderException {
        List<String> attempts = new ArrayList<>();
        Exception lastFailure = null;
        for (RenderBackend backend : candidates) {
            if (!backend.isAvailable()) {
                attempts.add(backend.name() + ": unavailable");
                LOGGER.info(() -> "Backend " + backend.name() + " unavailable, trying next");
                continue;
            }
            try {
                backend.render(markup, target);
                if (!Files.isRegularFile(target) || Files.size(target) == 0) {
                    throw new IOException(backend.name() + " produced no output");
                }
                attempts.add(backend.name() + ": ok");
                LOGGER.info(() -> "Rendered " + target.getFileName() + " with " + backend.name());
                return new RenderOutcome(backend.name(), attempts);
            } catch (IOException | RuntimeException ex) {
                lastFailure = ex;
                attempts.add(backend.name() + ": failed (" + describe(ex) + ")");
                LOGGER.log(Level.WARNING, "Backend " + backend.name() + " failed", ex);
                discardPartial(target);
            }
        }
        throw new RenderException("No rendering backend succeeded: " + String.join("; ", attempts), attempts, lastFailure);
    }

    private static String describe(Exception ex) {
        return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    }

    private static void discardPartial(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Could not remove partial document " + target, ex);
        }
    }
}
