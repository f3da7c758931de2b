package com.osman.picking.core.pdf;

import java.util.List;

/**
 * @param backendName backend that produced the document
 * @param attempts    one line per backend considered, in priority order
 */
public record RenderOutcome(String backendName, List<String> attempts) {

    public RenderOutcome {
        attempts = List.copyOf(attempts);
    }
}
