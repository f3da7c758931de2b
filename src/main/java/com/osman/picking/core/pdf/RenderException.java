package com.osman.picking.core.pdf;

import com.osman.picking.core.ErrorKind;
import com.osman.picking.core.PickingException;

import java.util.List;

/**
 * Every configured backend was unavailable or failed; no document was produced.
 */
public final class RenderException extends PickingException {
    private final List<String> attempts;

    public RenderException(String message, List<String> attempts, Throwable lastFailure) {
        super(ErrorKind.RENDER, message, List.of(), lastFailure);
        this.attempts = List.copyOf(attempts);
    }

    public List<String> attempts() {
        return attempts;
    }
}
