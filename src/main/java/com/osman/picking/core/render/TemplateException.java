package com.osman.picking.core.render;

import com.osman.picking.core.ErrorKind;
import com.osman.picking.core.PickingException;

import java.util.List;

/**
 * Raised when a row reaching the template lacks a field every slot must show.
 */
public final class TemplateException extends PickingException {

    public TemplateException(String displayNumber, String message) {
        super(ErrorKind.TEMPLATE, "Row %s: %s".formatted(displayNumber, message),
            List.of(displayNumber == null ? "?" : displayNumber), null);
    }
}
