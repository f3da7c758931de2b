package com.osman.picking.core.code;

import com.osman.picking.core.ErrorKind;
import com.osman.picking.core.PickingException;

/**
 * Raised when an item code contains characters the configured symbology cannot carry.
 */
public final class EncodingException extends PickingException {
    private final String itemCode;

    public EncodingException(String itemCode, String message) {
        this(itemCode, message, null);
    }

    public EncodingException(String itemCode, String message, Throwable cause) {
        super(ErrorKind.ENCODING, "Cannot encode item code '%s': %s".formatted(itemCode, message), cause);
        this.itemCode = itemCode;
    }

    public String itemCode() {
        return itemCode;
    }
}
