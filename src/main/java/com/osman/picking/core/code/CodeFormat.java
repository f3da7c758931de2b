package com.osman.picking.core.code;

import com.google.zxing.BarcodeFormat;

import java.util.Locale;

/**
 * Symbologies the code generator can produce.
 */
public enum CodeFormat {
    QR_CODE("qr", BarcodeFormat.QR_CODE),
    CODE_128("code128", BarcodeFormat.CODE_128);

    private final String configName;
    private final BarcodeFormat barcodeFormat;

    CodeFormat(String configName, BarcodeFormat barcodeFormat) {
        this.configName = configName;
        this.barcodeFormat = barcodeFormat;
    }

    public String configName() {
        return configName;
    }

    BarcodeFormat barcodeFormat() {
        return barcodeFormat;
    }

    public static CodeFormat fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return QR_CODE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
        for (CodeFormat format : values()) {
            if (format.configName.equals(normalized) || format.name().replace("_", "").equalsIgnoreCase(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown code format '" + value + "'");
    }
}
