package com.osman.picking.core.pdf;

import com.osman.picking.config.GridSpec;
import com.osman.picking.config.PipelineConfig.RenderOptions;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the backend candidate list named in the render configuration.
 */
public final class RenderBackends {

    private RenderBackends() {
    }

    public static List<RenderBackend> fromConfig(RenderOptions options, GridSpec grid) {
        List<RenderBackend> backends = new ArrayList<>();
        for (String name : options.backends()) {
            backends.add(create(name, options, grid));
        }
        return backends;
    }

    static RenderBackend create(String name, RenderOptions options, GridSpec grid) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case WkhtmltopdfBackend.NAME -> new WkhtmltopdfBackend(options.wkhtmltopdf(), options.timeoutSeconds(),
                grid.sheetWidthMm(), grid.sheetHeightMm());
            case BatikRasterBackend.NAME -> new BatikRasterBackend(
                options.fontDirectory().isEmpty() ? null : Path.of(options.fontDirectory()), options.dpi());
            default -> throw new IllegalArgumentException("Unknown rendering backend '" + name + "'");
        };
    }
}
