package com.osman.picking.cli;

import com.osman.picking.config.ConfigService;
import com.osman.picking.config.PipelineConfig;
import com.osman.picking.core.PickingException;
import com.osman.picking.core.PickingPipeline;
import com.osman.picking.core.PickingRequest;
import com.osman.picking.core.PipelineResult;
import com.osman.picking.logging.AppLogger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point: builds the picking document for one shipment export.
 */
public final class PickingDocumentTool {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String DEFAULT_OUTPUT_DIRECTORY = "picking-output";

    private static final Logger LOGGER = AppLogger.get();
    private static final Set<String> VALUE_OPTIONS = Set.of("--shipment", "--master", "--bom", "--out", "--config",
        "--font-dir");
    private static final Set<String> FLAG_OPTIONS = Set.of("--remember-config", "--help");
    private static final String USAGE = """
        Usage: PickingDocumentTool --shipment <file> --master <file> [--bom <file>]
                                   [--out <dir>] [--config <file>] [--font-dir <dir>]
                                   [--remember-config]
        """;

    private PickingDocumentTool() {}

    public static void main(String[] args) {
        System.exit(run(args, ConfigService.getInstance(), System.out, System.err));
    }

    static int run(String[] args, ConfigService configService, PrintStream out, PrintStream err) {
        Map<String, String> options;
        try {
            options = parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.print(USAGE);
            return EXIT_USAGE;
        }
        if (options.containsKey("--help")) {
            out.print(USAGE);
            return EXIT_OK;
        }
        if (!options.containsKey("--shipment") || !options.containsKey("--master")) {
            err.println("--shipment and --master are required");
            err.print(USAGE);
            return EXIT_USAGE;
        }

        Path shipment = Path.of(options.get("--shipment"));
        Path master = Path.of(options.get("--master"));
        Path bom = options.containsKey("--bom") ? Path.of(options.get("--bom")) : null;
        Path outDir = options.containsKey("--out")
            ? Path.of(options.get("--out"))
            : defaultOutputDirectory(shipment);
        Path configFile = options.containsKey("--config") ? Path.of(options.get("--config")) : null;
        Path fontDir = options.containsKey("--font-dir") ? Path.of(options.get("--font-dir")) : null;

        PickingPipeline pipeline;
        try {
            PipelineConfig config = configService.load(configFile);
            if (fontDir != null) {
                config = config.withRender(config.render().withFontDirectory(fontDir.toString()));
            }
            pipeline = new PickingPipeline(config);
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.log(Level.SEVERE, "Invalid configuration", e);
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (options.containsKey("--remember-config")) {
            if (configFile != null) {
                configService.rememberConfigPath(configFile);
            }
            if (fontDir != null) {
                configService.rememberFontDirectory(fontDir);
            }
        }

        try {
            PipelineResult result = pipeline.run(new PickingRequest(shipment, master, bom, outDir));
            out.println(result.report().summary());
            out.println("Document: " + result.documentPath());
            return EXIT_OK;
        } catch (PickingException e) {
            LOGGER.log(Level.SEVERE, "Picking document failed", e);
            String rows = e.affectedRows().isEmpty() ? "" : " (rows " + String.join(", ", e.affectedRows()) + ")";
            err.println(e.kind() + ": " + e.getMessage() + rows);
            return EXIT_FAILURE;
        }
    }

    static Map<String, String> parse(String[] args) {
        Map<String, String> options = new HashMap<>();
        if (args == null) {
            return options;
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String value = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                value = arg.substring(eq + 1);
                arg = arg.substring(0, eq);
            }
            if (FLAG_OPTIONS.contains(arg)) {
                options.put(arg, "true");
            } else if (VALUE_OPTIONS.contains(arg)) {
                if (value == null) {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Missing value for " + arg);
                    }
                    value = args[++i];
                }
                if (value.isBlank()) {
                    throw new IllegalArgumentException("Empty value for " + arg);
                }
                options.put(arg, value.trim());
            } else {
                throw new IllegalArgumentException("Unknown option " + arg);
            }
        }
        return options;
    }

    static Path defaultOutputDirectory(Path shipment) {
        Path parent = shipment.toAbsolutePath().getParent();
        return parent == null ? Path.of(DEFAULT_OUTPUT_DIRECTORY) : parent.resolve(DEFAULT_OUTPUT_DIRECTORY);
    }
}
