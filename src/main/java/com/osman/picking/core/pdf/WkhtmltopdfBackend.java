package com.osman.picking.core.pdf;

import com.osman.picking.logging.AppLogger;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Renders markup with an external wkhtmltopdf process at the sheet's physical size and without page margins.
 */
public final class WkhtmltopdfBackend implements RenderBackend {
    public static final String NAME = "wkhtmltopdf";

    private static final Logger LOGGER = AppLogger.get();
    private static final int OUTPUT_TAIL_CHARS = 400;

    private final String executable;
    private final long timeoutSeconds;
    private final double pageWidthMm;
    private final double pageHeightMm;
    private final String searchPath;

    public WkhtmltopdfBackend(String executable, long timeoutSeconds, double pageWidthMm, double pageHeightMm) {
        this(executable, timeoutSeconds, pageWidthMm, pageHeightMm, System.getenv("PATH"));
    }

    WkhtmltopdfBackend(String executable, long timeoutSeconds, double pageWidthMm, double pageHeightMm,
                       String searchPath) {
        this.executable = Objects.requireNonNull(executable, "executable");
        this.timeoutSeconds = timeoutSeconds;
        this.pageWidthMm = pageWidthMm;
        this.pageHeightMm = pageHeightMm;
        this.searchPath = searchPath == null ? "" : searchPath;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return resolveExecutable().isPresent();
    }

    /**
     * Absolute path of the executable: the configured path itself, or the first match on the search path.
     */
    Optional<Path> resolveExecutable() {
        Path configured = Path.of(executable);
        if (configured.isAbsolute() || executable.contains(File.separator)) {
            return Files.isExecutable(configured) ? Optional.of(configured.toAbsolutePath()) : Optional.empty();
        }
        boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Path.of(dir, executable);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
            if (windows) {
                Path exe = Path.of(dir, executable + ".exe");
                if (Files.isRegularFile(exe)) {
                    return Optional.of(exe);
                }
            }
        }
        return Optional.empty();
    }

    List<String> command(Path binary, Path markup, Path target) {
        List<String> command = new ArrayList<>();
        command.add(binary.toString());
        command.add("--quiet");
        command.add("--enable-local-file-access");
        command.add("--disable-smart-shrinking");
        command.add("--encoding");
        command.add("utf-8");
        command.add("--page-width");
        command.add(millimetres(pageWidthMm));
        command.add("--page-height");
        command.add(millimetres(pageHeightMm));
        for (String margin : List.of("-T", "-B", "-L", "-R")) {
            command.add(margin);
            command.add("0");
        }
        command.add(markup.toAbsolutePath().toString());
        command.add(target.toAbsolutePath().toString());
        return command;
    }

    @Override
    public void render(Path markup, Path target) throws IOException {
        Path binary = resolveExecutable()
            .orElseThrow(() -> new IOException("wkhtmltopdf executable not found: " + executable));
        Path log = Files.createTempFile("wkhtmltopdf_", ".log");
        try {
            ProcessBuilder builder = new ProcessBuilder(command(binary, markup, target))
                .directory(markup.toAbsolutePath().getParent().toFile())
                .redirectErrorStream(true)
                .redirectOutput(log.toFile());
            LOGGER.fine(() -> "Running " + String.join(" ", builder.command()));
            Process process = builder.start();
            boolean finished;
            try {
                finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                throw new IOException("wkhtmltopdf interrupted", e);
            }
            if (!finished) {
                process.destroyForcibly();
                throw new IOException("wkhtmltopdf timed out after " + timeoutSeconds + " s");
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new IOException("wkhtmltopdf exited with " + exitCode + ": " + tail(log));
            }
        } finally {
            Files.deleteIfExists(log);
        }
    }

    private static String tail(Path log) throws IOException {
        String output = new String(Files.readAllBytes(log), StandardCharsets.UTF_8).strip();
        return output.length() <= OUTPUT_TAIL_CHARS ? output : output.substring(output.length() - OUTPUT_TAIL_CHARS);
    }

    private static String millimetres(double value) {
        return String.format(Locale.ROOT, "%.2fmm", value);
    }
}
