package com.osman.picking.core.fs;

import com.osman.picking.core.model.RunReport;
import com.osman.picking.logging.AppLogger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link OutputArtifacts} backed by a hidden staging directory inside the output directory.
 * <p>
 * Files are written into the staging directory with the same relative layout they will have in the output
 * directory, then moved over on {@link #commit()}. Closing before a commit deletes the staging directory,
 * so a failed run leaves the canonical files of earlier runs untouched.
 */
public final class StagedOutputDirectory implements OutputArtifacts {
    private static final Logger LOGGER = AppLogger.get();
    private static final String STAGING_PREFIX = ".staging-";

    private final Path outputDirectory;
    private final Path staging;
    private boolean committed;

    public StagedOutputDirectory(Path outputDirectory) throws IOException {
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory").toAbsolutePath();
        Files.createDirectories(this.outputDirectory);
        this.staging = Files.createTempDirectory(this.outputDirectory, STAGING_PREFIX);
    }

    @Override
    public String codeImageReference(String itemCode) {
        return CODES_DIRECTORY + "/" + ArtifactNames.codeImageFileName(itemCode);
    }

    @Override
    public void writeCodeImage(String reference, byte[] png) throws IOException {
        writeAtomically(stagedPath(reference), png);
    }

    @Override
    public Path writeMarkup(String markup) throws IOException {
        Path target = staging.resolve(MARKUP_FILENAME);
        writeAtomically(target, markup.getBytes(StandardCharsets.UTF_8));
        return target;
    }

    @Override
    public Path documentTarget() {
        return staging.resolve(DOCUMENT_FILENAME);
    }

    @Override
    public void writeReport(RunReport report) throws IOException {
        byte[] json = report.toJson().toString(2).getBytes(StandardCharsets.UTF_8);
        writeAtomically(staging.resolve(RunReport.DEFAULT_FILENAME), json);
    }

    @Override
    public synchronized void commit() throws IOException {
        if (committed) {
            throw new IllegalStateException("Output already committed");
        }
        List<Path> files;
        try (Stream<Path> walk = Files.walk(staging)) {
            files = walk.filter(Files::isRegularFile).collect(Collectors.toCollection(ArrayList::new));
        }
        Path document = documentTarget();
        files.sort(Comparator.comparing((Path file) -> file.equals(document)).thenComparing(Path::toString));

        for (Path file : files) {
            Path destination = outputDirectory.resolve(staging.relativize(file).toString());
            Files.createDirectories(destination.getParent());
            move(file, destination);
        }
        committed = true;
        deleteStaging();
        LOGGER.fine(() -> "Published %d files to %s".formatted(files.size(), outputDirectory));
    }

    @Override
    public Path outputDirectory() {
        return outputDirectory;
    }

    public Path canonical(String relativeName) {
        return outputDirectory.resolve(relativeName);
    }

    /**
     * Staging area of this run; exists until the run is committed or closed.
     */
    public Path stagingDirectory() {
        return staging;
    }

    @Override
    public synchronized void close() {
        if (!committed) {
            LOGGER.fine(() -> "Discarding staged output " + staging);
        }
        deleteStaging();
    }

    private Path stagedPath(String reference) {
        Path resolved = staging.resolve(reference).normalize();
        if (!resolved.startsWith(staging)) {
            throw new IllegalArgumentException("Reference escapes the output directory: " + reference);
        }
        return resolved;
    }

    private static void writeAtomically(Path target, byte[] content) throws IOException {
        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".part");
        try {
            Files.write(temp, content);
            move(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static void move(Path source, Path destination) throws IOException {
        try {
            Files.move(source, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(source, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteStaging() {
        if (!Files.exists(staging)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(staging)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException ex) {
                    throw new UncheckedIOException(ex);
                }
            });
        } catch (IOException | UncheckedIOException ex) {
            LOGGER.log(Level.WARNING, "Could not remove staging directory " + staging, ex);
        }
    }
}
