package com.osman.picking.core.pdf;

import com.osman.picking.logging.AppLogger;

import java.awt.Font;
import java.awt.FontFormatException;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Font faces available to the in-process renderer: the faces of an optional font folder, registered with the
 * graphics environment, backed by the logical sans-serif font of the platform.
 */
final class SheetFonts {
    private static final Logger LOGGER = AppLogger.get();

    private final List<Font> registered;
    private final Font fallback = new Font(Font.SANS_SERIF, Font.PLAIN, 12);

    private SheetFonts(List<Font> registered) {
        this.registered = List.copyOf(registered);
    }

    /**
     * Platform fonts only.
     */
    static SheetFonts system() {
        return new SheetFonts(List.of());
    }

    /**
     * Registers every .ttf, .otf and .ttc file of {@code directory}. Unreadable files are skipped.
     *
     * @throws IOException if the folder is missing or none of its files could be registered
     */
    static SheetFonts load(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Font folder not found or is not a directory: " + directory);
        }
        List<Path> files;
        try (Stream<Path> list = Files.list(directory)) {
            files = list.filter(SheetFonts::isFontFile).sorted().toList();
        }
        if (files.isEmpty()) {
            throw new IOException("No font files (.ttf, .otf, .ttc) were found in: " + directory);
        }

        GraphicsEnvironment ge = GraphicsEnvironment.getLocalGraphicsEnvironment();
        List<Font> fonts = new ArrayList<>();
        for (Path file : files) {
            try {
                Font font = Font.createFont(Font.TRUETYPE_FONT, file.toFile());
                ge.registerFont(font);
                fonts.add(font);
            } catch (IOException | FontFormatException e) {
                LOGGER.log(Level.WARNING, "Skipping unreadable font " + file, e);
            }
        }
        if (fonts.isEmpty()) {
            throw new IOException("Font files were found but none could be registered in: " + directory);
        }
        LOGGER.fine(() -> "Registered %d fonts from %s".formatted(fonts.size(), directory));
        return new SheetFonts(fonts);
    }

    /**
     * CSS family list with the registered families ahead of {@code declared}.
     */
    String familyList(String declared) {
        if (registered.isEmpty()) {
            return declared;
        }
        Set<String> families = new LinkedHashSet<>();
        for (Font font : registered) {
            families.add("'" + font.getFamily(Locale.ROOT).replace("'", "") + "'");
        }
        if (declared != null && !declared.isBlank()) {
            families.add(declared.trim());
        }
        return String.join(", ", families);
    }

    /**
     * Distinct characters of {@code text} that no available face can show, in order of appearance.
     */
    String undisplayable(String text) {
        StringBuilder missing = new StringBuilder();
        text.codePoints()
            .filter(codePoint -> !Character.isWhitespace(codePoint))
            .distinct()
            .filter(codePoint -> !canDisplay(codePoint))
            .forEach(missing::appendCodePoint);
        return missing.toString();
    }

    private boolean canDisplay(int codePoint) {
        if (fallback.canDisplay(codePoint)) {
            return true;
        }
        for (Font font : registered) {
            if (font.canDisplay(codePoint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isFontFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return Files.isRegularFile(file) && (name.endsWith(".ttf") || name.endsWith(".otf") || name.endsWith(".ttc"));
    }
}
