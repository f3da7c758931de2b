package com.osman.picking.logging;

import java.util.Locale;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Provides the shared logger for the picking document pipeline.
 */
public final class AppLogger {
    static final String LEVEL_PROPERTY = "picking.logLevel";

    private static final Logger LOGGER = createLogger();

    private AppLogger() {
    }

    public static Logger get() {
        return LOGGER;
    }

    static Level resolveLevel(String raw) {
        if (raw == null || raw.isBlank()) {
            return Level.INFO;
        }
        try {
            return Level.parse(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return Level.INFO;
        }
    }

    private static Logger createLogger() {
        Logger logger = Logger.getLogger("com.osman.picking.PickingDocument");
        logger.setUseParentHandlers(false);
        Formatter formatter = new Formatter() {
            @Override
            public String format(LogRecord record) {
                String line = "%s %s%n".formatted(record.getLevel().getName(), formatMessage(record));
                if (record.getThrown() != null) {
                    line += "    caused by " + record.getThrown() + System.lineSeparator();
                }
                return line;
            }
        };

        StreamHandler consoleHandler = new StreamHandler(System.err, formatter) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        try {
            consoleHandler.setEncoding(UTF_8.name());
        } catch (Exception ignored) {
            // fall back to platform default when UTF-8 is unavailable
        }
        consoleHandler.setLevel(Level.ALL);
        logger.addHandler(consoleHandler);
        logger.setLevel(resolveLevel(System.getProperty(LEVEL_PROPERTY)));
        return logger;
    }
}
