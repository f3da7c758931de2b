package com.osman.picking.config;

import com.osman.picking.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Central entry point for resolving the pipeline configuration with system property overrides and
 * persisted preferences.
 * <p>
 * Lookup order for every value: explicit argument, system property, stored preference, configuration file,
 * bundled default.
 */
public final class ConfigService {
    static final String CONFIG_PROPERTY = "pickingConfig";
    static final String WKHTMLTOPDF_PROPERTY = "wkhtmltopdf";
    static final String FONT_DIR_PROPERTY = "fontDir";

    static final String PREF_KEY_CONFIG = "config.path";
    static final String PREF_KEY_WKHTMLTOPDF = "wkhtmltopdf.path";
    static final String PREF_KEY_FONT_DIR = "font.dir";

    private static final Logger LOGGER = AppLogger.get();
    private static final ConfigService INSTANCE = new ConfigService(PreferencesStore.global());

    private final PreferencesStore preferences;

    ConfigService(PreferencesStore preferences) {
        this.preferences = preferences;
    }

    public static ConfigService getInstance() {
        return INSTANCE;
    }

    /**
     * Service backed by its own preferences node instead of the global one.
     */
    public static ConfigService using(PreferencesStore preferences) {
        return new ConfigService(preferences);
    }

    /**
     * Loads the effective configuration.
     *
     * @param explicitConfig configuration file named by the caller, may be {@code null}
     */
    public PipelineConfig load(Path explicitConfig) throws IOException {
        Optional<Path> source = Optional.ofNullable(explicitConfig).or(this::configuredPath);
        PipelineConfig config;
        if (source.isPresent()) {
            LOGGER.info("Using configuration " + source.get());
            config = PipelineConfig.load(source.get());
        } else {
            config = PipelineConfig.bundled();
        }
        PipelineConfig.RenderOptions render = config.render()
            .withWkhtmltopdf(resolveWkhtmltopdf(config.render().wkhtmltopdf()))
            .withFontDirectory(resolveFontDirectory(config.render().fontDirectory()));
        return config.withRender(render);
    }

    public Optional<Path> configuredPath() {
        String override = System.getProperty(CONFIG_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Optional.of(Path.of(override.trim()));
        }
        return preferences.getPath(PREF_KEY_CONFIG);
    }

    public void rememberConfigPath(Path configPath) {
        if (configPath == null) return;
        preferences.putPath(PREF_KEY_CONFIG, configPath);
    }

    public void rememberWkhtmltopdf(Path executable) {
        if (executable == null) return;
        preferences.putPath(PREF_KEY_WKHTMLTOPDF, executable);
    }

    public void rememberFontDirectory(Path fontDirectory) {
        if (fontDirectory == null) return;
        preferences.putPath(PREF_KEY_FONT_DIR, fontDirectory);
    }

    String resolveWkhtmltopdf(String configured) {
        String override = System.getProperty(WKHTMLTOPDF_PROPERTY);
        if (override != null && !override.isBlank()) {
            return override.trim();
        }
        return preferences.getString(PREF_KEY_WKHTMLTOPDF).orElse(configured);
    }

    String resolveFontDirectory(String configured) {
        String override = System.getProperty(FONT_DIR_PROPERTY);
        if (override != null && !override.isBlank()) {
            return override.trim();
        }
        return preferences.getString(PREF_KEY_FONT_DIR).orElse(configured);
    }
}
