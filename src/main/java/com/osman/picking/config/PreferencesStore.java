package com.osman.picking.config;

import java.nio.file.Path;
import java.util.Optional;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * Thin wrapper around {@link Preferences} so the tool can remember the configuration file and executables
 * chosen in earlier runs.
 */
public final class PreferencesStore {
    private static final String ROOT_NODE = "com/osman/picking";

    private final Preferences delegate;

    private PreferencesStore(Preferences delegate) {
        this.delegate = delegate;
    }

    public static PreferencesStore global() {
        return new PreferencesStore(Preferences.userRoot().node(ROOT_NODE));
    }

    /**
     * Store rooted at a child node of the global one; lets callers keep separate profiles.
     */
    public static PreferencesStore forNode(String childNode) {
        return new PreferencesStore(Preferences.userRoot().node(ROOT_NODE).node(childNode));
    }

    public Optional<Path> getPath(String key) {
        return getString(key).map(Path::of);
    }

    public void putPath(String key, Path path) {
        if (key == null || key.isBlank() || path == null) return;
        putString(key, path.toAbsolutePath().toString());
    }

    public Optional<String> getString(String key) {
        String value = delegate.get(key, null);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    public void putString(String key, String value) {
        if (key == null || key.isBlank() || value == null) return;
        delegate.put(key, value);
        flushQuietly();
    }

    /**
     * Deletes this node and everything stored under it.
     */
    public void clear() {
        try {
            delegate.removeNode();
            delegate.flush();
        } catch (BackingStoreException | IllegalStateException ignored) {
            // nothing persisted or already removed
        }
    }

    private void flushQuietly() {
        try {
            delegate.flush();
        } catch (BackingStoreException ignored) {
            // value stays in memory for this run
        }
    }
}
