package com.osman.picking.core.fs;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * File naming rules for generated artifacts.
 */
public final class ArtifactNames {
    private static final Pattern UNSAFE = Pattern.compile("[^0-9A-Za-z_-]+");
    private static final int HASH_DIGITS = 8;

    private ArtifactNames() {
    }

    /**
     * {@code <slug>_<hash>.png}: readable slug of the code plus a short digest so codes that slug alike
     * (e.g. {@code A/B} and {@code A-B}) still get distinct files.
     */
    public static String codeImageFileName(String itemCode) {
        return slugify(itemCode) + "_" + shortHash(itemCode) + ".png";
    }

    static String slugify(String value) {
        String normalized = Normalizer.normalize(value == null ? "" : value, Normalizer.Form.NFKC)
            .strip()
            .replace('/', '-');
        String slug = UNSAFE.matcher(normalized).replaceAll("_");
        return slug.isEmpty() ? "code" : slug;
    }

    static String shortHash(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, HASH_DIGITS);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 unavailable", ex);
        }
    }
}
