package org.clipcrawl.files;

import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lowercase hex SHA-256 of a blob's bytes.
 */
public record ContentHash(String hex) {
    private static final Pattern HEX = Pattern.compile("[0-9a-f]{64}");

    public ContentHash {
        hex = hex.toLowerCase(Locale.ROOT);
        if (!HEX.matcher(hex).matches()) throw new IllegalArgumentException("Not a SHA-256 hash: " + hex);
    }

    public static ContentHash of(byte[] data) {
        try {
            return new ContentHash(HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(data)));
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * Location of the blob below the store's root: {@code ab/cdef...}.
     */
    Path relativePath() {
        return Path.of(hex.substring(0, 2), hex.substring(2));
    }

    @Override
    public String toString() {
        return hex;
    }
}
