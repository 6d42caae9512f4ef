package uk.gegc.covenhub.features.asset.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * SHA-256 helpers for chunk verification and generated names.
 */
public final class ContentHashing {

    private ContentHashing() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static String sha256Hex(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    public static String sha256Hex(String value) {
        return sha256Hex(value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Compares the digest of {@code bytes} with a caller-supplied hex digest, ignoring case
     * and surrounding whitespace. Constant-time over the digest bytes.
     */
    public static boolean matches(byte[] bytes, String claimedHex) {
        if (claimedHex == null) {
            return false;
        }
        String normalized = claimedHex.trim().toLowerCase(Locale.ROOT);
        String actual = sha256Hex(bytes);
        return MessageDigest.isEqual(
                actual.getBytes(StandardCharsets.US_ASCII),
                normalized.getBytes(StandardCharsets.US_ASCII));
    }
}
