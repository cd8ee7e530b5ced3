package com.atlas.security;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * HMAC-SHA256 and timing-safe comparison shared by token signing and webhook verification.
 */
public final class Hmac {

    private static final String ALGORITHM = "HmacSHA256";

    private Hmac() {
        // utility class
    }

    /**
     * Computes HMAC-SHA256 of {@code data} under {@code key}.
     *
     * @throws IllegalStateException if the JVM lacks HmacSHA256 (never on a compliant JDK)
     */
    public static byte[] sha256(byte[] key, byte[] data) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(key, ALGORITHM));
            return mac.doFinal(data);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    /** Convenience overload for UTF-8 string keys. */
    public static byte[] sha256(String key, byte[] data) {
        return sha256(key.getBytes(StandardCharsets.UTF_8), data);
    }

    /**
     * Compares two strings without exiting early on the first differing byte.
     * Null on either side is never equal.
     */
    public static boolean constantTimeEquals(String expected, String actual) {
        if (expected == null || actual == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                actual.getBytes(StandardCharsets.UTF_8));
    }
}
