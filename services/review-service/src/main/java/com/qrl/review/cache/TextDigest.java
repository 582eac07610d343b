package com.qrl.review.cache;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** SHA-256 over UTF-8 text, for cache keys and stable token hashing. */
public final class TextDigest {
    private TextDigest() {
    }

    public static String hex(String text) {
        return HexFormat.of().formatHex(sha256(text));
    }

    /** First eight digest bytes as a long; stable across JVMs unlike {@link String#hashCode()}. */
    public static long leadingLong(String text) {
        return ByteBuffer.wrap(sha256(text), 0, Long.BYTES).getLong();
    }

    private static byte[] sha256(String text) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
