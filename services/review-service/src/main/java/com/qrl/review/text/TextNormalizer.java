package com.qrl.review.text;

import java.util.regex.Pattern;

public final class TextNormalizer {
    private static final Pattern TAG = Pattern.compile("<[^>]*>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    /** Strips markup tags and collapses whitespace; {@code null} yields an empty string. */
    public static String normalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String withoutTags = TAG.matcher(raw).replaceAll(" ");
        return WHITESPACE.matcher(withoutTags).replaceAll(" ").trim();
    }

    public static boolean isBlank(String raw) {
        return normalize(raw).isEmpty();
    }
}
