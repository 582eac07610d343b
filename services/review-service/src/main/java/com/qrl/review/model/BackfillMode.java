package com.qrl.review.model;

import java.util.Locale;

/** Which records an embedding backfill run selects. */
public enum BackfillMode {
    /** Records with no embedding or a stale one. */
    FRESH_MISSING("fresh-missing"),
    /** Every eligible record, regardless of its current embedding. */
    FORCE("force");

    private final String value;

    BackfillMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static BackfillMode fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return FRESH_MISSING;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (BackfillMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("unknown backfill mode: " + raw);
    }
}
