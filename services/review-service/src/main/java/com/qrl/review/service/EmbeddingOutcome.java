package com.qrl.review.service;

public enum EmbeddingOutcome {
    /** Vector computed and stored, stale flag cleared. */
    PROCESSED,
    /** Text too short to embed; record untouched. */
    SKIPPED,
    /** Content was edited while the vector was computed; record stays stale. */
    SUPERSEDED
}
