package com.qrl.review.embed;

public enum EmbeddingMode {
    /** OpenAI-compatible {@code /v1/embeddings} endpoint. */
    HTTP,
    /** Deterministic local embedder for development and tests. */
    TOY
}
