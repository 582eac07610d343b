package com.qrl.review.text;

/**
 * @param keywordText lower-cased text the keyword finder matches against
 * @param embeddingText text sent to the embedding provider; empty when the notes are too short to embed
 */
public record ExtractedText(String keywordText, String embeddingText) {
    public boolean isEmbeddable() {
        return embeddingText != null && !embeddingText.isEmpty();
    }
}
