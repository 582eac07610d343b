package com.qrl.review.model;

import java.time.Instant;
import java.util.List;

/**
 * A graded (or pending) review of one agent interaction.
 *
 * <p>{@code embedding} is only populated when the store was asked to project it;
 * a {@code null} vector on a record loaded without projection says nothing about
 * whether one is stored.
 */
public record ReviewRecord(
    Long id,
    String ticketNo,
    String agentId,
    ReviewContent content,
    Integer qualityScore,
    List<String> categories,
    ReviewStatus status,
    Instant gradedAt,
    List<Double> embedding,
    boolean embeddingStale
) {
    public ReviewRecord {
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    public boolean isGraded() {
        return status == ReviewStatus.GRADED && qualityScore != null;
    }

    public boolean hasFreshEmbedding() {
        return embedding != null && !embedding.isEmpty() && !embeddingStale;
    }

    public boolean sharesCategoryWith(ReviewRecord other) {
        if (other == null || categories.isEmpty()) {
            return false;
        }
        for (String category : categories) {
            if (other.categories().contains(category)) {
                return true;
            }
        }
        return false;
    }

    public ReviewRecord withId(Long newId) {
        return new ReviewRecord(newId, ticketNo, agentId, content, qualityScore, categories, status, gradedAt, embedding,
            embeddingStale);
    }

    public ReviewRecord withEmbedding(List<Double> vector, boolean stale) {
        return new ReviewRecord(id, ticketNo, agentId, content, qualityScore, categories, status, gradedAt, vector, stale);
    }
}
