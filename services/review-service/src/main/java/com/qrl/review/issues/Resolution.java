package com.qrl.review.issues;

/**
 * @param resolvedBy id of the later good review that resolved the bad one, or {@code null}
 * @param similarity cosine similarity for the embedding path, otherwise {@code null}
 */
public record Resolution(ResolutionPath path, Long resolvedBy, Double similarity) {
    public static Resolution byCategory(long goodId) {
        return new Resolution(ResolutionPath.CATEGORY, goodId, null);
    }

    public static Resolution byEmbedding(long goodId, double similarity) {
        return new Resolution(ResolutionPath.EMBEDDING, goodId, similarity);
    }

    public static Resolution unresolved() {
        return new Resolution(ResolutionPath.UNRESOLVED, null, null);
    }

    public boolean isResolved() {
        return path != ResolutionPath.UNRESOLVED;
    }
}
