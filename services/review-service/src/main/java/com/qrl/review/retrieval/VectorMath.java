package com.qrl.review.retrieval;

import java.util.List;

public final class VectorMath {
    private VectorMath() {
    }

    /**
     * Cosine similarity of two equal-length vectors. Returns 0 when either is
     * null or empty, when lengths differ, or when either norm is zero.
     */
    public static double cosine(List<Double> a, List<Double> b) {
        if (a == null || b == null || a.isEmpty() || a.size() != b.size()) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.size(); i++) {
            double x = value(a.get(i));
            double y = value(b.get(i));
            dot += x * y;
            normA += x * x;
            normB += y * y;
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double similarity = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Double.isNaN(similarity) ? 0.0 : similarity;
    }

    /** Cosine scaled to an integer percentage. */
    public static int similarityScore(List<Double> a, List<Double> b) {
        return (int) Math.round(cosine(a, b) * 100.0);
    }

    private static double value(Double boxed) {
        return boxed == null ? 0.0 : boxed;
    }
}
