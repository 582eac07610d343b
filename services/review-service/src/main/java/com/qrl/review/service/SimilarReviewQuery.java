package com.qrl.review.service;

import java.util.List;

public record SimilarReviewQuery(String text, Long excludeId, Integer limit, List<String> categories) {
    public SimilarReviewQuery {
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    public static SimilarReviewQuery of(String text, Long excludeId, Integer limit) {
        return new SimilarReviewQuery(text, excludeId, limit, List.of());
    }
}
