package com.qrl.review.service;

import com.qrl.review.model.MatchType;
import java.time.Instant;
import java.util.List;

public record SimilarReviewHit(
    long documentId,
    int score,
    MatchType matchType,
    String ticketNo,
    String agentId,
    String agentName,
    Integer qualityScore,
    List<String> categories,
    Instant gradedAt
) {
}
