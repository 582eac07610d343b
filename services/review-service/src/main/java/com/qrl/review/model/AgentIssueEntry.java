package com.qrl.review.model;

import java.time.Instant;
import java.util.List;

public record AgentIssueEntry(
    String agentId,
    long reviewId,
    String ticketNo,
    List<String> categories,
    Integer qualityScore,
    Instant gradedAt,
    String summary,
    String feedbackExcerpt,
    boolean resolved,
    Instant createdAt
) {
    public AgentIssueEntry {
        categories = categories == null ? List.of() : List.copyOf(categories);
    }
}
