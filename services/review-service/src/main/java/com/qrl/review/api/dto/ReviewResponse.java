package com.qrl.review.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.qrl.review.model.ReviewRecord;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

public record ReviewResponse(
    @JsonProperty("review_id") Long reviewId,
    @JsonProperty("ticket_no") String ticketNo,
    @JsonProperty("agent_id") String agentId,
    String kind,
    @JsonProperty("quality_score") Integer qualityScore,
    List<String> categories,
    String status,
    @JsonProperty("graded_at") Instant gradedAt,
    @JsonProperty("embedding_stale") boolean embeddingStale
) {
    public static ReviewResponse from(ReviewRecord record) {
        return new ReviewResponse(
            record.id(),
            record.ticketNo(),
            record.agentId(),
            record.content().kind().name().toLowerCase(Locale.ROOT),
            record.qualityScore(),
            record.categories(),
            record.status().name(),
            record.gradedAt(),
            record.embeddingStale()
        );
    }
}
