package com.qrl.review.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.qrl.review.common.RequestIds;
import com.qrl.review.model.MatchType;
import com.qrl.review.service.SimilarReviewHit;
import com.qrl.review.service.SimilarReviewResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SimilarReviewResponse(
    @JsonProperty("trace_id") String traceId,
    @JsonProperty("request_id") String requestId,
    @JsonProperty("took_ms") long tookMs,
    @JsonProperty("vector_status") String vectorStatus,
    String message,
    List<Hit> results
) {
    public static SimilarReviewResponse from(SimilarReviewResult result, RequestIds ids) {
        List<Hit> hits = new ArrayList<>(result.hits().size());
        for (SimilarReviewHit hit : result.hits()) {
            hits.add(new Hit(
                hit.documentId(),
                hit.score(),
                hit.matchType(),
                hit.ticketNo(),
                hit.agentId(),
                hit.agentName(),
                hit.qualityScore(),
                hit.categories(),
                hit.gradedAt()
            ));
        }
        return new SimilarReviewResponse(
            ids.traceId(),
            ids.requestId(),
            result.tookMs(),
            result.vectorStatus(),
            result.message(),
            hits
        );
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Hit(
        @JsonProperty("document_id") long documentId,
        int score,
        @JsonProperty("match_type") MatchType matchType,
        @JsonProperty("ticket_no") String ticketNo,
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("agent_name") String agentName,
        @JsonProperty("quality_score") Integer qualityScore,
        List<String> categories,
        @JsonProperty("graded_at") Instant gradedAt
    ) {
    }
}
