package com.qrl.review.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.qrl.review.model.AgentIssueEntry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public record AgentIssuesResponse(
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("agent_name") String agentName,
    List<Issue> issues
) {
    public static AgentIssuesResponse from(String agentId, String agentName, List<AgentIssueEntry> entries) {
        List<Issue> issues = new ArrayList<>(entries.size());
        for (AgentIssueEntry entry : entries) {
            issues.add(new Issue(
                entry.reviewId(),
                entry.ticketNo(),
                entry.categories(),
                entry.qualityScore(),
                entry.gradedAt(),
                entry.summary(),
                entry.feedbackExcerpt(),
                entry.resolved(),
                entry.createdAt()
            ));
        }
        return new AgentIssuesResponse(agentId, agentName, issues);
    }

    public record Issue(
        @JsonProperty("review_id") long reviewId,
        @JsonProperty("ticket_no") String ticketNo,
        List<String> categories,
        @JsonProperty("quality_score") Integer qualityScore,
        @JsonProperty("graded_at") Instant gradedAt,
        String summary,
        @JsonProperty("feedback") String feedbackExcerpt,
        @JsonProperty("is_resolved") boolean resolved,
        @JsonProperty("created_at") Instant createdAt
    ) {
    }
}
