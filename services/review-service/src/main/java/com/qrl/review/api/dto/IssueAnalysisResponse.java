package com.qrl.review.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.qrl.review.issues.AgentIssueReport;
import com.qrl.review.issues.IssueAnalysisReport;
import java.util.ArrayList;
import java.util.List;

public record IssueAnalysisResponse(
    @JsonProperty("agents_analyzed") int agentsAnalyzed,
    @JsonProperty("bad_count") int badCount,
    @JsonProperty("unresolved_count") int unresolvedCount,
    @JsonProperty("failed_agents") int failedAgents,
    List<AgentResult> agents
) {
    public static IssueAnalysisResponse from(IssueAnalysisReport report) {
        List<AgentResult> agents = new ArrayList<>(report.agents().size());
        for (AgentIssueReport agent : report.agents()) {
            agents.add(new AgentResult(
                agent.agentId(),
                agent.badCount(),
                agent.unresolvedCount(),
                agent.resolvedByCategory(),
                agent.resolvedByEmbedding(),
                agent.summaryFailures(),
                agent.error()
            ));
        }
        return new IssueAnalysisResponse(
            report.agentsAnalyzed(),
            report.badCount(),
            report.unresolvedCount(),
            report.failedAgents(),
            agents
        );
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AgentResult(
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("bad_count") int badCount,
        @JsonProperty("unresolved_count") int unresolvedCount,
        @JsonProperty("resolved_by_category") int resolvedByCategory,
        @JsonProperty("resolved_by_embedding") int resolvedByEmbedding,
        @JsonProperty("summary_failures") int summaryFailures,
        String error
    ) {
    }
}
