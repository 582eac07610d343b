package com.qrl.review.issues;

public record AgentIssueReport(
    String agentId,
    int badCount,
    int unresolvedCount,
    int resolvedByCategory,
    int resolvedByEmbedding,
    int summaryFailures,
    String error
) {
    public static AgentIssueReport failed(String agentId, String error) {
        return new AgentIssueReport(agentId, 0, 0, 0, 0, 0, error);
    }

    public boolean isFailed() {
        return error != null;
    }
}
