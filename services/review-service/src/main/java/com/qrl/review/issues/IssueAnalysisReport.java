package com.qrl.review.issues;

import java.util.List;

public record IssueAnalysisReport(
    int agentsAnalyzed,
    int badCount,
    int unresolvedCount,
    int failedAgents,
    List<AgentIssueReport> agents
) {
    public static IssueAnalysisReport of(List<AgentIssueReport> agents) {
        int bad = 0;
        int unresolved = 0;
        int failed = 0;
        for (AgentIssueReport report : agents) {
            bad += report.badCount();
            unresolved += report.unresolvedCount();
            if (report.isFailed()) {
                failed++;
            }
        }
        return new IssueAnalysisReport(agents.size(), bad, unresolved, failed, List.copyOf(agents));
    }
}
