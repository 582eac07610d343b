package com.qrl.review.store;

import com.qrl.review.model.AgentIssueEntry;
import java.time.Instant;
import java.util.List;

public interface IssueStore {
    /** Replaces the agent's whole issue list and stamps the analysis time. */
    void replaceIssues(String agentId, List<AgentIssueEntry> entries, Instant analyzedAt);

    List<AgentIssueEntry> findByAgent(String agentId);
}
