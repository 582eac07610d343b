package com.qrl.review.api;

import com.qrl.review.api.dto.AgentIssuesResponse;
import com.qrl.review.common.AgentNotFoundException;
import com.qrl.review.model.Agent;
import com.qrl.review.store.AgentDirectory;
import com.qrl.review.store.IssueStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AgentIssueController {
    private final AgentDirectory agentDirectory;
    private final IssueStore issueStore;

    public AgentIssueController(AgentDirectory agentDirectory, IssueStore issueStore) {
        this.agentDirectory = agentDirectory;
        this.issueStore = issueStore;
    }

    @GetMapping("/api/v1/agents/{agentId}/issues")
    public AgentIssuesResponse listIssues(@PathVariable String agentId) {
        Agent agent = agentDirectory.findById(agentId).orElseThrow(() -> new AgentNotFoundException(agentId));
        return AgentIssuesResponse.from(agent.id(), agent.name(), issueStore.findByAgent(agent.id()));
    }
}
