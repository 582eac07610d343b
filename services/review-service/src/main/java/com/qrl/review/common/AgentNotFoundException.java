package com.qrl.review.common;

public class AgentNotFoundException extends RuntimeException {
    public AgentNotFoundException(String agentId) {
        super("agent not found: " + agentId);
    }
}
