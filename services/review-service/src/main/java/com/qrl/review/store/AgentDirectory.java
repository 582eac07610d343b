package com.qrl.review.store;

import com.qrl.review.model.Agent;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface AgentDirectory {
    List<Agent> listActiveAgents();

    Optional<Agent> findById(String agentId);

    Map<String, Agent> findByIds(Collection<String> agentIds);
}
