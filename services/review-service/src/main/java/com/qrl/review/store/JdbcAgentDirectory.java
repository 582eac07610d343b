package com.qrl.review.store;

import com.qrl.review.model.Agent;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcAgentDirectory implements AgentDirectory {
    private static final String COLUMNS = "agent_id, name, team, position, is_removed";

    private final JdbcTemplate jdbcTemplate;

    public JdbcAgentDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Agent> listActiveAgents() {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM agent WHERE is_removed = 0 ORDER BY name, agent_id",
            agentMapper()
        );
    }

    @Override
    public Optional<Agent> findById(String agentId) {
        List<Agent> rows = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM agent WHERE agent_id = ?",
            agentMapper(),
            agentId
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public Map<String, Agent> findByIds(Collection<String> agentIds) {
        if (agentIds == null || agentIds.isEmpty()) {
            return Map.of();
        }
        List<Object> params = new ArrayList<>(new LinkedHashSet<>(agentIds));
        StringJoiner placeholders = new StringJoiner(", ");
        for (int i = 0; i < params.size(); i++) {
            placeholders.add("?");
        }
        List<Agent> rows = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM agent WHERE agent_id IN (" + placeholders + ")",
            agentMapper(),
            params.toArray()
        );
        Map<String, Agent> byId = new HashMap<>();
        for (Agent agent : rows) {
            byId.put(agent.id(), agent);
        }
        return byId;
    }

    private RowMapper<Agent> agentMapper() {
        return (rs, rowNum) -> new Agent(
            rs.getString("agent_id"),
            rs.getString("name"),
            rs.getString("team"),
            rs.getString("position"),
            rs.getBoolean("is_removed")
        );
    }
}
