package com.qrl.review.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qrl.review.model.AgentIssueEntry;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class JdbcIssueStore implements IssueStore {
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcIssueStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void replaceIssues(String agentId, List<AgentIssueEntry> entries, Instant analyzedAt) {
        jdbcTemplate.update("DELETE FROM agent_issue WHERE agent_id = ?", agentId);
        if (!entries.isEmpty()) {
            jdbcTemplate.batchUpdate(
                "INSERT INTO agent_issue (agent_id, review_id, ticket_no, categories_json, quality_score, graded_at, "
                    + "summary, feedback_excerpt, resolved, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                new BatchPreparedStatementSetter() {
                    @Override
                    public void setValues(PreparedStatement ps, int i) throws SQLException {
                        AgentIssueEntry entry = entries.get(i);
                        ps.setString(1, agentId);
                        ps.setLong(2, entry.reviewId());
                        ps.setString(3, entry.ticketNo());
                        ps.setString(4, writeJson(entry.categories()));
                        ps.setObject(5, entry.qualityScore());
                        ps.setTimestamp(6, SqlValues.timestamp(entry.gradedAt()));
                        ps.setString(7, entry.summary());
                        ps.setString(8, entry.feedbackExcerpt());
                        ps.setBoolean(9, entry.resolved());
                        ps.setTimestamp(10, SqlValues.timestamp(entry.createdAt()));
                    }

                    @Override
                    public int getBatchSize() {
                        return entries.size();
                    }
                }
            );
        }
        jdbcTemplate.update(
            "UPDATE agent SET issues_last_analyzed = ? WHERE agent_id = ?",
            SqlValues.timestamp(analyzedAt),
            agentId
        );
    }

    @Override
    public List<AgentIssueEntry> findByAgent(String agentId) {
        return jdbcTemplate.query(
            "SELECT agent_id, review_id, ticket_no, categories_json, quality_score, graded_at, summary, feedback_excerpt, "
                + "resolved, created_at FROM agent_issue WHERE agent_id = ? ORDER BY graded_at, review_id",
            issueMapper(),
            agentId
        );
    }

    private RowMapper<AgentIssueEntry> issueMapper() {
        return (rs, rowNum) -> new AgentIssueEntry(
            rs.getString("agent_id"),
            rs.getLong("review_id"),
            rs.getString("ticket_no"),
            readCategories(rs.getString("categories_json")),
            SqlValues.nullableInt(rs, "quality_score"),
            SqlValues.instant(rs, "graded_at"),
            rs.getString("summary"),
            rs.getString("feedback_excerpt"),
            rs.getBoolean("resolved"),
            SqlValues.instant(rs, "created_at")
        );
    }

    private String writeJson(List<String> value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize categories", e);
        }
    }

    private List<String> readCategories(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to parse categories", e);
        }
    }
}
