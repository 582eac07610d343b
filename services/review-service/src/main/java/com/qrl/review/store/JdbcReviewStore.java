package com.qrl.review.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qrl.review.model.BackfillMode;
import com.qrl.review.model.ConversationContent;
import com.qrl.review.model.ReviewContent;
import com.qrl.review.model.ReviewKind;
import com.qrl.review.model.ReviewRecord;
import com.qrl.review.model.ReviewStatus;
import com.qrl.review.model.TicketContent;
import com.qrl.review.text.ReviewTextExtractor;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcReviewStore implements ReviewStore {
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<Double>> DOUBLE_LIST = new TypeReference<>() {
    };

    static final String BASE_COLUMNS = "review_id, ticket_no, agent_id, kind, notes, feedback, short_description, "
        + "conversation_excerpt, quality_score, categories_json, status, graded_at, embedding_stale";
    static final String EMBEDDING_COLUMNS = BASE_COLUMNS + ", embedding_json";

    private static final String ELIGIBLE_CONTENT = "status = 'GRADED' "
        + "AND notes IS NOT NULL AND notes <> '' AND feedback IS NOT NULL AND feedback <> '' ";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final ReviewTextExtractor textExtractor;

    public JdbcReviewStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, ReviewTextExtractor textExtractor) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.textExtractor = textExtractor;
    }

    @Override
    public long insert(ReviewRecord record) {
        ReviewContent content = record.content();
        String searchText = textExtractor.extract(content).keywordText();
        String categoriesJson = writeJson(record.categories());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO review_record (ticket_no, agent_id, kind, notes, feedback, short_description, "
                    + "conversation_excerpt, search_text, quality_score, categories_json, status, graded_at, embedding_stale) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 1)",
                Statement.RETURN_GENERATED_KEYS
            );
            ps.setString(1, record.ticketNo());
            ps.setString(2, record.agentId());
            ps.setString(3, content.kind().name());
            ps.setString(4, content.notes());
            ps.setString(5, content.feedback());
            ps.setString(6, content.shortDescription());
            ps.setString(7, excerptOf(content));
            ps.setString(8, searchText);
            ps.setObject(9, record.qualityScore());
            ps.setString(10, categoriesJson);
            ps.setString(11, record.status().name());
            ps.setTimestamp(12, SqlValues.timestamp(record.gradedAt()));
            return ps;
        }, keyHolder);
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    @Override
    public void update(ReviewRecord record) {
        ReviewContent content = record.content();
        jdbcTemplate.update(
            "UPDATE review_record SET ticket_no = ?, agent_id = ?, kind = ?, notes = ?, feedback = ?, short_description = ?, "
                + "conversation_excerpt = ?, search_text = ?, quality_score = ?, categories_json = ?, status = ?, "
                + "graded_at = ?, embedding_stale = ?, updated_at = NOW() WHERE review_id = ?",
            record.ticketNo(),
            record.agentId(),
            content.kind().name(),
            content.notes(),
            content.feedback(),
            content.shortDescription(),
            excerptOf(content),
            textExtractor.extract(content).keywordText(),
            record.qualityScore(),
            writeJson(record.categories()),
            record.status().name(),
            SqlValues.timestamp(record.gradedAt()),
            record.embeddingStale(),
            record.id()
        );
    }

    @Override
    public Optional<ReviewRecord> findById(long id, boolean includeEmbedding) {
        String columns = includeEmbedding ? EMBEDDING_COLUMNS : BASE_COLUMNS;
        List<ReviewRecord> rows = jdbcTemplate.query(
            "SELECT " + columns + " FROM review_record WHERE review_id = ?",
            recordMapper(includeEmbedding),
            id
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<ReviewRecord> findByIds(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<Object> params = new ArrayList<>(ids);
        String sql = "SELECT " + BASE_COLUMNS + " FROM review_record WHERE review_id IN (" + placeholders(ids.size()) + ")";
        return jdbcTemplate.query(sql, recordMapper(false), params.toArray());
    }

    @Override
    public List<ReviewRecord> findKeywordCandidates(
        List<String> tokens,
        Collection<Long> excludeIds,
        Collection<String> categories,
        int limit
    ) {
        if (tokens == null || tokens.isEmpty()) {
            return List.of();
        }
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ").append(BASE_COLUMNS)
            .append(" FROM review_record WHERE ").append(ELIGIBLE_CONTENT);

        StringJoiner anyToken = new StringJoiner(" OR ", "AND (", ") ");
        for (String token : tokens) {
            anyToken.add("search_text LIKE ?");
            params.add("%" + token + "%");
        }
        sql.append(anyToken);
        appendExclude(sql, params, excludeIds);
        appendCategories(sql, params, categories);
        sql.append("ORDER BY graded_at DESC, review_id DESC LIMIT ?");
        params.add(Math.max(1, limit));
        return jdbcTemplate.query(sql.toString(), recordMapper(false), params.toArray());
    }

    @Override
    public List<ReviewRecord> findEmbeddedCandidates(
        Collection<Long> excludeIds,
        Collection<String> categories,
        int limit
    ) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ").append(EMBEDDING_COLUMNS)
            .append(" FROM review_record WHERE status = 'GRADED' ")
            .append("AND embedding_json IS NOT NULL AND embedding_stale = 0 ");
        appendExclude(sql, params, excludeIds);
        appendCategories(sql, params, categories);
        sql.append("ORDER BY graded_at DESC, review_id DESC LIMIT ?");
        params.add(Math.max(1, limit));
        return jdbcTemplate.query(sql.toString(), recordMapper(true), params.toArray());
    }

    @Override
    public List<Long> findIdsForBackfill(BackfillMode mode, Instant gradedFrom, int limit) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT review_id FROM review_record WHERE status = 'GRADED' ")
            .append("AND ((notes IS NOT NULL AND notes <> '') OR (feedback IS NOT NULL AND feedback <> '')) ");
        if (mode == BackfillMode.FRESH_MISSING) {
            sql.append("AND (embedding_json IS NULL OR embedding_stale = 1) ");
        }
        if (gradedFrom != null) {
            sql.append("AND graded_at >= ? ");
            params.add(SqlValues.timestamp(gradedFrom));
        }
        sql.append("ORDER BY review_id");
        if (limit > 0) {
            sql.append(" LIMIT ?");
            params.add(limit);
        }
        return jdbcTemplate.queryForList(sql.toString(), Long.class, params.toArray());
    }

    @Override
    public boolean storeEmbedding(long id, List<Double> vector, String modelId, ReviewContent embeddedFrom) {
        int updated = jdbcTemplate.update(
            "UPDATE review_record SET embedding_json = ?, embedding_dims = ?, embedding_model = ?, "
                + "embedded_at = NOW(), embedding_stale = 0 WHERE review_id = ? "
                + "AND kind = ? AND notes <=> ? AND feedback <=> ? AND short_description <=> ? "
                + "AND conversation_excerpt <=> ?",
            writeJson(vector),
            vector.size(),
            modelId,
            id,
            embeddedFrom.kind().name(),
            embeddedFrom.notes(),
            embeddedFrom.feedback(),
            embeddedFrom.shortDescription(),
            excerptOf(embeddedFrom)
        );
        return updated > 0;
    }

    @Override
    public List<ReviewRecord> findGradedForAgent(String agentId, Instant gradedFrom) {
        return jdbcTemplate.query(
            "SELECT " + EMBEDDING_COLUMNS + " FROM review_record "
                + "WHERE agent_id = ? AND status = 'GRADED' AND quality_score IS NOT NULL AND graded_at >= ? "
                + "ORDER BY graded_at, review_id",
            recordMapper(true),
            agentId,
            SqlValues.timestamp(gradedFrom)
        );
    }

    private RowMapper<ReviewRecord> recordMapper(boolean includeEmbedding) {
        return (rs, rowNum) -> new ReviewRecord(
            rs.getLong("review_id"),
            rs.getString("ticket_no"),
            rs.getString("agent_id"),
            readContent(rs),
            SqlValues.nullableInt(rs, "quality_score"),
            readJson(rs.getString("categories_json"), STRING_LIST),
            ReviewStatus.valueOf(rs.getString("status")),
            SqlValues.instant(rs, "graded_at"),
            includeEmbedding ? readJson(rs.getString("embedding_json"), DOUBLE_LIST) : null,
            rs.getBoolean("embedding_stale")
        );
    }

    private ReviewContent readContent(ResultSet rs) throws SQLException {
        ReviewKind kind = ReviewKind.valueOf(rs.getString("kind"));
        if (kind == ReviewKind.CONVERSATION) {
            return new ConversationContent(
                rs.getString("notes"),
                rs.getString("feedback"),
                rs.getString("short_description"),
                rs.getString("conversation_excerpt")
            );
        }
        return new TicketContent(rs.getString("notes"), rs.getString("feedback"), rs.getString("short_description"));
    }

    private static String excerptOf(ReviewContent content) {
        return content instanceof ConversationContent conversation ? conversation.conversationExcerpt() : null;
    }

    private void appendExclude(StringBuilder sql, List<Object> params, Collection<Long> excludeIds) {
        if (excludeIds == null || excludeIds.isEmpty()) {
            return;
        }
        StringJoiner joiner = new StringJoiner(", ");
        for (Long id : excludeIds) {
            if (id == null) {
                continue;
            }
            joiner.add("?");
            params.add(id);
        }
        if (joiner.length() == 0) {
            return;
        }
        sql.append("AND review_id NOT IN (").append(joiner).append(") ");
    }

    private void appendCategories(StringBuilder sql, List<Object> params, Collection<String> categories) {
        if (categories == null || categories.isEmpty()) {
            return;
        }
        sql.append("AND JSON_OVERLAPS(categories_json, CAST(? AS JSON)) ");
        params.add(writeJson(List.copyOf(categories)));
    }

    private static String placeholders(int count) {
        StringJoiner joiner = new StringJoiner(", ");
        for (int i = 0; i < count; i++) {
            joiner.add("?");
        }
        return joiner.toString();
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize column value", e);
        }
    }

    private <T> List<T> readJson(String json, TypeReference<List<T>> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to parse column value", e);
        }
    }
}
