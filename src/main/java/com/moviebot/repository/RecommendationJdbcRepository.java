package com.moviebot.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class RecommendationJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public RecommendationJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void saveRecommendationLog(String userId, String entityId, double score, String reason) {
        jdbcTemplate.update(
                "INSERT INTO recommendation_log(user_id, entity_id, score, reason, ts) VALUES (?,?,?,?,?)",
                userId, entityId, score, reason, Instant.now().toString());
    }

    public List<RecommendationLogRow> loadRecommendationLog(String userId) {
        return jdbcTemplate.query(
                "SELECT user_id, entity_id, score, reason, ts FROM recommendation_log WHERE user_id=? ORDER BY id",
                (rs, n) -> new RecommendationLogRow(rs.getString(1), rs.getString(2), rs.getDouble(3), rs.getString(4), rs.getString(5)),
                userId);
    }

    public record RecommendationLogRow(String userId, String entityId, double score, String reason, String ts) {}
}
