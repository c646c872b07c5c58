package com.moviebot.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class EmbeddingJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public EmbeddingJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<EmbeddingRow> loadEntityEmbeddings() {
        return jdbcTemplate.query(
                "SELECT entity_id, vector FROM entity_embeddings ORDER BY entity_id",
                (rs, n) -> new EmbeddingRow(rs.getString(1), rs.getString(2)));
    }

    /**
     * {@code vector} is the comma-separated float list as stored.
     */
    public record EmbeddingRow(String entityId, String vector) {}
}
