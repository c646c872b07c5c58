package com.moviebot.repository;

import com.moviebot.graph.GraphModels.GraphFilter;
import com.moviebot.graph.GraphModels.GraphRow;
import com.moviebot.graph.GraphStore;
import com.moviebot.graph.LabelResolver;
import com.moviebot.session.SessionModels.Constraint;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.*;

/**
 * Knowledge graph backed by a single {@code triples(subject, predicate, object)} table.
 * Entity ids are bare (e.g. {@code Q172241}); literals are stored as text.
 */
@Repository
public class GraphJdbcRepository implements GraphStore, LabelResolver {
    static final String LABEL = "rdfs:label";
    static final String RATING = "ddis:rating";
    static final String INSTANCE_OF = "wdt:P31";
    static final String PUBLICATION_DATE = "wdt:P577";
    static final String LANGUAGE = "wdt:P407";
    static final String IMAGE = "wdt:P18";

    // literals that do not look like a number or an ISO year convert to NULL instead of failing
    private static final String NUMBER_PATTERN = "^[0-9]+(\\.[0-9]+)?$";
    private static final String YEAR_PATTERN = "^[0-9]{4}";

    private static final String RATING_COLUMN =
            "(SELECT MAX(" + number("r") + ") FROM triples r WHERE r.subject = m.subject AND r.predicate = '" + RATING + "')";

    private final JdbcTemplate jdbcTemplate;

    public GraphJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<GraphRow> sharedPropertyMatches(Set<String> seeds, String predicate, GraphFilter filter, Set<String> exclude, int limit) {
        if (seeds.isEmpty()) return List.of();
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder()
                .append("SELECT DISTINCT m.subject, lbl.object AS value_label, ").append(RATING_COLUMN).append(" AS rating, ")
                .append("s.object AS shared_value ")
                .append("FROM triples s ")
                .append("JOIN triples m ON m.predicate = s.predicate AND m.object = s.object ")
                .append("LEFT JOIN triples lbl ON lbl.subject = s.object AND lbl.predicate = '").append(LABEL).append("' ")
                .append("WHERE s.predicate = ? AND s.subject IN (").append(placeholders(seeds.size())).append(")");
        params.add(predicate);
        params.addAll(seeds);

        Set<String> excluded = new LinkedHashSet<>(seeds);
        excluded.addAll(exclude);
        sql.append(" AND m.subject NOT IN (").append(placeholders(excluded.size())).append(")");
        params.addAll(excluded);

        appendFilter(sql, params, "m.subject", filter);
        sql.append(" ORDER BY rating DESC NULLS LAST, m.subject LIMIT ?");
        params.add(limit);

        return jdbcTemplate.query(sql.toString(), ROW_MAPPER, params.toArray());
    }

    @Override
    public List<GraphRow> propertyMatches(Map<String, String> required, GraphFilter filter, Set<String> exclude, int limit) {
        if (required.isEmpty()) return List.of();
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder()
                .append("SELECT m.subject, CAST(NULL AS VARCHAR) AS value_label, MAX(").append(number("r")).append(") AS rating ")
                .append("FROM triples m ")
                .append("LEFT JOIN triples r ON r.subject = m.subject AND r.predicate = '").append(RATING).append("' ")
                .append("WHERE 1 = 1");
        for (var e : required.entrySet()) {
            sql.append(" AND EXISTS (SELECT 1 FROM triples p WHERE p.subject = m.subject AND p.predicate = ? AND p.object = ?)");
            params.add(e.getKey());
            params.add(e.getValue());
        }
        if (!exclude.isEmpty()) {
            sql.append(" AND m.subject NOT IN (").append(placeholders(exclude.size())).append(")");
            params.addAll(exclude);
        }
        appendFilter(sql, params, "m.subject", filter);
        sql.append(" GROUP BY m.subject ORDER BY rating DESC NULLS LAST, m.subject LIMIT ?");
        params.add(limit);

        return jdbcTemplate.query(sql.toString(), ROW_MAPPER, params.toArray());
    }

    @Override
    public Set<String> verifyMembership(Set<String> entityIds, GraphFilter filter) {
        if (entityIds.isEmpty()) return Set.of();
        List<Object> params = new ArrayList<>(entityIds);
        StringBuilder sql = new StringBuilder()
                .append("SELECT DISTINCT m.subject FROM triples m WHERE m.subject IN (")
                .append(placeholders(entityIds.size())).append(")");
        appendFilter(sql, params, "m.subject", filter);
        return new HashSet<>(jdbcTemplate.query(sql.toString(), (rs, n) -> rs.getString(1), params.toArray()));
    }

    @Override
    public Optional<String> labelOf(String entityId) {
        return firstObject(entityId, LABEL);
    }

    @Override
    public Optional<String> imageOf(String entityId) {
        return firstObject(entityId, IMAGE);
    }

    private Optional<String> firstObject(String subject, String predicate) {
        List<String> rows = jdbcTemplate.query(
                "SELECT object FROM triples WHERE subject = ? AND predicate = ? ORDER BY object LIMIT 1",
                (rs, n) -> rs.getString(1),
                subject, predicate);
        return rows.stream().findFirst();
    }

    private void appendFilter(StringBuilder sql, List<Object> params, String column, GraphFilter filter) {
        if (filter.requiredTypeId() != null) {
            sql.append(" AND ").append(exists(column, INSTANCE_OF, "t.object = ?"));
            params.add(filter.requiredTypeId());
        }
        for (Constraint c : filter.constraints().values()) {
            switch (c.kind()) {
                case YEAR -> {
                    // operator is whitelisted by Constraint itself
                    sql.append(" AND ").append(exists(column, PUBLICATION_DATE, year() + " " + c.operator() + " ?"));
                    params.add(c.lower().intValue());
                }
                case YEAR_RANGE -> {
                    sql.append(" AND ").append(exists(column, PUBLICATION_DATE, year() + " BETWEEN ? AND ?"));
                    params.add(c.lower().intValue());
                    params.add(c.upper().intValue());
                }
                case LANGUAGE -> {
                    sql.append(" AND ").append(exists(column, LANGUAGE, "t.object = ?"));
                    params.add(c.entityId());
                }
                case MIN_RATING -> {
                    sql.append(" AND ").append(exists(column, RATING, number("t") + " >= ?"));
                    params.add(c.lower());
                }
            }
        }
        for (var e : filter.negatedProperties().entrySet()) {
            sql.append(" AND NOT EXISTS (SELECT 1 FROM triples n WHERE n.subject = ").append(column)
                    .append(" AND n.predicate = ? AND n.object = ?)");
            params.add(e.getKey());
            params.add(e.getValue());
        }
    }

    private String exists(String column, String predicate, String condition) {
        return "EXISTS (SELECT 1 FROM triples t WHERE t.subject = " + column
                + " AND t.predicate = '" + predicate + "' AND " + condition + ")";
    }

    private static String year() {
        return "CASE WHEN REGEXP_LIKE(t.object, '" + YEAR_PATTERN + "') THEN CAST(SUBSTRING(t.object, 1, 4) AS INT) END";
    }

    private static String number(String alias) {
        return "CASE WHEN REGEXP_LIKE(" + alias + ".object, '" + NUMBER_PATTERN + "') THEN CAST(" + alias + ".object AS DOUBLE) END";
    }

    private static String placeholders(int n) {
        return String.join(",", Collections.nCopies(n, "?"));
    }

    private static final RowMapper<GraphRow> ROW_MAPPER = (rs, n) -> {
        double rating = rs.getDouble(3);
        return new GraphRow(rs.getString(1), rs.getString(2), rs.wasNull() ? null : rating);
    };
}
