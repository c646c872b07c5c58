package com.moviebot.recommendation;

import com.moviebot.config.RecommendationProperties;
import com.moviebot.graph.GraphModels.GraphFilter;
import com.moviebot.session.SessionModels.Constraint;
import com.moviebot.session.SessionModels.ConstraintKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Translates session constraints and negations into the filter pushed into graph queries.
 * Generation and verification share it, so both apply exactly the same predicates.
 */
final class GraphFilters {
    private static final Logger log = LoggerFactory.getLogger(GraphFilters.class);

    private GraphFilters() {}

    static GraphFilter from(Map<ConstraintKind, Constraint> constraints,
                            Map<String, String> negations,
                            RecommendationProperties properties) {
        return new GraphFilter(constraints, predicates(negations, properties), properties.getMovieTypeId());
    }

    /**
     * Preference kind → entity becomes predicate → entity; kinds without a predicate are dropped.
     */
    static Map<String, String> predicates(Map<String, String> byKind, RecommendationProperties properties) {
        Map<String, String> mapped = new LinkedHashMap<>();
        byKind.forEach((kind, entityId) -> {
            String predicate = properties.getPreferencePredicates().get(kind);
            if (predicate == null) {
                log.debug("No graph predicate for preference kind '{}', ignored", kind);
            } else {
                mapped.put(predicate, entityId);
            }
        });
        return mapped;
    }
}
