package com.moviebot.recommendation;

import com.moviebot.config.RecommendationProperties;
import com.moviebot.config.RecommendationProperties.SharedProperty;
import com.moviebot.graph.GraphModels.GraphFilter;
import com.moviebot.graph.GraphModels.GraphRow;
import com.moviebot.graph.GraphStore;
import com.moviebot.recommendation.RecommendationModels.Degradation;
import com.moviebot.recommendation.RecommendationModels.DegradationNote;
import com.moviebot.recommendation.RecommendationModels.StageOutcome;
import com.moviebot.session.SessionModels.Constraint;
import com.moviebot.session.SessionModels.ConstraintKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Candidates from the knowledge graph: movies sharing properties with the seeds, and movies
 * matching every explicit preference. Constraints and negations are applied inside the queries.
 */
@Component
public class GraphCandidateSource {
    private static final Logger log = LoggerFactory.getLogger(GraphCandidateSource.class);
    public static final String PREFERENCE_REASON = "it matches your preferences";
    public static final String FALLBACK_VALUE = "a shared property";

    private final GraphStore graphStore;
    private final ExternalCalls externalCalls;
    private final RecommendationProperties properties;

    public GraphCandidateSource(GraphStore graphStore, ExternalCalls externalCalls, RecommendationProperties properties) {
        this.graphStore = graphStore;
        this.externalCalls = externalCalls;
        this.properties = properties;
    }

    public StageOutcome<Map<String, Candidate>> fromSeeds(Set<String> seeds,
                                                          Set<String> exclude,
                                                          Map<ConstraintKind, Constraint> constraints,
                                                          Map<String, String> negations) {
        Map<String, Candidate> candidates = new LinkedHashMap<>();
        if (seeds.isEmpty()) return StageOutcome.ok(candidates);

        GraphFilter filter = GraphFilters.from(constraints, negations, properties);
        List<DegradationNote> notes = new ArrayList<>();

        for (SharedProperty property : properties.getSharedProperties()) {
            List<GraphRow> rows;
            try {
                rows = externalCalls.call("shared " + property.getPredicate(), () -> graphStore.sharedPropertyMatches(
                        seeds, property.getPredicate(), filter, exclude, properties.getGraphQueryLimit()));
            } catch (RuntimeException e) {
                log.warn("Shared-property query for {} skipped: {}", property.getPredicate(), e.getMessage());
                notes.add(new DegradationNote(Degradation.SOURCE_UNAVAILABLE, "graph " + property.getPredicate()));
                continue;
            }
            log.debug("Shared-property {} returned {} rows", property.getPredicate(), rows.size());

            for (GraphRow row : rows) {
                if (row.entityId() == null || exclude.contains(row.entityId()) || seeds.contains(row.entityId())) continue;
                String value = row.matchedValue() == null || row.matchedValue().isBlank() ? FALLBACK_VALUE : row.matchedValue();
                Candidate c = candidates.computeIfAbsent(row.entityId(), Candidate::new);
                c.addScore(property.getWeight());
                c.addReason(property.getReason() + " '" + value + "'");
                if (row.rating() != null) c.raiseQuality(row.rating());
            }
        }
        return StageOutcome.of(candidates, notes);
    }

    public StageOutcome<Map<String, Candidate>> fromPreferences(Map<String, String> preferences,
                                                                Set<String> exclude,
                                                                Map<ConstraintKind, Constraint> constraints,
                                                                Map<String, String> negations) {
        Map<String, Candidate> candidates = new LinkedHashMap<>();
        Map<String, String> required = GraphFilters.predicates(preferences, properties);
        if (required.isEmpty()) return StageOutcome.ok(candidates);

        GraphFilter filter = GraphFilters.from(constraints, negations, properties);
        List<GraphRow> rows;
        try {
            rows = externalCalls.call("preferences", () -> graphStore.propertyMatches(
                    required, filter, exclude, properties.getGraphQueryLimit()));
        } catch (RuntimeException e) {
            log.warn("Preference query skipped: {}", e.getMessage());
            return StageOutcome.degraded(candidates, Degradation.SOURCE_UNAVAILABLE, "graph preferences");
        }

        for (GraphRow row : rows) {
            if (row.entityId() == null || exclude.contains(row.entityId())) continue;
            Candidate c = candidates.computeIfAbsent(row.entityId(), Candidate::new);
            c.addScore(properties.getPreferenceMatchScore());
            c.addReason(PREFERENCE_REASON);
            if (row.rating() != null) c.raiseQuality(row.rating());
        }
        log.debug("Preference query returned {} candidates", candidates.size());
        return StageOutcome.ok(candidates);
    }
}
