package com.moviebot.recommendation;

import com.moviebot.config.RecommendationProperties;
import com.moviebot.graph.GraphStore;
import com.moviebot.recommendation.RecommendationModels.Degradation;
import com.moviebot.recommendation.RecommendationModels.StageOutcome;
import com.moviebot.session.SessionModels.Constraint;
import com.moviebot.session.SessionModels.ConstraintKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Re-checks merged candidates against the session's hard constraints, negations and the movie
 * type, with one batched membership query. Fails open.
 */
@Component
public class ConstraintFilter {
    private static final Logger log = LoggerFactory.getLogger(ConstraintFilter.class);

    private final GraphStore graphStore;
    private final ExternalCalls externalCalls;
    private final RecommendationProperties properties;

    public ConstraintFilter(GraphStore graphStore, ExternalCalls externalCalls, RecommendationProperties properties) {
        this.graphStore = graphStore;
        this.externalCalls = externalCalls;
        this.properties = properties;
    }

    public StageOutcome<Map<String, Candidate>> filter(Map<String, Candidate> candidates,
                                                       Map<ConstraintKind, Constraint> constraints,
                                                       Map<String, String> negations) {
        if (candidates.isEmpty()) return StageOutcome.ok(candidates);

        // truncation happens before verification: a valid low scorer can lose its slot to an
        // invalid high scorer
        Set<String> toVerify = topByScore(candidates, properties.getFilterCap());
        if (toVerify.size() < candidates.size()) {
            log.info("Candidate pool {} over cap, verifying top {}", candidates.size(), toVerify.size());
        }

        Set<String> valid;
        try {
            valid = externalCalls.call("verify membership",
                    () -> graphStore.verifyMembership(toVerify, GraphFilters.from(constraints, negations, properties)));
        } catch (RuntimeException e) {
            log.warn("Constraint verification failed, keeping {} unfiltered candidates: {}", candidates.size(), e.getMessage());
            return StageOutcome.degraded(candidates, Degradation.FILTER_VERIFICATION_FAILED, e.getMessage());
        }

        Map<String, Candidate> kept = new LinkedHashMap<>();
        candidates.forEach((id, c) -> {
            if (toVerify.contains(id) && valid.contains(id)) kept.put(id, c);
        });
        log.debug("Constraint filter kept {} of {} candidates", kept.size(), candidates.size());
        return StageOutcome.ok(kept);
    }

    /**
     * Ids of the {@code cap} highest-scoring candidates; equal scores keep map order.
     */
    Set<String> topByScore(Map<String, Candidate> candidates, int cap) {
        if (candidates.size() <= cap) return new LinkedHashSet<>(candidates.keySet());
        List<Candidate> sorted = new ArrayList<>(candidates.values());
        sorted.sort(Comparator.comparingDouble(Candidate::score).reversed());
        Set<String> top = new LinkedHashSet<>();
        for (int i = 0; i < cap; i++) {
            top.add(sorted.get(i).entityId());
        }
        return top;
    }
}
