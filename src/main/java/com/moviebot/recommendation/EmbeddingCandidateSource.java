package com.moviebot.recommendation;

import com.moviebot.config.RecommendationProperties;
import com.moviebot.embedding.VectorIndex;
import com.moviebot.embedding.VectorIndex.Neighbour;
import com.moviebot.recommendation.RecommendationModels.Degradation;
import com.moviebot.recommendation.RecommendationModels.DegradationNote;
import com.moviebot.recommendation.RecommendationModels.StageOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Nearest neighbours of the seeds in embedding space. Knows nothing about constraints: its
 * output is re-validated by {@link ConstraintFilter}.
 */
@Component
public class EmbeddingCandidateSource {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingCandidateSource.class);
    public static final String SIMILARITY_REASON = "it's similar to movies you like";

    private final VectorIndex vectorIndex;
    private final ExternalCalls externalCalls;
    private final RecommendationProperties properties;

    public EmbeddingCandidateSource(VectorIndex vectorIndex, ExternalCalls externalCalls, RecommendationProperties properties) {
        this.vectorIndex = vectorIndex;
        this.externalCalls = externalCalls;
        this.properties = properties;
    }

    public StageOutcome<Map<String, Candidate>> fromSeeds(Set<String> seeds, Set<String> exclude) {
        Map<String, Candidate> candidates = new LinkedHashMap<>();
        List<DegradationNote> notes = new ArrayList<>();

        for (String seed : new TreeSet<>(seeds)) {
            List<Neighbour> neighbours;
            try {
                neighbours = externalCalls.call("neighbours of " + seed,
                        () -> vectorIndex.nearestNeighbors(seed, properties.getNeighbourCount()));
            } catch (RuntimeException e) {
                log.warn("Nearest-neighbour lookup for {} skipped: {}", seed, e.getMessage());
                notes.add(new DegradationNote(Degradation.SOURCE_UNAVAILABLE, "embedding " + seed));
                continue;
            }
            if (neighbours.isEmpty()) {
                log.debug("Seed {} has no embedding", seed);
                continue;
            }
            for (Neighbour n : neighbours) {
                if (exclude.contains(n.entityId()) || seeds.contains(n.entityId())) continue;
                Candidate c = candidates.computeIfAbsent(n.entityId(), Candidate::new);
                c.addScore(n.similarity());
                c.addReason(SIMILARITY_REASON);
            }
        }
        log.debug("Embedding source produced {} candidates from {} seeds", candidates.size(), seeds.size());
        return StageOutcome.of(candidates, notes);
    }
}
