package com.moviebot.recommendation;

import com.moviebot.config.RecommendationProperties;
import com.moviebot.recommendation.RecommendationModels.CandidateSourceKind;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class CandidateAggregator {
    private final RecommendationProperties properties;

    public CandidateAggregator(RecommendationProperties properties) {
        this.properties = properties;
    }

    /**
     * Folds one source's candidates into {@code main}: score += source score * source weight,
     * reasons unioned, quality signal maxed.
     */
    public void merge(Map<String, Candidate> main, Map<String, Candidate> source, CandidateSourceKind kind) {
        double weight = weight(kind);
        for (Candidate incoming : source.values()) {
            Candidate target = main.computeIfAbsent(incoming.entityId(), Candidate::new);
            target.addScore(incoming.score() * weight);
            target.addReasons(incoming.reasons());
            target.raiseQuality(incoming.qualitySignal());
        }
    }

    public double weight(CandidateSourceKind kind) {
        var weights = properties.getSourceWeights();
        return switch (kind) {
            case GRAPH_PREFERENCE -> weights.getGraphPreference();
            case GRAPH_SEED -> weights.getGraphSeed();
            case EMBEDDING_SEED -> weights.getEmbeddingSeed();
        };
    }
}
