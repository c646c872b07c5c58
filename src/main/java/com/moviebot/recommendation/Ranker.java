package com.moviebot.recommendation;

import com.moviebot.config.RecommendationProperties;
import com.moviebot.recommendation.RecommendationModels.RankedEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Orders candidates by {@code score + quality * ratingWeight}. The sort is stable: equal final
 * scores keep the candidates' insertion order.
 */
@Component
public class Ranker {
    public static final String DEFAULT_REASON = "is a potential match";

    private final RecommendationProperties properties;

    public Ranker(RecommendationProperties properties) {
        this.properties = properties;
    }

    public List<RankedEntry> rank(Map<String, Candidate> candidates) {
        List<RankedEntry> ranked = new ArrayList<>(candidates.size());
        for (Candidate c : candidates.values()) {
            double finalScore = c.score() + c.qualitySignal() * properties.getRatingWeight();
            ranked.add(new RankedEntry(c.entityId(), finalScore, chooseReason(c)));
        }
        ranked.sort(Comparator.comparingDouble(RankedEntry::finalScore).reversed());
        return ranked;
    }

    /**
     * First structured reason; the embedding reason only when nothing else explains the match.
     */
    String chooseReason(Candidate candidate) {
        String marker = properties.getSimilarityReasonMarker();
        String fallback = null;
        for (String reason : candidate.reasons()) {
            if (!reason.contains(marker)) return reason;
            if (fallback == null) fallback = reason;
        }
        return fallback == null ? DEFAULT_REASON : fallback;
    }
}
