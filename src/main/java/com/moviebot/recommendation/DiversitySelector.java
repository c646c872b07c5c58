package com.moviebot.recommendation;

import com.moviebot.config.RecommendationProperties;
import com.moviebot.embedding.VectorIndex;
import com.moviebot.recommendation.RecommendationModels.Degradation;
import com.moviebot.recommendation.RecommendationModels.RankedEntry;
import com.moviebot.recommendation.RecommendationModels.StageOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Maximal Marginal Relevance re-ordering of the ranked list.
 *
 * <p>The top-ranked entry always opens the selection. After that only entries with an embedding
 * can be picked, so the result may hold fewer than {@code k} entries when embeddings are
 * missing. Any failure falls back to the plain top-{@code k} of the ranked list.</p>
 */
@Component
public class DiversitySelector {
    private static final Logger log = LoggerFactory.getLogger(DiversitySelector.class);

    private final VectorIndex vectorIndex;
    private final RecommendationProperties properties;

    public DiversitySelector(VectorIndex vectorIndex, RecommendationProperties properties) {
        this.vectorIndex = vectorIndex;
        this.properties = properties;
    }

    public StageOutcome<List<RankedEntry>> select(List<RankedEntry> ranked, int k) {
        if (ranked.size() <= k) return StageOutcome.ok(ranked);
        try {
            return StageOutcome.ok(mmr(ranked, k, properties.getMmrLambda()));
        } catch (RuntimeException e) {
            log.warn("MMR diversification failed, returning plain top {}: {}", k, e.toString());
            return StageOutcome.degraded(List.copyOf(ranked.subList(0, k)), Degradation.DIVERSIFICATION_FAILED, e.toString());
        }
    }

    private List<RankedEntry> mmr(List<RankedEntry> ranked, int k, double lambda) {
        if (k <= 0) return List.of();

        double maxScore = ranked.stream().mapToDouble(RankedEntry::finalScore).max().orElse(0.0);
        double scale = maxScore > 0 ? maxScore : 1.0;

        Map<String, float[]> embeddings = new HashMap<>();
        for (RankedEntry entry : ranked) {
            vectorIndex.embeddingOf(entry.entityId()).ifPresent(v -> embeddings.put(entry.entityId(), v));
        }

        List<RankedEntry> selected = new ArrayList<>(k);
        List<float[]> selectedVectors = new ArrayList<>(k);
        selected.add(ranked.get(0));
        Optional.ofNullable(embeddings.get(ranked.get(0).entityId())).ifPresent(selectedVectors::add);

        List<RankedEntry> pool = new ArrayList<>();
        for (RankedEntry entry : ranked.subList(1, ranked.size())) {
            if (embeddings.containsKey(entry.entityId())) pool.add(entry);
        }

        while (selected.size() < k && !pool.isEmpty()) {
            RankedEntry best = null;
            float[] bestVector = null;
            double bestMmr = Double.NEGATIVE_INFINITY;

            for (RankedEntry candidate : pool) {
                float[] v = embeddings.get(candidate.entityId());
                double relevance = candidate.finalScore() / scale;
                double maxSim = 0.0;
                for (float[] chosen : selectedVectors) {
                    maxSim = Math.max(maxSim, vectorIndex.cosineSimilarity(v, chosen));
                }
                double mmr = lambda * relevance - (1 - lambda) * maxSim;
                if (mmr > bestMmr) {
                    bestMmr = mmr;
                    best = candidate;
                    bestVector = v;
                }
            }
            if (best == null) break;
            selected.add(best);
            selectedVectors.add(bestVector);
            pool.remove(best);
        }

        if (selected.size() < k) {
            log.debug("MMR selected {} of {} requested, remaining entries lack embeddings", selected.size(), k);
        }
        return selected;
    }
}
