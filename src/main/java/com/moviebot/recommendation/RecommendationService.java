package com.moviebot.recommendation;

import com.moviebot.config.ExecutorConfig;
import com.moviebot.config.RecommendationProperties;
import com.moviebot.graph.GraphStore;
import com.moviebot.graph.LabelResolver;
import com.moviebot.recommendation.RecommendationModels.*;
import com.moviebot.repository.RecommendationJdbcRepository;
import com.moviebot.session.Session;
import com.moviebot.session.SessionManager;
import com.moviebot.session.SessionModels.Constraint;
import com.moviebot.session.SessionModels.ConstraintKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Candidate generation → aggregation → constraint filtering → ranking → diversity selection.
 */
@Service
public class RecommendationService {
    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    private final GraphCandidateSource graphSource;
    private final EmbeddingCandidateSource embeddingSource;
    private final CandidateAggregator aggregator;
    private final ConstraintFilter constraintFilter;
    private final Ranker ranker;
    private final DiversitySelector diversitySelector;
    private final LabelResolver labelResolver;
    private final GraphStore graphStore;
    private final SessionManager sessionManager;
    private final RecommendationJdbcRepository repository;
    private final RecommendationProperties properties;
    private final ExecutorService sourceExecutor;

    public RecommendationService(GraphCandidateSource graphSource,
                                 EmbeddingCandidateSource embeddingSource,
                                 CandidateAggregator aggregator,
                                 ConstraintFilter constraintFilter,
                                 Ranker ranker,
                                 DiversitySelector diversitySelector,
                                 LabelResolver labelResolver,
                                 GraphStore graphStore,
                                 SessionManager sessionManager,
                                 RecommendationJdbcRepository repository,
                                 RecommendationProperties properties,
                                 @Qualifier(ExecutorConfig.SOURCE_EXECUTOR) ExecutorService sourceExecutor) {
        this.graphSource = graphSource;
        this.embeddingSource = embeddingSource;
        this.aggregator = aggregator;
        this.constraintFilter = constraintFilter;
        this.ranker = ranker;
        this.diversitySelector = diversitySelector;
        this.labelResolver = labelResolver;
        this.graphStore = graphStore;
        this.sessionManager = sessionManager;
        this.repository = repository;
        this.properties = properties;
        this.sourceExecutor = sourceExecutor;
    }

    /**
     * Runs the pipeline for the user's current session and marks the returned movies as
     * recommended, all under the session lock.
     */
    public RecommendationResult recommend(String userId, int k) {
        return sessionManager.withSession(userId, session -> recommend(session, k));
    }

    /**
     * Same as {@link #recommend(String, int)} for a session the caller already holds.
     */
    public RecommendationResult recommend(Session session, int k) {
        RecommendationResult result = getRecommendations(session, k);
        List<String> ids = result.recommendations().stream().map(Recommendation::id).toList();
        if (!ids.isEmpty()) {
            session.addRecommendations(ids);
            logRecommendations(session.userId(), result.recommendations());
        }
        return result;
    }

    /**
     * Read-only with respect to the session.
     */
    public RecommendationResult getRecommendations(Session session, int k) {
        if (k <= 0) throw new IllegalArgumentException("k must be positive");
        if (!session.hasInput()) {
            log.info("Session {} has neither seeds nor preferences", session.userId());
            return RecommendationResult.noInput();
        }

        Set<String> exclude = session.excludeList();
        Set<String> seeds = Set.copyOf(session.seedEntities());
        Map<String, String> preferences = Map.copyOf(session.preferences());
        Map<ConstraintKind, Constraint> constraints = Map.copyOf(session.constraints());
        Map<String, String> negations = Map.copyOf(session.negations());
        List<DegradationNote> notes = new ArrayList<>();

        // 1. generation: graph on the source pool, embeddings on this thread
        CompletableFuture<List<StageOutcome<Map<String, Candidate>>>> graphFuture = CompletableFuture.supplyAsync(() -> List.of(
                graphSource.fromSeeds(seeds, exclude, constraints, negations),
                graphSource.fromPreferences(preferences, exclude, constraints, negations)), sourceExecutor);
        StageOutcome<Map<String, Candidate>> embedded = embeddingSource.fromSeeds(seeds, exclude);

        Map<String, Candidate> merged = new LinkedHashMap<>();
        try {
            List<StageOutcome<Map<String, Candidate>>> graph = graphFuture.join();
            aggregator.merge(merged, graph.get(0).value(), CandidateSourceKind.GRAPH_SEED);
            notes.addAll(graph.get(0).notes());
            aggregator.merge(merged, embedded.value(), CandidateSourceKind.EMBEDDING_SEED);
            aggregator.merge(merged, graph.get(1).value(), CandidateSourceKind.GRAPH_PREFERENCE);
            notes.addAll(graph.get(1).notes());
        } catch (CompletionException | CancellationException e) {
            log.warn("Graph candidate generation failed: {}", e.getMessage());
            notes.add(new DegradationNote(Degradation.SOURCE_UNAVAILABLE, "graph"));
            aggregator.merge(merged, embedded.value(), CandidateSourceKind.EMBEDDING_SEED);
        }
        notes.addAll(embedded.notes());
        log.info("Session {}: generated {} raw candidates", session.userId(), merged.size());

        // 2. filtering
        StageOutcome<Map<String, Candidate>> filtered = constraintFilter.filter(merged, constraints, negations);
        notes.addAll(filtered.notes());

        // 3. ranking, 4. diversification
        List<RankedEntry> ranked = ranker.rank(filtered.value());
        StageOutcome<List<RankedEntry>> diversified = diversitySelector.select(ranked, k);
        notes.addAll(diversified.notes());

        List<Recommendation> recommendations = format(diversified.value());
        log.info("Session {}: {} candidates after filtering, returning {} recommendations",
                session.userId(), filtered.value().size(), recommendations.size());

        RecommendationStatus status = recommendations.isEmpty() ? RecommendationStatus.NOTHING_FOUND : RecommendationStatus.OK;
        return new RecommendationResult(status, recommendations, List.copyOf(notes));
    }

    private List<Recommendation> format(List<RankedEntry> entries) {
        List<Recommendation> out = new ArrayList<>(entries.size());
        for (RankedEntry entry : entries) {
            try {
                Optional<String> label = labelResolver.labelOf(entry.entityId());
                if (label.isEmpty()) {
                    log.warn("No label for {}, dropped from output", entry.entityId());
                    continue;
                }
                String image = graphStore.imageOf(entry.entityId()).orElse(null);
                out.add(new Recommendation(entry.entityId(), label.get(), entry.finalScore(), entry.reason(), image));
            } catch (RuntimeException e) {
                log.warn("Could not resolve {} for output: {}", entry.entityId(), e.getMessage());
            }
        }
        return out;
    }

    private void logRecommendations(String userId, List<Recommendation> recommendations) {
        try {
            recommendations.forEach(r -> repository.saveRecommendationLog(userId, r.id(), r.score(), r.reason()));
        } catch (RuntimeException e) {
            log.warn("Recommendation log write failed for {}: {}", userId, e.getMessage());
        }
    }

    public int defaultResultSize() {
        return properties.getDefaultResultSize();
    }
}
