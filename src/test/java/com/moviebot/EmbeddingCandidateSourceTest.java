package com.moviebot;

import com.moviebot.config.RecommendationProperties;
import com.moviebot.embedding.VectorIndex.Neighbour;
import com.moviebot.recommendation.Candidate;
import com.moviebot.recommendation.EmbeddingCandidateSource;
import com.moviebot.recommendation.RecommendationModels.Degradation;
import com.moviebot.recommendation.RecommendationModels.StageOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddingCandidateSourceTest {
    private Fakes.VectorIndexStub index;
    private EmbeddingCandidateSource source;

    @BeforeEach
    void setUp() {
        RecommendationProperties properties = new RecommendationProperties();
        index = new Fakes.VectorIndexStub();
        source = new EmbeddingCandidateSource(index, Fakes.externalCalls(properties), properties);
    }

    @Test
    void similaritiesAddUpAcrossSeeds() {
        index.neighbours("M1", new Neighbour("M3", 0.6), new Neighbour("M4", 0.5))
             .neighbours("M2", new Neighbour("M3", 0.3));

        StageOutcome<Map<String, Candidate>> out = source.fromSeeds(Set.of("M1", "M2"), Set.of("M1", "M2"));

        assertEquals(0.9, out.value().get("M3").score(), 1e-9);
        assertEquals(0.5, out.value().get("M4").score(), 1e-9);
        assertEquals(Set.of(EmbeddingCandidateSource.SIMILARITY_REASON), out.value().get("M3").reasons());
        assertFalse(out.isDegraded());
    }

    @Test
    void excludedAndSeedNeighboursAreDropped() {
        index.neighbours("M1", new Neighbour("M2", 0.9), new Neighbour("M5", 0.8), new Neighbour("M6", 0.7));

        StageOutcome<Map<String, Candidate>> out = source.fromSeeds(Set.of("M1", "M2"), Set.of("M1", "M5"));

        assertEquals(Set.of("M6"), out.value().keySet());
    }

    @Test
    void seedWithoutEmbeddingContributesNothing() {
        index.neighbours("M1", new Neighbour("M3", 0.6));

        StageOutcome<Map<String, Candidate>> out = source.fromSeeds(Set.of("M1", "M8"), Set.of());

        assertEquals(Set.of("M3"), out.value().keySet());
        assertFalse(out.isDegraded());
    }

    @Test
    void failingLookupIsSkippedAndNoted() {
        index.neighbours("M1", new Neighbour("M3", 0.6)).neighbours("M2", new Neighbour("M4", 0.4));
        index.failing.add("M2");

        StageOutcome<Map<String, Candidate>> out = source.fromSeeds(Set.of("M1", "M2"), Set.of());

        assertEquals(Set.of("M3"), out.value().keySet());
        assertEquals(Degradation.SOURCE_UNAVAILABLE, out.notes().get(0).kind());
    }
}
