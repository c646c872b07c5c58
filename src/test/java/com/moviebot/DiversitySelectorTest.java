package com.moviebot;

import com.moviebot.config.RecommendationProperties;
import com.moviebot.recommendation.DiversitySelector;
import com.moviebot.recommendation.RecommendationModels.Degradation;
import com.moviebot.recommendation.RecommendationModels.RankedEntry;
import com.moviebot.recommendation.RecommendationModels.StageOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiversitySelectorTest {
    private Fakes.VectorIndexStub index;
    private DiversitySelector selector;

    @BeforeEach
    void setUp() {
        index = new Fakes.VectorIndexStub()
                .vector("A", 1f, 0f)
                .vector("B", 0.99f, 0.01f)
                .vector("C", 0f, 1f)
                .vector("D", 0.7f, 0.7f);
        selector = new DiversitySelector(index, new RecommendationProperties());
    }

    private static List<RankedEntry> ranked() {
        return List.of(
                new RankedEntry("A", 1.0, "a"),
                new RankedEntry("B", 0.95, "b"),
                new RankedEntry("C", 0.9, "c"),
                new RankedEntry("D", 0.5, "d"));
    }

    private static List<String> ids(List<RankedEntry> entries) {
        return entries.stream().map(RankedEntry::entityId).toList();
    }

    @Test
    void returnsInputUnchangedWhenNotLongerThanK() {
        List<RankedEntry> input = ranked().subList(0, 3);

        StageOutcome<List<RankedEntry>> out = selector.select(input, 3);

        assertEquals(input, out.value());
        assertFalse(out.isDegraded());
    }

    @Test
    void skipsNearDuplicateOfTopEntry() {
        StageOutcome<List<RankedEntry>> out = selector.select(ranked(), 2);

        assertEquals(List.of("A", "C"), ids(out.value()));
    }

    @Test
    void selectionIsASubsetOfAtMostK() {
        for (int k = 1; k <= 3; k++) {
            List<RankedEntry> out = selector.select(ranked(), k).value();
            assertTrue(out.size() <= k);
            assertTrue(new HashSet<>(ranked()).containsAll(out));
            assertEquals("A", out.get(0).entityId());
        }
    }

    @Test
    void entriesWithoutEmbeddingsAreOnlySelectableFirst() {
        List<RankedEntry> input = List.of(
                new RankedEntry("X", 2.0, "x"),
                new RankedEntry("Y", 1.5, "y"),
                new RankedEntry("C", 1.0, "c"));

        List<RankedEntry> out = selector.select(input, 2).value();

        assertEquals(List.of("X", "C"), ids(out));
    }

    @Test
    void fallsBackToPlainTopKWhenSimilarityFails() {
        index.failSimilarity = true;

        StageOutcome<List<RankedEntry>> out = selector.select(ranked(), 3);

        assertEquals(List.of("A", "B", "C"), ids(out.value()));
        assertTrue(out.isDegraded());
        assertEquals(Degradation.DIVERSIFICATION_FAILED, out.notes().get(0).kind());
    }
}
