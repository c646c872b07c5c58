package com.moviebot.recommendation;

import java.util.List;

public class RecommendationModels {

    public enum CandidateSourceKind { GRAPH_PREFERENCE, GRAPH_SEED, EMBEDDING_SEED }

    public enum RecommendationStatus {
        OK,
        /** Neither seeds nor preferences were given, nothing to search from. */
        NO_INPUT,
        /** The search ran but no candidate survived. */
        NOTHING_FOUND
    }

    public enum Degradation { SOURCE_UNAVAILABLE, FILTER_VERIFICATION_FAILED, DIVERSIFICATION_FAILED }

    public record DegradationNote(Degradation kind, String detail) {}

    public record RankedEntry(String entityId, double finalScore, String reason) {}

    public record Recommendation(String id, String label, double score, String reason, String imageId) {}

    public record RecommendationResult(RecommendationStatus status,
                                       List<Recommendation> recommendations,
                                       List<DegradationNote> degradations) {
        public static RecommendationResult noInput() {
            return new RecommendationResult(RecommendationStatus.NO_INPUT, List.of(), List.of());
        }

        public boolean degraded() {
            return !degradations.isEmpty();
        }
    }

    /**
     * Value produced by a pipeline stage plus the degradations it had to accept on the way.
     * A stage never signals a handled failure by throwing.
     */
    public record StageOutcome<T>(T value, List<DegradationNote> notes) {
        public StageOutcome {
            notes = List.copyOf(notes);
        }

        public static <T> StageOutcome<T> ok(T value) {
            return new StageOutcome<>(value, List.of());
        }

        public static <T> StageOutcome<T> degraded(T value, Degradation kind, String detail) {
            return new StageOutcome<>(value, List.of(new DegradationNote(kind, detail)));
        }

        public static <T> StageOutcome<T> of(T value, List<DegradationNote> notes) {
            return new StageOutcome<>(value, notes);
        }

        public boolean isDegraded() {
            return !notes.isEmpty();
        }
    }
}
