package com.moviebot.session;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class SessionModels {

    /**
     * Output of the intent parser for one user message. Preference and negation keys are
     * preference kinds ("genre", "director", ...), values are entity ids.
     */
    public record ParsedIntent(IntentType intent,
                               Set<String> seedEntities,
                               Map<String, String> preferences,
                               Map<ConstraintKind, Constraint> constraints,
                               Map<String, String> negations,
                               boolean followUp) {
        public ParsedIntent {
            intent = intent == null ? IntentType.RECOMMENDATION : intent;
            seedEntities = seedEntities == null ? Set.of() : Set.copyOf(seedEntities);
            preferences = preferences == null ? Map.of() : Map.copyOf(preferences);
            constraints = constraints == null ? Map.of() : Map.copyOf(constraints);
            negations = negations == null ? Map.of() : Map.copyOf(negations);
        }

        public static ParsedIntent seeds(String... ids) {
            return new ParsedIntent(IntentType.RECOMMENDATION, Set.of(ids), Map.of(), Map.of(), Map.of(), false);
        }

        public static ParsedIntent followUpRequest() {
            return new ParsedIntent(IntentType.RECOMMENDATION, Set.of(), Map.of(), Map.of(), Map.of(), true);
        }
    }

    public enum IntentType { RECOMMENDATION, OTHER }

    public enum ConstraintKind { YEAR, YEAR_RANGE, LANGUAGE, MIN_RATING }

    /**
     * Typed constraint value. Which fields are set depends on {@link #kind()}:
     * YEAR uses operator and lower, YEAR_RANGE lower and upper (inclusive), LANGUAGE entityId,
     * MIN_RATING lower (inclusive).
     */
    public record Constraint(ConstraintKind kind, String operator, Double lower, Double upper, String entityId) {
        private static final Set<String> OPERATORS = Set.of("<", "<=", "=", ">=", ">");

        public Constraint {
            if (kind == null) throw new IllegalArgumentException("Constraint kind is required");
            switch (kind) {
                case YEAR -> {
                    if (operator == null || !OPERATORS.contains(operator) || lower == null) {
                        throw new IllegalArgumentException("Year constraint needs an operator and a year");
                    }
                }
                case YEAR_RANGE -> {
                    if (lower == null || upper == null || lower > upper) {
                        throw new IllegalArgumentException("Year range needs start <= end");
                    }
                }
                case LANGUAGE -> {
                    if (entityId == null || entityId.isBlank()) {
                        throw new IllegalArgumentException("Language constraint needs an entity id");
                    }
                }
                case MIN_RATING -> {
                    if (lower == null) throw new IllegalArgumentException("Rating constraint needs a threshold");
                }
            }
        }

        public static Constraint year(String operator, int year) {
            return new Constraint(ConstraintKind.YEAR, operator, (double) year, null, null);
        }

        public static Constraint yearRange(int start, int end) {
            return new Constraint(ConstraintKind.YEAR_RANGE, null, (double) start, (double) end, null);
        }

        public static Constraint language(String languageId) {
            return new Constraint(ConstraintKind.LANGUAGE, null, null, null, languageId);
        }

        public static Constraint minRating(double threshold) {
            return new Constraint(ConstraintKind.MIN_RATING, null, threshold, null, null);
        }
    }

    public record Turn(String userMessage, String botResponse, Instant ts) {}

    public record SessionSnapshot(String userId,
                                  Set<String> seedEntities,
                                  Map<String, String> preferences,
                                  Map<ConstraintKind, Constraint> constraints,
                                  Map<String, String> negations,
                                  Set<String> recommendedEntities,
                                  List<Turn> history) {}
}
