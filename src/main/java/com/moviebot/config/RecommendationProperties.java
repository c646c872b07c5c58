package com.moviebot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tuning knobs of the recommendation pipeline, bound from {@code movies.recommendation.*}.
 *
 * Defaults below are the production values; tests construct the bean directly and override
 * individual fields through the setters.
 */
@Component
@ConfigurationProperties(prefix = "movies.recommendation")
public class RecommendationProperties {

    /**
     * Shared-property categories queried for seed movies. Adding a category is a configuration
     * change only.
     */
    private List<SharedProperty> sharedProperties = new ArrayList<>(List.of(
            new SharedProperty("wdt:P136", 1.0, "shares the genre"),
            new SharedProperty("wdt:P57", 0.8, "has the same director"),
            new SharedProperty("wdt:P161", 0.5, "shares an actor"),
            new SharedProperty("wdt:P179", 0.9, "is in the same series as"),
            new SharedProperty("wdt:P4969", 0.7, "is based on similar work as")
    ));

    /**
     * Preference kind (as produced by the intent parser) to graph predicate.
     */
    private Map<String, String> preferencePredicates = new LinkedHashMap<>(Map.of(
            "genre", "wdt:P136",
            "director", "wdt:P57",
            "actor", "wdt:P161",
            "screenwriter", "wdt:P58",
            "composer", "wdt:P86",
            "producer", "wdt:P162",
            "country", "wdt:P495",
            "language", "wdt:P407",
            "part of series", "wdt:P179",
            "based on", "wdt:P4969"
    ));

    private SourceWeights sourceWeights = new SourceWeights();

    private double preferenceMatchScore = 2.0;
    private double ratingWeight = 0.02;
    private int neighbourCount = 20;
    private int graphQueryLimit = 20;
    private int filterCap = 200;
    private double mmrLambda = 0.7;
    private int defaultResultSize = 5;
    private long externalCallTimeoutMs = 2000;
    private int executorThreads = 4;
    private String movieTypeId = "Q11424";
    private String similarityReasonMarker = "similar to";

    public List<SharedProperty> getSharedProperties() {
        return sharedProperties;
    }

    public void setSharedProperties(List<SharedProperty> sharedProperties) {
        this.sharedProperties = sharedProperties;
    }

    public Map<String, String> getPreferencePredicates() {
        return preferencePredicates;
    }

    public void setPreferencePredicates(Map<String, String> preferencePredicates) {
        this.preferencePredicates = preferencePredicates;
    }

    public SourceWeights getSourceWeights() {
        return sourceWeights;
    }

    public void setSourceWeights(SourceWeights sourceWeights) {
        this.sourceWeights = sourceWeights;
    }

    public double getPreferenceMatchScore() {
        return preferenceMatchScore;
    }

    public void setPreferenceMatchScore(double preferenceMatchScore) {
        this.preferenceMatchScore = preferenceMatchScore;
    }

    public double getRatingWeight() {
        return ratingWeight;
    }

    public void setRatingWeight(double ratingWeight) {
        this.ratingWeight = ratingWeight;
    }

    public int getNeighbourCount() {
        return neighbourCount;
    }

    public void setNeighbourCount(int neighbourCount) {
        this.neighbourCount = neighbourCount;
    }

    public int getGraphQueryLimit() {
        return graphQueryLimit;
    }

    public void setGraphQueryLimit(int graphQueryLimit) {
        this.graphQueryLimit = graphQueryLimit;
    }

    public int getFilterCap() {
        return filterCap;
    }

    public void setFilterCap(int filterCap) {
        this.filterCap = filterCap;
    }

    public double getMmrLambda() {
        return mmrLambda;
    }

    public void setMmrLambda(double mmrLambda) {
        this.mmrLambda = mmrLambda;
    }

    public int getDefaultResultSize() {
        return defaultResultSize;
    }

    public void setDefaultResultSize(int defaultResultSize) {
        this.defaultResultSize = defaultResultSize;
    }

    public long getExternalCallTimeoutMs() {
        return externalCallTimeoutMs;
    }

    public void setExternalCallTimeoutMs(long externalCallTimeoutMs) {
        this.externalCallTimeoutMs = externalCallTimeoutMs;
    }

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public String getMovieTypeId() {
        return movieTypeId;
    }

    public void setMovieTypeId(String movieTypeId) {
        this.movieTypeId = movieTypeId;
    }

    public String getSimilarityReasonMarker() {
        return similarityReasonMarker;
    }

    public void setSimilarityReasonMarker(String similarityReasonMarker) {
        this.similarityReasonMarker = similarityReasonMarker;
    }

    /**
     * One row of the shared-property table: graph predicate, score added per match and the
     * reason prefix shown to the user.
     */
    public static class SharedProperty {
        private String predicate;
        private double weight;
        private String reason;

        public SharedProperty() {
        }

        public SharedProperty(String predicate, double weight, String reason) {
            this.predicate = predicate;
            this.weight = weight;
            this.reason = reason;
        }

        public String getPredicate() {
            return predicate;
        }

        public void setPredicate(String predicate) {
            this.predicate = predicate;
        }

        public double getWeight() {
            return weight;
        }

        public void setWeight(double weight) {
            this.weight = weight;
        }

        public String getReason() {
            return reason;
        }

        public void setReason(String reason) {
            this.reason = reason;
        }
    }

    /**
     * Trust weight per candidate source. Must keep preference > graph seed > embedding seed.
     */
    public static class SourceWeights {
        private double graphPreference = 2.0;
        private double graphSeed = 1.0;
        private double embeddingSeed = 0.1;

        public double getGraphPreference() {
            return graphPreference;
        }

        public void setGraphPreference(double graphPreference) {
            this.graphPreference = graphPreference;
        }

        public double getGraphSeed() {
            return graphSeed;
        }

        public void setGraphSeed(double graphSeed) {
            this.graphSeed = graphSeed;
        }

        public double getEmbeddingSeed() {
            return embeddingSeed;
        }

        public void setEmbeddingSeed(double embeddingSeed) {
            this.embeddingSeed = embeddingSeed;
        }
    }
}
