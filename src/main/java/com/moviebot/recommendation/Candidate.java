package com.moviebot.recommendation;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Accumulated evidence for one entity: score is summed, reasons are unioned in arrival order,
 * quality signal keeps the maximum seen.
 */
public class Candidate {
    private final String entityId;
    private double score;
    private final Set<String> reasons = new LinkedHashSet<>();
    private double qualitySignal;

    public Candidate(String entityId) {
        this.entityId = entityId;
    }

    public void addScore(double delta) {
        score += delta;
    }

    public void addReason(String reason) {
        reasons.add(reason);
    }

    public void addReasons(Collection<String> more) {
        reasons.addAll(more);
    }

    public void raiseQuality(double value) {
        qualitySignal = Math.max(qualitySignal, value);
    }

    public String entityId() {
        return entityId;
    }

    public double score() {
        return score;
    }

    public Set<String> reasons() {
        return Collections.unmodifiableSet(reasons);
    }

    public double qualitySignal() {
        return qualitySignal;
    }

    @Override
    public String toString() {
        return "Candidate{" + entityId + ", score=" + score + ", quality=" + qualitySignal + ", reasons=" + reasons + "}";
    }
}
