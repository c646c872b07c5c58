package com.moviebot.embedding;

import java.util.List;
import java.util.Optional;

/**
 * Nearest-neighbour access to entity embeddings. All vectors handed out are L2-normalised.
 */
public interface VectorIndex {

    /**
     * Up to {@code k} neighbours of {@code entityId}, most similar first, the entity itself
     * excluded. Empty when the entity has no embedding.
     */
    List<Neighbour> nearestNeighbors(String entityId, int k);

    Optional<float[]> embeddingOf(String entityId);

    double cosineSimilarity(float[] a, float[] b);

    record Neighbour(String entityId, double similarity) {}
}
