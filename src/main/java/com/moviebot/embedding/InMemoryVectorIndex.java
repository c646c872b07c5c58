package com.moviebot.embedding;

import com.moviebot.repository.EmbeddingJdbcRepository;
import com.moviebot.repository.EmbeddingJdbcRepository.EmbeddingRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Brute-force cosine index over all entity embeddings, loaded once on first use and read-only
 * afterwards.
 */
@Component
public class InMemoryVectorIndex implements VectorIndex {
    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorIndex.class);
    private static final double EPS = 1e-12;

    private final EmbeddingJdbcRepository repository;
    private volatile Map<String, float[]> vectors;

    public InMemoryVectorIndex(EmbeddingJdbcRepository repository) {
        this.repository = repository;
    }

    @Override
    public List<Neighbour> nearestNeighbors(String entityId, int k) {
        Map<String, float[]> all = vectors();
        float[] query = all.get(entityId);
        if (query == null || k <= 0) return List.of();

        PriorityQueue<Neighbour> top = new PriorityQueue<>(Comparator.comparingDouble(Neighbour::similarity));
        for (var e : all.entrySet()) {
            if (e.getKey().equals(entityId)) continue;
            top.add(new Neighbour(e.getKey(), dot(query, e.getValue())));
            if (top.size() > k) top.poll();
        }
        List<Neighbour> result = new ArrayList<>(top);
        result.sort(Comparator.comparingDouble(Neighbour::similarity).reversed().thenComparing(Neighbour::entityId));
        return result;
    }

    @Override
    public Optional<float[]> embeddingOf(String entityId) {
        return Optional.ofNullable(vectors().get(entityId)).map(float[]::clone);
    }

    @Override
    public double cosineSimilarity(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector dimensions differ: " + a.length + " vs " + b.length);
        }
        double na = Math.sqrt(dot(a, a));
        double nb = Math.sqrt(dot(b, b));
        if (na < EPS || nb < EPS) return 0.0;
        return dot(a, b) / (na * nb);
    }

    public int size() {
        return vectors().size();
    }

    private Map<String, float[]> vectors() {
        Map<String, float[]> loaded = vectors;
        if (loaded == null) {
            synchronized (this) {
                loaded = vectors;
                if (loaded == null) {
                    loaded = load();
                    vectors = loaded;
                }
            }
        }
        return loaded;
    }

    private Map<String, float[]> load() {
        Map<String, float[]> result = new HashMap<>();
        int dimension = -1;
        for (EmbeddingRow row : repository.loadEntityEmbeddings()) {
            float[] v = parse(row);
            if (v == null) continue;
            if (dimension < 0) {
                dimension = v.length;
            } else if (v.length != dimension) {
                log.warn("Skipping embedding of {}: dimension {} instead of {}", row.entityId(), v.length, dimension);
                continue;
            }
            result.put(row.entityId(), normalize(v));
        }
        log.info("Entity embeddings loaded and normalised: {} vectors, dimension {}", result.size(), Math.max(dimension, 0));
        return Map.copyOf(result);
    }

    private float[] parse(EmbeddingRow row) {
        if (row.vector() == null || row.vector().isBlank()) return null;
        String[] parts = row.vector().split(",");
        float[] v = new float[parts.length];
        try {
            for (int i = 0; i < parts.length; i++) {
                v[i] = Float.parseFloat(parts[i].trim());
            }
        } catch (NumberFormatException e) {
            log.warn("Skipping malformed embedding of {}: {}", row.entityId(), e.getMessage());
            return null;
        }
        return v;
    }

    private static float[] normalize(float[] v) {
        double norm = Math.max(Math.sqrt(dot(v, v)), EPS);
        float[] out = new float[v.length];
        for (int i = 0; i < v.length; i++) {
            out[i] = (float) (v[i] / norm);
        }
        return out;
    }

    private static double dot(float[] a, float[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }
}
