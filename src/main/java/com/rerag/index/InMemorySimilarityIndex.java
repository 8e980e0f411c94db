package com.rerag.index;

import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

public class InMemorySimilarityIndex implements SimilarityIndex {
    private static final Comparator<Neighbor> NEAREST_FIRST = Comparator
            .comparingDouble(Neighbor::distance)
            .thenComparing(Neighbor::id);

    private final Map<String, float[]> vectors = new HashMap<>();
    private final DistanceMetric metric;
    private int dimension = -1;

    public InMemorySimilarityIndex() {
        this(DistanceMetric.COSINE);
    }

    public InMemorySimilarityIndex(DistanceMetric metric) {
        this.metric = Objects.requireNonNull(metric, "metric");
    }

    @Override
    public void insert(String id, float[] embedding) {
        Objects.requireNonNull(id, "id");
        checkDimension(embedding);
        if (vectors.containsKey(id)) {
            throw new IllegalStateException("Vector already indexed for id " + id);
        }
        store(id, embedding);
    }

    @Override
    public void replace(String id, float[] embedding) {
        Objects.requireNonNull(id, "id");
        checkDimension(embedding);
        remove(id);
        store(id, embedding);
    }

    @Override
    public boolean remove(String id) {
        boolean removed = vectors.remove(id) != null;
        if (vectors.isEmpty()) {
            dimension = -1;
        }
        return removed;
    }

    @Override
    public List<Neighbor> knn(float[] query, int k) {
        Objects.requireNonNull(query, "query");
        if (k <= 0 || vectors.isEmpty()) {
            return List.of();
        }
        if (query.length != dimension) {
            throw new DimensionMismatchException(dimension, query.length);
        }
        return vectors.entrySet().stream()
                .map(entry -> new Neighbor(entry.getKey(), metric.distance(query, entry.getValue())))
                .sorted(NEAREST_FIRST)
                .limit(k)
                .toList();
    }

    @Override
    public boolean contains(String id) {
        return vectors.containsKey(id);
    }

    @Override
    public Optional<float[]> vector(String id) {
        float[] stored = vectors.get(id);
        return stored == null ? Optional.empty() : Optional.of(Arrays.copyOf(stored, stored.length));
    }

    @Override
    public int size() {
        return vectors.size();
    }

    @Override
    public OptionalInt dimension() {
        return dimension < 0 ? OptionalInt.empty() : OptionalInt.of(dimension);
    }

    @Override
    public DistanceMetric metric() {
        return metric;
    }

    private void checkDimension(float[] embedding) {
        if (embedding == null || embedding.length == 0) {
            throw new IllegalArgumentException("Embedding must not be empty");
        }
        if (dimension >= 0 && embedding.length != dimension) {
            throw new DimensionMismatchException(dimension, embedding.length);
        }
    }

    private void store(String id, float[] embedding) {
        vectors.put(id, Arrays.copyOf(embedding, embedding.length));
        dimension = embedding.length;
    }
}
