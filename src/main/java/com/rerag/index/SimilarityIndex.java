package com.rerag.index;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

public interface SimilarityIndex {

    void insert(String id, float[] embedding);

    void replace(String id, float[] embedding);

    boolean remove(String id);

    List<Neighbor> knn(float[] query, int k);

    boolean contains(String id);

    Optional<float[]> vector(String id);

    int size();

    OptionalInt dimension();

    DistanceMetric metric();
}
