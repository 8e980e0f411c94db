package com.rerag.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class HashingEmbeddingService implements EmbeddingService {
    private static final float BIGRAM_WEIGHT = 0.5f;

    private final int dimension;

    public HashingEmbeddingService(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive, got " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimension];
        List<String> words = words(text);
        for (int i = 0; i < words.size(); i++) {
            accumulate(vector, words.get(i), 1f);
            if (i > 0) {
                accumulate(vector, words.get(i - 1) + ' ' + words.get(i), BIGRAM_WEIGHT);
            }
        }
        normalise(vector);
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return "hashing-" + dimension + "-v1";
    }

    private void accumulate(float[] vector, String feature, float weight) {
        int hash = feature.hashCode();
        vector[Math.floorMod(hash, dimension)] += (hash >>> 31) == 0 ? weight : -weight;
    }

    private static List<String> words(String text) {
        List<String> words = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return words;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("\\W+")) {
            if (!token.isEmpty()) {
                words.add(token);
            }
        }
        return words;
    }

    private static void normalise(float[] vector) {
        double sumOfSquares = 0;
        for (float v : vector) {
            sumOfSquares += (double) v * v;
        }
        if (sumOfSquares == 0) {
            return;
        }
        float norm = (float) Math.sqrt(sumOfSquares);
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
    }
}
