package com.rerag.embedding;

public interface EmbeddingService {

    float[] embed(String text);

    int dimension();

    default String version() {
        return "unversioned";
    }
}
