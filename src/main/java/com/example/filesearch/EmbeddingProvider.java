package com.example.filesearch;

/**
 * Turns text into a fixed-length vector.
 * <p>
 * Implementations never throw on internal failure: they return a zero vector of {@link #dimension()}
 * so every successful extraction still yields a usable vector.
 */
public interface EmbeddingProvider {

    float[] embed(String text);

    int dimension();
}
