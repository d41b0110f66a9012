package com.example.filesearch;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Deterministic local provider: hashed bag of words, L2-normalized. Needs no model download,
 * so it is the default and what the tests run against.
 */
@Service
@ConditionalOnProperty(prefix = "embedding", name = "cli.enabled", havingValue = "false", matchIfMissing = true)
public class HashingEmbeddingProvider implements EmbeddingProvider {

    private final int dimension;

    public HashingEmbeddingProvider(@Value("${embedding.dimension:384}") int dimension) {
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("\\W+")) {
            if (token.isBlank()) continue;
            vector[Math.floorMod(token.hashCode(), dimension)] += 1f;
        }
        float norm = 0f;
        for (float v : vector) norm += v * v;
        norm = (float) Math.sqrt(norm);
        if (norm > 0f) {
            for (int i = 0; i < vector.length; i++) vector[i] /= norm;
        }
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }
}
