package com.example.filesearch;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class HashingEmbeddingProviderTest {

    private final HashingEmbeddingProvider provider = new HashingEmbeddingProvider(64);

    @Test
    public void deterministicAndNormalized() {
        float[] a = provider.embed("Office of State Fire Marshal");
        float[] b = provider.embed("office of state fire marshal");

        assertThat(a).hasSize(64).containsExactly(b);
        double norm = 0;
        for (float v : a) norm += v * v;
        assertThat(norm).isCloseTo(1.0, org.assertj.core.data.Offset.offset(1e-5));
    }

    @Test
    public void blankTextGivesZeroVectorOfFixedDimension() {
        assertThat(provider.embed("  ")).hasSize(64).containsOnly(0f);
        assertThat(provider.embed(null)).hasSize(64);
    }
}
