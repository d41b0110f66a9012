package com.example.filesearch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class BruteForceAnnIndexTest {

    @TempDir
    Path tempDir;

    @Test
    public void returnsExactNearestInDistanceOrder() {
        BruteForceAnnIndex svc = new BruteForceAnnIndex(3);
        svc.add(1, new float[]{1f, 0f, 0f});
        svc.add(2, new float[]{0f, 1f, 0f});
        svc.add(3, new float[]{0.9f, 0.1f, 0f});

        List<AnnIndex.Neighbor> res = svc.query(new float[]{1f, 0f, 0f}, 2);
        assertThat(res).extracting(AnnIndex.Neighbor::id).containsExactly(1L, 3L);
        assertThat(res.get(0).distance()).isZero();
    }

    @Test
    public void zeroVectorsAreSearchable() {
        BruteForceAnnIndex svc = new BruteForceAnnIndex(2);
        svc.add(1, new float[]{0f, 0f});

        assertThat(svc.query(new float[]{0f, 0f}, 1)).extracting(AnnIndex.Neighbor::id).containsExactly(1L);
    }

    @Test
    public void persistAndLoad() throws Exception {
        BruteForceAnnIndex svc = new BruteForceAnnIndex(2);
        svc.add(4, new float[]{0.5f, 0.5f});
        Path file = tempDir.resolve("bf.dat");
        svc.persistTo(file);

        BruteForceAnnIndex loaded = new BruteForceAnnIndex(2);
        loaded.loadFrom(file);

        assertThat(loaded.size()).isEqualTo(1);
        assertThat(loaded.vector(4)).hasValueSatisfying(v -> assertThat(v).containsExactly(0.5f, 0.5f));
    }
}
