package com.example.filesearch;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Approximate nearest neighbour structure keyed by record id.
 * Implementations are not required to be safe under concurrent writes; {@link VectorIndex} serializes them.
 */
public interface AnnIndex {

    int dimension();

    /** Adds a vector. The caller guarantees {@code id} is not present. */
    void add(long id, float[] vector);

    /** @return true if the id was present and is gone now */
    boolean remove(long id);

    Optional<float[]> vector(long id);

    /** Nearest neighbours of {@code q}, closest first. */
    List<Neighbor> query(float[] q, int topK);

    int size();

    void persistTo(Path file) throws IOException;

    void loadFrom(Path file) throws IOException;

    record Neighbor(long id, float distance) {
    }
}
