package com.example.filesearch;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Exact search over an in-memory map. Used for small stores and as the reference the HNSW graph is tested against.
 */
public class BruteForceAnnIndex implements AnnIndex {

    private final int dimension;
    private final Map<Long, float[]> store = new HashMap<>();

    public BruteForceAnnIndex(int dimension) {
        if (dimension < 1) throw new IllegalArgumentException("Dimension must be a positive integer");
        this.dimension = dimension;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public void add(long id, float[] vector) {
        store.put(id, Arrays.copyOf(vector, vector.length));
    }

    @Override
    public boolean remove(long id) {
        return store.remove(id) != null;
    }

    @Override
    public Optional<float[]> vector(long id) {
        float[] v = store.get(id);
        return v == null ? Optional.empty() : Optional.of(Arrays.copyOf(v, v.length));
    }

    @Override
    public List<Neighbor> query(float[] q, int topK) {
        if (topK <= 0) return List.of();
        return store.entrySet().stream()
                .map(e -> new Neighbor(e.getKey(), euclidean(q, e.getValue())))
                .sorted(Comparator.comparingDouble(Neighbor::distance).thenComparingLong(Neighbor::id))
                .limit(topK)
                .collect(Collectors.toList());
    }

    @Override
    public int size() {
        return store.size();
    }

    private static float euclidean(float[] a, float[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return (float) Math.sqrt(sum);
    }

    @Override
    public void persistTo(Path file) throws IOException {
        try (OutputStream os = Files.newOutputStream(file);
             ObjectOutputStream oos = new ObjectOutputStream(new BufferedOutputStream(os))) {
            oos.writeInt(dimension);
            oos.writeObject(new HashMap<>(store));
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public void loadFrom(Path file) throws IOException {
        try (InputStream is = Files.newInputStream(file);
             ObjectInputStream ois = new ObjectInputStream(new BufferedInputStream(is))) {
            int dim = ois.readInt();
            if (dim != dimension) {
                throw new IndexCorruptionException("ANN snapshot " + file + " has dimension " + dim
                        + " but the index is configured for " + dimension);
            }
            Map<Long, float[]> persisted = (Map<Long, float[]>) ois.readObject();
            store.clear();
            store.putAll(persisted);
        } catch (ClassNotFoundException | ClassCastException e) {
            throw new IOException("Unreadable ANN snapshot " + file, e);
        }
    }
}
