package com.example.filesearch;

import com.github.jelmerk.knn.DistanceFunctions;
import com.github.jelmerk.knn.Item;
import com.github.jelmerk.knn.SearchResult;
import com.github.jelmerk.knn.hnsw.HnswIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link AnnIndex} backed by a jelmerk HNSW graph using euclidean distance.
 * <p>
 * HNSW keeps a slot for every node ever added, removed ones included, so the graph is rebuilt
 * (compacted, and grown if needed) once the slots run out.
 */
public class HnswAnnIndex implements AnnIndex {

    private static final Logger log = LoggerFactory.getLogger(HnswAnnIndex.class);

    private final int dimension;
    private final int m;
    private final int efConstruction;
    private final int ef;
    private final int initialMaxItems;

    private HnswIndex<Long, float[], VectorItem, Float> index;
    private int slotsUsed;

    public HnswAnnIndex(int dimension, int m, int efConstruction, int ef, int maxItems) {
        if (dimension < 1) throw new IllegalArgumentException("Dimension must be a positive integer");
        this.dimension = dimension;
        this.m = m;
        this.efConstruction = efConstruction;
        this.ef = ef;
        this.initialMaxItems = Math.max(1, maxItems);
        this.index = newIndex(initialMaxItems);
    }

    private HnswIndex<Long, float[], VectorItem, Float> newIndex(int capacity) {
        return HnswIndex.newBuilder(dimension, DistanceFunctions.FLOAT_EUCLIDEAN_DISTANCE, capacity)
                .withM(m)
                .withEfConstruction(efConstruction)
                .withEf(ef)
                .withRemoveEnabled()
                .build();
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public void add(long id, float[] vector) {
        if (slotsUsed >= index.getMaxItemCount()) {
            compact(Math.max(index.getMaxItemCount(), (index.size() + 1) * 2));
        }
        index.add(new VectorItem(id, Arrays.copyOf(vector, vector.length)));
        slotsUsed++;
    }

    @Override
    public boolean remove(long id) {
        if (index.get(id).isEmpty()) return false;
        boolean removed = index.remove(id, 0L);
        if (!removed) {
            // rebuild without this id
            Collection<VectorItem> items = index.items();
            HnswIndex<Long, float[], VectorItem, Float> rebuilt = newIndex(index.getMaxItemCount());
            int used = 0;
            for (VectorItem it : items) {
                if (it.id() != id) {
                    rebuilt.add(it);
                    used++;
                }
            }
            this.index = rebuilt;
            this.slotsUsed = used;
        }
        return true;
    }

    @Override
    public Optional<float[]> vector(long id) {
        return index.get(id).map(it -> Arrays.copyOf(it.vector(), it.vector().length));
    }

    @Override
    public List<Neighbor> query(float[] q, int topK) {
        if (topK <= 0 || index.size() == 0) return List.of();
        List<SearchResult<VectorItem, Float>> results = index.findNearest(q, topK);
        List<Neighbor> out = new ArrayList<>(results.size());
        for (SearchResult<VectorItem, Float> r : results) {
            out.add(new Neighbor(r.item().id(), r.distance()));
        }
        return out;
    }

    @Override
    public int size() {
        return index.size();
    }

    @Override
    public void persistTo(Path file) throws IOException {
        index.save(file);
    }

    @Override
    public void loadFrom(Path file) throws IOException {
        HnswIndex<Long, float[], VectorItem, Float> loaded = HnswIndex.load(file);
        if (loaded.getDimensions() != dimension) {
            throw new IndexCorruptionException("ANN snapshot " + file + " has dimension " + loaded.getDimensions()
                    + " but the index is configured for " + dimension);
        }
        this.index = loaded;
        // the snapshot does not tell how many slots are taken; start from a compacted graph
        compact(Math.max(initialMaxItems, loaded.size() * 2));
        log.info("Loaded HNSW snapshot from {} (size={})", file.toAbsolutePath(), index.size());
    }

    private void compact(int capacity) {
        Collection<VectorItem> items = index.items();
        HnswIndex<Long, float[], VectorItem, Float> rebuilt = newIndex(capacity);
        for (VectorItem it : items) {
            rebuilt.add(it);
        }
        log.debug("Compacted HNSW graph: {} items, capacity {} -> {}", items.size(), index.getMaxItemCount(), capacity);
        this.index = rebuilt;
        this.slotsUsed = items.size();
    }

    public Map<String, Integer> getHnswParams() {
        return Map.of("m", m, "efConstruction", efConstruction, "ef", ef, "maxItems", index.getMaxItemCount());
    }

    static final class VectorItem implements Item<Long, float[]> {

        private static final long serialVersionUID = 1L;

        private final long id;
        private final float[] vector;

        VectorItem(long id, float[] vector) {
            this.id = id;
            this.vector = vector;
        }

        @Override
        public Long id() { return id; }

        @Override
        public float[] vector() { return vector; }

        @Override
        public int dimensions() { return vector.length; }

        @Override
        public long version() { return 0L; }
    }
}
