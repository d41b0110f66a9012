package com.example.filesearch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Exclusive owner of the ANN structure and the id-to-metadata map.
 * <p>
 * Every id in the ANN structure has exactly one entry in the map and vice versa. Mutations run under a
 * single write lock and are written through to two co-located artifacts (ANN snapshot and id map)
 * before they return; searches share the read lock.
 * <p>
 * If writing the artifacts fails the mutation stays applied in memory and
 * {@link IndexPersistenceException} is thrown, so memory is ahead of disk until the next successful write.
 */
public class VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(VectorIndex.class);

    private static final TypeReference<Map<Long, FileMetadata>> ID_MAP_TYPE = new TypeReference<>() { };

    private final AnnIndex ann;
    private final Map<Long, FileMetadata> idMap = new HashMap<>();
    private final Path indexPath;
    private final Path idMapPath;
    private final ObjectMapper mapper;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Opens the store: loads both artifacts if both exist, creates and writes an empty store if neither does.
     *
     * @throws IndexCorruptionException if only one artifact exists or they cannot be read
     * @throws IndexPersistenceException if a fresh store cannot be written
     */
    public VectorIndex(AnnIndex ann, Path indexPath, Path idMapPath) {
        this.ann = ann;
        this.indexPath = indexPath;
        this.idMapPath = idMapPath;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        initialize();
    }

    private void initialize() {
        boolean hasIndex = Files.exists(indexPath);
        boolean hasIdMap = Files.exists(idMapPath);
        if (hasIndex && hasIdMap) {
            loadExisting();
        } else if (!hasIndex && !hasIdMap) {
            log.info("No persisted index at {}; creating an empty store (dimension={})", indexPath.toAbsolutePath(), ann.dimension());
            lock.writeLock().lock();
            try {
                persist();
            } finally {
                lock.writeLock().unlock();
            }
        } else {
            Path missing = hasIndex ? idMapPath : indexPath;
            throw new IndexCorruptionException("Index artifacts are inconsistent: " + missing.toAbsolutePath()
                    + " is missing while its counterpart exists");
        }
    }

    private void loadExisting() {
        try {
            ann.loadFrom(indexPath);
            Map<Long, FileMetadata> loaded = mapper.readValue(idMapPath.toFile(), ID_MAP_TYPE);
            idMap.putAll(loaded);
        } catch (IOException e) {
            throw new IndexCorruptionException("Failed to load existing store from " + indexPath.toAbsolutePath()
                    + " and " + idMapPath.toAbsolutePath(), e);
        }
        if (idMap.size() != ann.size()) {
            throw new IndexCorruptionException("Index snapshot holds " + ann.size() + " vectors but the id map holds "
                    + idMap.size() + " entries");
        }
        log.info("Loaded vector index: {} entries (dimension={})", idMap.size(), ann.dimension());
    }

    /**
     * Inserts or replaces the entry for {@code id}. A replaced entry is removed from the ANN structure first.
     *
     * @throws DimensionMismatchException if the vector length differs from the index dimension
     * @throws IndexPersistenceException  if the write-through failed (the entry is still added in memory)
     */
    public void add(long id, float[] vector, FileMetadata metadata) {
        checkDimension(vector);
        lock.writeLock().lock();
        try {
            FileMetadata previous = idMap.get(id);
            Optional<float[]> previousVector = Optional.empty();
            if (previous != null) {
                if (!previous.path().equals(metadata.path())) {
                    log.warn("Id {} is shared by {} and {}; the newer entry replaces the older one", id, previous.path(), metadata.path());
                }
                previousVector = ann.vector(id);
                ann.remove(id);
            }
            try {
                ann.add(id, vector);
            } catch (RuntimeException e) {
                // put the replaced entry back so both structures still agree
                previousVector.ifPresentOrElse(v -> ann.add(id, v), () -> idMap.remove(id));
                throw e;
            }
            idMap.put(id, metadata);
            persist();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes the entry for {@code id}; absent ids are a no-op and nothing is written.
     */
    public void remove(long id) {
        lock.writeLock().lock();
        try {
            if (!idMap.containsKey(id)) return;
            ann.remove(id);
            idMap.remove(id);
            persist();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Up to {@code topK} hits ordered by ascending distance, ties broken by ascending id. A non-positive
     * {@code topK} yields an empty list.
     * <p>
     * The ANN structure picks arbitrarily among equally distant ids, so candidates are fetched until every id
     * tied with the {@code topK}-th distance is among them, then sorted and trimmed.
     *
     * @throws DimensionMismatchException if the query length differs from the index dimension
     */
    public List<SearchHit> search(float[] queryVector, int topK) {
        checkDimension(queryVector);
        if (topK <= 0) return List.of();
        lock.readLock().lock();
        try {
            List<SearchHit> hits = new ArrayList<>();
            for (AnnIndex.Neighbor n : candidates(queryVector, topK)) {
                FileMetadata metadata = idMap.get(n.id());
                if (metadata == null) {
                    log.warn("ANN structure returned id {} with no metadata entry; skipping", n.id());
                    continue;
                }
                hits.add(new SearchHit(n.id(), n.distance(), metadata));
            }
            hits.sort(Comparator.comparingDouble(SearchHit::distance).thenComparingLong(SearchHit::id));
            return hits.size() > topK ? hits.subList(0, topK) : hits;
        } finally {
            lock.readLock().unlock();
        }
    }

    // caller holds the read lock
    private List<AnnIndex.Neighbor> candidates(float[] queryVector, int topK) {
        int total = ann.size();
        int fetch = Math.min(topK, total);
        if (fetch == 0) return List.of();
        List<AnnIndex.Neighbor> found = sortedQuery(queryVector, fetch);
        while (fetch < total && tiedAtBoundary(found, topK)) {
            fetch = (int) Math.min(total, fetch * 2L);
            found = sortedQuery(queryVector, fetch);
        }
        return found;
    }

    private List<AnnIndex.Neighbor> sortedQuery(float[] queryVector, int k) {
        List<AnnIndex.Neighbor> found = new ArrayList<>(ann.query(queryVector, k));
        found.sort(Comparator.comparingDouble(AnnIndex.Neighbor::distance).thenComparingLong(AnnIndex.Neighbor::id));
        return found;
    }

    // true while nothing fetched lies strictly beyond the topK-th distance
    private static boolean tiedAtBoundary(List<AnnIndex.Neighbor> sorted, int topK) {
        if (sorted.size() < topK) return false;
        float boundary = sorted.get(topK - 1).distance();
        return sorted.get(sorted.size() - 1).distance() <= boundary;
    }

    public boolean isEmpty() {
        return count() == 0;
    }

    public int count() {
        lock.readLock().lock();
        try {
            return ann.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean exists(long id) {
        lock.readLock().lock();
        try {
            return idMap.containsKey(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<FileMetadata> get(long id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(idMap.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Ids of all entries whose stored path is {@code directory} itself or lies below it.
     */
    public List<Long> idsUnder(Path directory) {
        Path dir = directory.toAbsolutePath().normalize();
        lock.readLock().lock();
        try {
            List<Long> out = new ArrayList<>();
            for (Map.Entry<Long, FileMetadata> e : idMap.entrySet()) {
                if (Path.of(e.getValue().path()).startsWith(dir)) out.add(e.getKey());
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int dimension() {
        return ann.dimension();
    }

    public Path getIndexPath() {
        return indexPath;
    }

    public Path getIdMapPath() {
        return idMapPath;
    }

    private void checkDimension(float[] vector) {
        if (vector == null) throw new DimensionMismatchException(ann.dimension(), 0);
        if (vector.length != ann.dimension()) throw new DimensionMismatchException(ann.dimension(), vector.length);
    }

    // caller holds the write lock
    private void persist() {
        try {
            if (indexPath.getParent() != null) Files.createDirectories(indexPath.getParent());
            if (idMapPath.getParent() != null) Files.createDirectories(idMapPath.getParent());
            Path indexTmp = indexPath.resolveSibling(indexPath.getFileName() + ".tmp");
            Path idMapTmp = idMapPath.resolveSibling(idMapPath.getFileName() + ".tmp");
            ann.persistTo(indexTmp);
            mapper.writeValue(idMapTmp.toFile(), idMap);
            Files.move(indexTmp, indexPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            Files.move(idMapTmp, idMapPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("Failed to persist vector index to {}: {}", indexPath.toAbsolutePath(), e.getMessage());
            throw new IndexPersistenceException("Failed to persist vector index to " + indexPath.toAbsolutePath(), e);
        }
    }
}
