package com.example.filesearch;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Keeps {@link VectorIndex} in step with the filesystem under the monitored roots.
 * <p>
 * A {@link DirectoryWatcher} puts {@link ChangeEvent}s on a queue; one consumer thread drains it, filters
 * ignored names, applies the per-path debounce and hands accepted paths to a bounded worker pool, which
 * re-indexes them through {@link FileScanner#scanFile(Path)}. Per path the lifecycle is
 * idle, pending, processing, idle; a path that is pending or processing, or was processed less than the
 * cooldown ago, does not get a second task. Deletions skip the debounce and are applied on the consumer thread.
 * <p>
 * Failed processing is logged and not retried; the next event for the path, or the next full scan, retries it.
 */
@Service
public class ChangeMonitor {

    private static final Logger log = LoggerFactory.getLogger(ChangeMonitor.class);

    // sweep expired debounce entries once the maps grow past this
    private static final int SWEEP_THRESHOLD = 1024;

    enum PathState { PENDING, PROCESSING }

    private final FileScanner scanner;
    private final VectorIndex vectorIndex;
    private final ProgressListener listener;
    private final MonitorSettings settings;
    private final Clock clock;

    private final BlockingQueue<ChangeEvent> events = new LinkedBlockingQueue<>();
    private final ConcurrentMap<Path, PathState> states = new ConcurrentHashMap<>();
    private final ConcurrentMap<Path, Instant> lastProcessed = new ConcurrentHashMap<>();
    private final ConcurrentMap<Path, Instant> recentlyCreated = new ConcurrentHashMap<>();
    private final Set<Path> roots = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile ExecutorService workers;
    private volatile DirectoryWatcher watcher;
    private volatile Thread consumer;

    @Autowired
    public ChangeMonitor(Environment env, FileScanner scanner, VectorIndex vectorIndex, ProgressListener listener) {
        this(scanner, vectorIndex, listener, MonitorSettings.fromEnvironment(env), Clock.systemUTC());
    }

    public ChangeMonitor(FileScanner scanner, VectorIndex vectorIndex, ProgressListener listener,
                         MonitorSettings settings, Clock clock) {
        this.scanner = scanner;
        this.vectorIndex = vectorIndex;
        this.listener = listener == null ? ProgressListener.NONE : listener;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Starts watching {@code initialRoots} (missing or non-directory roots are logged and skipped)
     * and starts the consumer loop.
     */
    public synchronized void start(Collection<Path> initialRoots) throws IOException {
        if (running.get()) return;
        AtomicInteger n = new AtomicInteger();
        workers = Executors.newFixedThreadPool(settings.workers(), r -> {
            Thread t = new Thread(r, "monitor-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        watcher = new DirectoryWatcher(events);
        running.set(true);
        for (Path root : initialRoots) {
            watchRoot(root);
        }
        watcher.start();
        consumer = new Thread(this::consumeLoop, "change-monitor");
        consumer.setDaemon(true);
        consumer.start();
        notifyStatus("File monitor started (" + roots.size() + " roots)");
    }

    /**
     * Stops the subscription and the consumer loop, then waits up to the stop timeout for in-flight tasks.
     * In-progress extraction is not interrupted. Events still queued are dropped.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) return;
        log.info("Stopping file system monitor...");
        try {
            watcher.close();
        } catch (IOException e) {
            log.warn("Error closing directory watcher: {}", e.getMessage());
        }
        try {
            consumer.join(settings.stopTimeout().toMillis());
            workers.shutdown();
            if (!workers.awaitTermination(settings.stopTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Monitor workers still busy after {} ms; leaving them to finish", settings.stopTimeout().toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        events.clear();
        notifyStatus("File monitor stopped");
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    public Set<Path> getRoots() {
        return Set.copyOf(roots);
    }

    /**
     * Adds a monitored root. Registered with the watcher right away when the monitor runs.
     *
     * @return the canonical root
     */
    public Path addRoot(Path root) throws IOException {
        Path canonical = root.toRealPath();
        if (!Files.isDirectory(canonical)) throw new IllegalArgumentException("Not a directory: " + canonical);
        if (running.get()) {
            watchRoot(canonical);
        } else {
            roots.add(canonical);
        }
        return canonical;
    }

    /**
     * Stops monitoring {@code root} and removes its entries from the index.
     *
     * @return number of entries removed
     * @throws PartialRemovalException if some entries could not be removed
     */
    public int removeRoot(Path root) {
        Path canonical = PathIds.canonicalize(root);
        roots.remove(canonical);
        DirectoryWatcher w = watcher;
        if (w != null) w.unregister(canonical);
        notifyStatus("Removing indexed files from " + canonical + "...");
        int removed = removeSubtree(canonical);
        notifyStatus("Removed folder " + canonical + " (" + removed + " entries)");
        return removed;
    }

    private void watchRoot(Path root) {
        Path canonical;
        try {
            canonical = root.toRealPath();
        } catch (IOException e) {
            log.error("Path does not exist or is not a directory: {}", root);
            return;
        }
        if (!Files.isDirectory(canonical)) {
            log.error("Path does not exist or is not a directory: {}", canonical);
            return;
        }
        try {
            watcher.register(canonical);
            roots.add(canonical);
            log.info("Started monitoring: {}", canonical);
        } catch (IOException e) {
            log.error("Failed to monitor {}: {}", canonical, e.getMessage());
        }
    }

    /**
     * Puts an event on the monitor's queue, as the watcher does.
     */
    public void submit(ChangeEvent event) {
        events.offer(event);
    }

    private void consumeLoop() {
        while (running.get()) {
            ChangeEvent event;
            try {
                event = events.poll(200, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (event == null) continue;
            try {
                handle(event);
            } catch (RuntimeException e) {
                log.error("Error handling {} event for '{}': {}", event.kind().label(), event.path(), e.getMessage(), e);
            }
        }
    }

    void handle(ChangeEvent event) {
        Path path = event.path();
        if (shouldIgnore(path)) return;
        switch (event.kind()) {
            case DELETED:
                handleDeleted(path);
                break;
            case MOVED:
                log.warn("Moved event for {} is not reconciled", path);
                break;
            case CREATED:
            case MODIFIED:
                handleChanged(path, event.kind());
                break;
            default:
                break;
        }
    }

    boolean shouldIgnore(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString();
        for (String pattern : settings.ignorePatterns()) {
            if (name.contains(pattern)) return true;
        }
        return false;
    }

    private void handleChanged(Path path, ChangeKind kind) {
        if (Files.isDirectory(path) || !scanner.isSupported(path)) return;
        Instant now = clock.instant();
        sweepIfLarge(now);

        if (kind == ChangeKind.MODIFIED) {
            Instant created = recentlyCreated.get(path);
            if (created != null) {
                if (elapsed(created, now).compareTo(settings.createdSuppression()) < 0) {
                    log.debug("Ignoring modify right after create: {}", path);
                    return;
                }
                recentlyCreated.remove(path, created);
            }
        }

        boolean[] accepted = {false};
        states.compute(path, (p, state) -> {
            if (state != null) return state;
            Instant last = lastProcessed.get(p);
            if (last != null && elapsed(last, now).compareTo(settings.cooldown()) < 0) return null;
            lastProcessed.put(p, now);
            accepted[0] = true;
            return PathState.PENDING;
        });
        if (!accepted[0]) {
            log.debug("Debounced {} event for {}", kind.label(), path);
            return;
        }
        if (kind == ChangeKind.CREATED) recentlyCreated.put(path, now);

        log.info("{}: {}", kind == ChangeKind.CREATED ? "Created" : "Modified", path);
        ExecutorService pool = workers;
        try {
            if (pool == null) throw new RejectedExecutionException("monitor not started");
            pool.submit(() -> process(path, kind));
        } catch (RejectedExecutionException e) {
            states.remove(path);
            log.warn("Monitor not accepting work; dropped {} event for {}", kind.label(), path);
        }
    }

    private void process(Path path, ChangeKind kind) {
        states.put(path, PathState.PROCESSING);
        try {
            if (!settings.settle().isZero()) {
                Thread.sleep(settings.settle().toMillis());
            }
            if (!Files.exists(path)) {
                log.debug("{} disappeared before processing", path);
                return;
            }
            Optional<VectorRecord> indexed = scanner.scanFile(path);
            if (indexed.isPresent()) {
                log.info("Processed {} event for: {}", kind.label(), path);
                notifyEvent(path, kind);
            } else {
                log.debug("Nothing to index for {}", path);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExtractionException | RuntimeException e) {
            log.error("Error processing {} event for '{}': {}", kind.label(), path, e.getMessage());
        } finally {
            states.remove(path);
        }
    }

    private void handleDeleted(Path path) {
        log.info("Deleted: {}", path);
        Path canonical = PathIds.canonicalize(path);
        long id = PathIds.idFor(canonical);
        lastProcessed.remove(canonical);
        recentlyCreated.remove(canonical);
        if (vectorIndex.exists(id)) {
            vectorIndex.remove(id);
            notifyEvent(canonical, ChangeKind.DELETED);
            return;
        }
        // no entry of its own: it may have been a directory
        int removed;
        try {
            removed = removeSubtree(canonical);
        } catch (PartialRemovalException e) {
            log.error("Failed to remove {} entries under deleted directory {}: {}", e.getErrors().size(), canonical, e.getErrors());
            removed = e.getRemoved();
        }
        if (removed > 0) {
            notifyEvent(canonical, ChangeKind.DELETED);
        }
    }

    /**
     * Removes every file under {@code directory} from the index: files found on disk by id, plus any
     * stored entry whose path lies below the directory. Keeps going past per-file failures.
     *
     * @return number of entries removed
     * @throws PartialRemovalException carrying all per-file failures, after the rest were removed
     */
    public int removeSubtree(Path directory) {
        Path dir = PathIds.canonicalize(directory);
        Set<Long> ids = new LinkedHashSet<>();
        List<String> errors = new ArrayList<>();
        if (Files.isDirectory(dir)) {
            try (Stream<Path> files = Files.walk(dir)) {
                files.filter(Files::isRegularFile).forEach(f -> ids.add(PathIds.idFor(f)));
            } catch (IOException | RuntimeException e) {
                errors.add("Error walking " + dir + ": " + e.getMessage());
            }
        }
        ids.addAll(vectorIndex.idsUnder(dir));

        int removed = 0;
        for (Long id : ids) {
            try {
                if (vectorIndex.exists(id)) {
                    vectorIndex.remove(id);
                    removed++;
                }
            } catch (RuntimeException e) {
                errors.add("Failed to remove id " + id + ": " + e.getMessage());
            }
        }
        log.info("Removed {} entries under {}", removed, dir);
        if (!errors.isEmpty()) {
            throw new PartialRemovalException(dir, removed, errors);
        }
        return removed;
    }

    private void sweepIfLarge(Instant now) {
        if (recentlyCreated.size() > SWEEP_THRESHOLD) {
            recentlyCreated.values().removeIf(t -> elapsed(t, now).compareTo(settings.createdSuppression()) >= 0);
        }
        if (lastProcessed.size() > SWEEP_THRESHOLD) {
            lastProcessed.values().removeIf(t -> elapsed(t, now).compareTo(settings.cooldown()) >= 0);
        }
    }

    private static Duration elapsed(Instant from, Instant to) {
        return Duration.between(from, to);
    }

    private void notifyStatus(String message) {
        try {
            listener.onStatus(message);
        } catch (RuntimeException e) {
            log.debug("Progress listener failed: {}", e.getMessage());
        }
    }

    private void notifyEvent(Path path, ChangeKind kind) {
        try {
            listener.onFileEvent(path, kind);
        } catch (RuntimeException e) {
            log.debug("Progress listener failed: {}", e.getMessage());
        }
    }
}
