package com.example.filesearch;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

@Slf4j
@Service
public class FileScanner {

    private static final String DEFAULT_EXTENSIONS = ".txt,.md,.pdf";

    private final VectorIndex vectorIndex;
    private final EmbeddingProvider embeddingProvider;
    private final List<ContentExtractor> extractors;
    private final ProgressListener progress;
    private final Set<String> extensions;
    private final int parallelism;

    // bounded pool for scan fan-out across roots
    private final ExecutorService executor;

    @Autowired
    public FileScanner(Environment env, VectorIndex vectorIndex, EmbeddingProvider embeddingProvider,
                       List<ContentExtractor> extractors, ProgressListener progress) {
        this(vectorIndex, embeddingProvider, extractors, progress,
                parseExtensions(env.getProperty("scanner.extensions", DEFAULT_EXTENSIONS)),
                Integer.parseInt(env.getProperty("scanner.parallelism", String.valueOf(Runtime.getRuntime().availableProcessors()))));
    }

    public FileScanner(VectorIndex vectorIndex, EmbeddingProvider embeddingProvider, List<ContentExtractor> extractors,
                       ProgressListener progress, Set<String> extensions, int parallelism) {
        this.vectorIndex = vectorIndex;
        this.embeddingProvider = embeddingProvider;
        this.extractors = List.copyOf(extractors);
        this.progress = progress == null ? ProgressListener.NONE : progress;
        this.extensions = Set.copyOf(extensions);
        this.parallelism = Math.max(1, parallelism);
        AtomicInteger n = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(this.parallelism, r -> {
            Thread t = new Thread(r, "scanner-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    static Set<String> parseExtensions(String ext) {
        return Arrays.stream(ext.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.startsWith(".") ? s.toLowerCase(Locale.ROOT) : ("." + s.toLowerCase(Locale.ROOT)))
                .collect(Collectors.toSet());
    }

    /**
     * Depth-first scan of one root. Never throws: a missing root, unreadable directories and files that
     * fail extraction end up in {@link ScanResult#errors()} while the rest of the tree is still indexed.
     * Files with an unsupported extension, and files without text, are skipped silently.
     */
    public ScanResult scanDirectory(Path root) {
        Path canonical;
        try {
            canonical = root.toRealPath();
        } catch (NoSuchFileException e) {
            log.error("Error: Path '{}' does not exist", root);
            return ScanResult.failed(root.toString(), "Path does not exist: " + root);
        } catch (IOException e) {
            log.error("Error resolving '{}': {}", root, e.getMessage());
            return ScanResult.failed(root.toString(), "Cannot resolve " + root + ": " + e.getMessage());
        }
        if (!Files.isDirectory(canonical)) {
            return ScanResult.failed(canonical.toString(), "Not a directory: " + canonical);
        }

        notifyStatus("Scanning " + canonical);
        List<VectorRecord> files = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        walk(canonical, files, errors);
        log.info("Scanned {}: indexed {} files, {} errors", canonical, files.size(), errors.size());
        notifyStatus("Scanned " + canonical + ": " + files.size() + " files indexed, " + errors.size() + " errors");
        return new ScanResult(files, Instant.now(), List.of(canonical.toString()), errors);
    }

    private void walk(Path dir, List<VectorRecord> files, List<String> errors) {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path entry : entries) {
                if (Thread.currentThread().isInterrupted()) {
                    errors.add("Scan interrupted in " + dir);
                    return;
                }
                if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    walk(entry, files, errors);
                    continue;
                }
                if (!isSupported(entry)) continue;
                try {
                    log.debug("Extracting content from '{}'", entry);
                    indexFile(entry).ifPresent(files::add);
                } catch (ContentNotFoundException e) {
                    log.debug("File vanished during scan: {}", entry);
                } catch (ExtractionException e) {
                    log.warn("Failed to extract {}: {}", entry, e.getMessage());
                    errors.add(entry + ": " + e.getMessage());
                } catch (IndexPersistenceException e) {
                    // the entry is indexed in memory; report that disk is behind
                    errors.add(entry + ": " + e.getMessage());
                } catch (RuntimeException e) {
                    log.error("Error processing '{}': {}", entry, e.getMessage(), e);
                    errors.add(entry + ": " + e);
                }
            }
        } catch (AccessDeniedException e) {
            log.warn("Permission denied: Cannot access '{}'", dir);
            errors.add("Permission denied: " + dir);
        } catch (IOException e) {
            log.error("Error scanning '{}': {}", dir, e.getMessage());
            errors.add("Error scanning " + dir + ": " + e.getMessage());
        }
    }

    /**
     * Scans several roots in parallel on the scanner pool and merges the results.
     * A root that fails entirely contributes an error entry; the others still complete.
     */
    public ScanResult scanDirectories(List<Path> roots) {
        Map<Path, Future<ScanResult>> futures = new LinkedHashMap<>();
        for (Path root : roots) {
            futures.put(root, executor.submit(() -> scanDirectory(root)));
        }
        List<ScanResult> parts = new ArrayList<>();
        for (Map.Entry<Path, Future<ScanResult>> e : futures.entrySet()) {
            try {
                parts.add(e.getValue().get());
            } catch (ExecutionException ex) {
                log.error("Error scanning '{}': {}", e.getKey(), ex.getCause().getMessage(), ex.getCause());
                parts.add(ScanResult.failed(e.getKey().toString(), "Error scanning " + e.getKey() + ": " + ex.getCause()));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                futures.values().forEach(f -> f.cancel(true));
                parts.add(ScanResult.failed(e.getKey().toString(), "Scan interrupted before " + e.getKey() + " completed"));
                break;
            }
        }
        return ScanResult.merge(parts, Instant.now());
    }

    /**
     * Indexes a single file. Unsupported files and files without text yield an empty result, not an error.
     * An existing entry for the same id is replaced in one step, so readers never see the file missing.
     *
     * @throws ExtractionException if the file exists but cannot be read
     */
    public Optional<VectorRecord> scanFile(Path path) throws ExtractionException {
        if (!isSupported(path)) return Optional.empty();
        return indexFile(PathIds.canonicalize(path));
    }

    private Optional<VectorRecord> indexFile(Path file) throws ExtractionException {
        ContentExtractor extractor = extractors.stream()
                .filter(x -> x.supports(file))
                .findFirst()
                .orElseThrow(() -> new UnsupportedContentTypeException(file));
        ExtractedContent content = extractor.extract(file);
        if (content.extractedText() == null || content.extractedText().isBlank()) {
            log.debug("No text extracted from {}; not indexed", file);
            return Optional.empty();
        }
        float[] vector = embeddingProvider.embed(content.extractedText());
        long id = PathIds.idFor(file);
        // add replaces an existing entry under the same write lock
        vectorIndex.add(id, vector, content.metadata());
        return Optional.of(new VectorRecord(id, vector, content.metadata()));
    }

    public boolean isSupported(Path file) {
        String s = file.getFileName() == null ? "" : file.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String e : extensions) if (s.endsWith(e)) return true;
        return false;
    }

    public Set<String> getExtensions() {
        return extensions;
    }

    public int getParallelism() {
        return parallelism;
    }

    private void notifyStatus(String message) {
        try {
            progress.onStatus(message);
        } catch (RuntimeException e) {
            log.debug("Progress listener failed: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
