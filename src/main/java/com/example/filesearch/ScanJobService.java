package com.example.filesearch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Runs {@link FileScanner#scanDirectories(List)} in the background for the admin surface. One job at a time.
 */
@Slf4j
@Service
public class ScanJobService {

    private final FileScanner fileScanner;
    private final ScanLogWriter scanLogWriter;

    // one job at a time; the scanner fans out across roots itself
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "scan-job-thread");
        t.setDaemon(true);
        return t;
    });

    private volatile String currentJobId = null;
    private volatile Instant startedAt = null;
    private volatile Instant finishedAt = null;
    private volatile List<Path> roots = List.of();
    private volatile ScanResult lastResult = null;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private volatile Future<?> currentFuture = null;

    public ScanJobService(FileScanner fileScanner, ScanLogWriter scanLogWriter) {
        this.fileScanner = fileScanner;
        this.scanLogWriter = scanLogWriter;
    }

    /**
     * Starts a scan of {@code jobRoots} unless one is already running, in which case the running job's id is returned.
     */
    public synchronized String startJob(List<Path> jobRoots) {
        if (isRunning()) {
            return currentJobId;
        }

        this.currentJobId = UUID.randomUUID().toString();
        this.startedAt = Instant.now();
        this.finishedAt = null;
        this.roots = List.copyOf(jobRoots);
        this.lastResult = null;
        this.cancelled.set(false);

        String jobId = currentJobId;
        List<Path> toScan = roots;
        this.currentFuture = executor.submit(() -> {
            log.info("Scan job {} started, roots={}", jobId, toScan);
            try {
                ScanResult result = fileScanner.scanDirectories(toScan);
                lastResult = result;
                scanLogWriter.write(result);
                log.info("Scan job {} indexed {} files with {} errors", jobId, result.scannedFiles().size(), result.errors().size());
            } catch (RuntimeException e) {
                log.error("Scan job {} failed: {}", jobId, e.getMessage(), e);
            } finally {
                finishedAt = Instant.now();
                if (cancelled.get()) log.info("Scan job {} cancelled.", jobId);
            }
        });

        return currentJobId;
    }

    public synchronized boolean cancel() {
        if (currentJobId == null) return false;
        cancelled.set(true);
        if (currentFuture != null) currentFuture.cancel(true);
        return true;
    }

    public boolean isRunning() {
        Future<?> f = currentFuture;
        return f != null && !f.isDone();
    }

    public Map<String, Object> status() {
        Map<String, Object> out = new HashMap<>();
        ScanResult result = lastResult;
        out.put("jobId", currentJobId);
        out.put("startedAt", startedAt == null ? null : startedAt.toString());
        out.put("finishedAt", finishedAt == null ? null : finishedAt.toString());
        out.put("roots", roots.stream().map(Path::toString).collect(Collectors.toList()));
        out.put("filesIndexed", result == null ? 0 : result.scannedFiles().size());
        out.put("errors", result == null ? List.of() : result.errors());
        out.put("cancelled", cancelled.get());
        out.put("running", isRunning());
        return out;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
