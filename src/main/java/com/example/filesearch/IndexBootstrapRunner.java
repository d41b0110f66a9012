package com.example.filesearch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Startup flow: initial parallel scan of {@code monitor.roots}, scan log, then the change monitor.
 * Nothing happens when no roots are configured.
 */
@Component
public class IndexBootstrapRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(IndexBootstrapRunner.class);

    private final FileScanner fileScanner;
    private final ChangeMonitor changeMonitor;
    private final ScanLogWriter scanLogWriter;
    private final ProgressListener progress;
    private final List<Path> roots;
    private final boolean monitorEnabled;

    public IndexBootstrapRunner(FileScanner fileScanner, ChangeMonitor changeMonitor, ScanLogWriter scanLogWriter,
                                ProgressListener progress,
                                @Value("${monitor.roots:}") String roots,
                                @Value("${monitor.enabled:true}") boolean monitorEnabled) {
        this.fileScanner = fileScanner;
        this.changeMonitor = changeMonitor;
        this.scanLogWriter = scanLogWriter;
        this.progress = progress;
        this.roots = parseRoots(roots);
        this.monitorEnabled = monitorEnabled;
    }

    static List<Path> parseRoots(String value) {
        if (value == null || value.isBlank()) return List.of();
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Path::of)
                .collect(Collectors.toList());
    }

    @Override
    public void run(String... args) throws Exception {
        if (roots.isEmpty()) {
            log.info("No monitor.roots configured; skipping initial scan");
            return;
        }

        log.info("Starting initial scan of {} roots", roots.size());
        progress.onStatus("Scanning " + roots.size() + " directories...");
        try {
            ScanResult result = fileScanner.scanDirectories(roots);
            scanLogWriter.write(result);
            log.info("Initial scan complete: {} files indexed, {} errors", result.scannedFiles().size(), result.errors().size());
            progress.onStatus("Initial scan complete. Found " + result.scannedFiles().size() + " files.");
        } catch (RuntimeException e) {
            log.error("Initial scan failed: {}", e.getMessage(), e);
        }

        if (!monitorEnabled) {
            log.info("monitor.enabled=false; change monitor not started");
            return;
        }
        changeMonitor.start(roots);
    }

    public List<Path> getRoots() {
        return roots;
    }
}
