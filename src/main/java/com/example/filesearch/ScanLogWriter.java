package com.example.filesearch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Appends a human readable report of each scan pass to the scan log. Diagnostics only: a failed
 * write is logged and never fails the scan.
 */
@Component
public class ScanLogWriter {

    private static final Logger log = LoggerFactory.getLogger(ScanLogWriter.class);
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String RULE = "=".repeat(50);

    private final Path logFile;

    public ScanLogWriter(@Value("${scanner.log.path:./logs/scan_result.log}") String logFile) {
        this.logFile = Path.of(logFile);
    }

    public void write(ScanResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("File System Scan Results\n\n").append(RULE).append('\n');
        sb.append("Scan finished at: ").append(TS.format(LocalDateTime.ofInstant(result.scanTime(), ZoneId.systemDefault()))).append('\n');
        sb.append("Scanned directories:\n");
        for (String p : result.scannedPaths()) sb.append("- ").append(p).append('\n');
        sb.append(RULE).append("\n\n");
        sb.append("Files indexed: ").append(result.scannedFiles().size()).append('\n');
        for (VectorRecord r : result.scannedFiles()) {
            FileMetadata m = r.metadata();
            sb.append(r.id()).append('\t').append(m.path()).append('\t').append(m.fileType())
                    .append('\t').append(m.sizeBytes()).append(" bytes\t").append(m.lastModified()).append('\n');
        }
        if (!result.errors().isEmpty()) {
            sb.append("Errors: ").append(result.errors().size()).append('\n');
            for (String e : result.errors()) sb.append("! ").append(e).append('\n');
        }
        sb.append('\n');
        try {
            if (logFile.getParent() != null) Files.createDirectories(logFile.getParent());
            Files.writeString(logFile, sb.toString(), StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.error("Error writing scan log to '{}': {}", logFile.toAbsolutePath(), e.getMessage());
        }
    }

    public Path getLogFile() {
        return logFile;
    }
}
