package com.example.filesearch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class ScanLogWriterTest {

    @TempDir
    Path tempDir;

    @Test
    public void appendsOneReportPerScan() throws Exception {
        Path logFile = tempDir.resolve("logs/scan_result.log");
        ScanLogWriter writer = new ScanLogWriter(logFile.toString());
        Instant t = Instant.parse("2024-03-01T12:00:00Z");
        VectorRecord rec = new VectorRecord(42L, new float[]{1f},
                new FileMetadata("/docs/a.txt", "a.txt", "txt", 12, t, t, null));

        writer.write(new ScanResult(List.of(rec), t, List.of("/docs"), List.of("/docs/bad.txt: corrupt")));
        writer.write(new ScanResult(List.of(), t, List.of("/other"), List.of()));

        String text = Files.readString(logFile);
        assertThat(text).contains("- /docs").contains("42\t/docs/a.txt\ttxt\t12 bytes").contains("! /docs/bad.txt: corrupt");
        assertThat(text).contains("- /other");
        assertThat(text.split("File System Scan Results", -1)).hasSize(3);
    }

    @Test
    public void unwritableLogDoesNotThrow() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("file"), "not a dir");
        ScanLogWriter writer = new ScanLogWriter(blocker.resolve("scan.log").toString());

        writer.write(new ScanResult(List.of(), Instant.now(), List.of("/x"), List.of()));

        assertThat(Files.isRegularFile(blocker)).isTrue();
    }
}
