package com.example.filesearch;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Immutable summary of one scan pass. Safe to hand across threads.
 */
public record ScanResult(List<VectorRecord> scannedFiles, Instant scanTime, List<String> scannedPaths, List<String> errors) {

    public ScanResult {
        scannedFiles = List.copyOf(scannedFiles);
        scannedPaths = List.copyOf(scannedPaths);
        errors = List.copyOf(errors);
    }

    static ScanResult failed(String path, String error) {
        return new ScanResult(List.of(), Instant.now(), List.of(path), List.of(error));
    }

    /**
     * Union of files and concatenation of paths and errors, stamped with the given time.
     */
    static ScanResult merge(Collection<ScanResult> parts, Instant scanTime) {
        List<VectorRecord> files = new ArrayList<>();
        List<String> paths = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (ScanResult part : parts) {
            files.addAll(part.scannedFiles());
            paths.addAll(part.scannedPaths());
            errors.addAll(part.errors());
        }
        return new ScanResult(files, scanTime, paths, errors);
    }
}
