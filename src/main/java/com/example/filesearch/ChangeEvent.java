package com.example.filesearch;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A filesystem change as reported by {@link DirectoryWatcher}.
 */
public record ChangeEvent(Path path, ChangeKind kind, Instant timestamp) {

    public static ChangeEvent of(Path path, ChangeKind kind) {
        return new ChangeEvent(path, kind, Instant.now());
    }
}
