package com.example.filesearch;

import java.nio.file.Path;

/**
 * Fire-and-forget sink for human readable status lines and file events.
 * Implementations must return quickly; callers swallow anything they throw.
 */
public interface ProgressListener {

    ProgressListener NONE = new ProgressListener() { };

    default void onStatus(String message) { }

    default void onFileEvent(Path path, ChangeKind kind) { }
}
