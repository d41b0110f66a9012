package com.example.filesearch;

import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Keeps the most recent status lines so the admin endpoint can show what the scanner and monitor did.
 */
@Component
public class RecentActivityListener implements ProgressListener {

    private static final int CAPACITY = 200;

    private final Deque<String> entries = new ArrayDeque<>();

    @Override
    public void onStatus(String message) {
        append(message);
    }

    @Override
    public void onFileEvent(Path path, ChangeKind kind) {
        append("File " + kind.label() + ": " + path);
    }

    private synchronized void append(String line) {
        if (entries.size() == CAPACITY) entries.removeFirst();
        entries.addLast(Instant.now() + " " + line);
    }

    public synchronized List<String> recent() {
        return new ArrayList<>(entries);
    }
}
