package com.example.filesearch;

/**
 * The persisted artifacts are inconsistent (one missing, unreadable or of the wrong dimension).
 * Raised at startup instead of silently creating a fresh store.
 */
public class IndexCorruptionException extends IllegalStateException {

    public IndexCorruptionException(String message) {
        super(message);
    }

    public IndexCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
