package com.example.filesearch;

import java.nio.file.Path;

/**
 * Content could not be extracted from a file. Subclasses narrow the cause.
 */
public class ExtractionException extends Exception {

    private final Path path;

    public ExtractionException(Path path, String message) {
        super(message);
        this.path = path;
    }

    public ExtractionException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
