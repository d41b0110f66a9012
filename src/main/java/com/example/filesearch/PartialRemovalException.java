package com.example.filesearch;

import java.nio.file.Path;
import java.util.List;

/**
 * Some entries under a directory could not be removed. Every other entry was removed.
 */
public class PartialRemovalException extends RuntimeException {

    private final Path directory;
    private final int removed;
    private final List<String> errors;

    public PartialRemovalException(Path directory, int removed, List<String> errors) {
        super("Partial failure removing " + directory + ": " + errors.size() + " error(s), first: " + errors.get(0));
        this.directory = directory;
        this.removed = removed;
        this.errors = List.copyOf(errors);
    }

    public Path getDirectory() { return directory; }

    public int getRemoved() { return removed; }

    public List<String> getErrors() { return errors; }
}
