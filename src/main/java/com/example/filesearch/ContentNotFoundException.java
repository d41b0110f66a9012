package com.example.filesearch;

import java.nio.file.Path;

public class ContentNotFoundException extends ExtractionException {

    public ContentNotFoundException(Path path) {
        super(path, "File not found: " + path);
    }
}
