package com.example.filesearch;

import java.nio.file.Path;

public class UnsupportedContentTypeException extends ExtractionException {

    public UnsupportedContentTypeException(Path path) {
        super(path, "No extractor supports " + path);
    }
}
