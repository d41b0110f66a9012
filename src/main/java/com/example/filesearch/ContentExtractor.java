package com.example.filesearch;

import java.nio.file.Path;

/**
 * Turns a file into text plus metadata. Implementations are looked up by {@link #supports(Path)}.
 */
public interface ContentExtractor {

    boolean supports(Path file);

    /**
     * @throws ContentNotFoundException         if the file does not exist
     * @throws UnsupportedContentTypeException  if this extractor cannot read the file
     * @throws ExtractionException              for any other read or parse failure
     */
    ExtractedContent extract(Path file) throws ExtractionException;
}
