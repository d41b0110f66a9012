package com.example.filesearch;

import java.time.Instant;

/**
 * Metadata of one indexed file, as produced by a {@link ContentExtractor}.
 * Owned by {@link VectorIndex} once stored.
 *
 * @param path         canonical absolute path
 * @param filename     last path element
 * @param fileType     extension without the dot, lower case ("pdf", "txt")
 * @param sizeBytes    size on disk when extracted
 * @param createdAt    creation time reported by the filesystem
 * @param lastModified last modification time reported by the filesystem
 * @param pageCount    number of pages for paged formats, {@code null} otherwise
 */
public record FileMetadata(
        String path,
        String filename,
        String fileType,
        long sizeBytes,
        Instant createdAt,
        Instant lastModified,
        Integer pageCount
) {
}
