package com.example.filesearch;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Locale;
import java.util.Set;

/**
 * Extracts UTF-8 text and filesystem metadata from plain text formats.
 */
@Component
public class PlainTextContentExtractor implements ContentExtractor {

    private static final Set<String> TEXT_TYPES = Set.of("txt", "md", "markdown", "text", "log", "csv", "rst");

    private final long maxSizeBytes;

    public PlainTextContentExtractor(@Value("${scanner.max.file.size.mb:50}") long maxSizeMb) {
        this.maxSizeBytes = maxSizeMb * 1024 * 1024;
    }

    @Override
    public boolean supports(Path file) {
        return TEXT_TYPES.contains(extensionOf(file));
    }

    @Override
    public ExtractedContent extract(Path file) throws ExtractionException {
        if (!Files.exists(file)) throw new ContentNotFoundException(file);
        if (!supports(file)) throw new UnsupportedContentTypeException(file);
        try {
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
            if (maxSizeBytes > 0 && attrs.size() > maxSizeBytes) {
                throw new ExtractionException(file, String.format(Locale.ROOT, "File too large (%.2fMB). Maximum size: %dMB",
                        attrs.size() / (1024.0 * 1024.0), maxSizeBytes / (1024 * 1024)));
            }
            String text = Files.readString(file, StandardCharsets.UTF_8).strip();
            FileMetadata metadata = new FileMetadata(
                    file.toAbsolutePath().normalize().toString(),
                    file.getFileName().toString(),
                    extensionOf(file),
                    attrs.size(),
                    attrs.creationTime().toInstant(),
                    attrs.lastModifiedTime().toInstant(),
                    null);
            return new ExtractedContent(metadata, text);
        } catch (java.nio.file.NoSuchFileException e) {
            throw new ContentNotFoundException(file);
        } catch (IOException e) {
            throw new ExtractionException(file, "Error extracting content from '" + file + "': " + e.getMessage(), e);
        }
    }

    static String extensionOf(Path file) {
        String name = file.getFileName() == null ? "" : file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
