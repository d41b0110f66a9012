package com.example.filesearch;

public record ExtractedContent(FileMetadata metadata, String extractedText) {
}
