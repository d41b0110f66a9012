package com.example.filesearch;

/**
 * A single search result: lower distance means closer.
 */
public record SearchHit(long id, float distance, FileMetadata metadata) {
}
