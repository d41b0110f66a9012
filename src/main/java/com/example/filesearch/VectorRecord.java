package com.example.filesearch;

import java.util.Arrays;

/**
 * One entry of the index: the id derived from the file path, its embedding and metadata.
 */
public record VectorRecord(long id, float[] vector, FileMetadata metadata) {

    public VectorRecord {
        vector = Arrays.copyOf(vector, vector.length);
    }

    @Override
    public float[] vector() {
        return Arrays.copyOf(vector, vector.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VectorRecord)) return false;
        VectorRecord other = (VectorRecord) o;
        return id == other.id && Arrays.equals(vector, other.vector) && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Long.hashCode(id) + Arrays.hashCode(vector)) + metadata.hashCode();
    }

    @Override
    public String toString() {
        return "VectorRecord{id=" + id + ", path=" + metadata.path() + ", dimension=" + vector.length + "}";
    }
}
