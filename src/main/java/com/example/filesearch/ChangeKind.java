package com.example.filesearch;

public enum ChangeKind {
    CREATED,
    MODIFIED,
    DELETED,
    MOVED;

    public String label() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
