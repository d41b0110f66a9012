package com.example.filesearch;

/**
 * Write-through of the index failed. The in-memory mutation that preceded it is kept,
 * so the in-memory state is ahead of disk until the next successful write.
 */
public class IndexPersistenceException extends RuntimeException {

    public IndexPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
