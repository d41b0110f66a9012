package com.example.filesearch;

/**
 * Rewrites a user query into a better search string. Must not throw: on any failure the
 * original query is returned.
 */
public interface QueryOptimizer {
    String optimize(String query);
}
