package com.example.filesearch;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Derives the identity key of a file from its path: SHA-256 of the absolute normalized path,
 * reduced into {@code [0, ID_RANGE)}. Pure and stable across restarts, which is how deletions and
 * re-scans find "the same file" again.
 */
public final class PathIds {

    public static final long ID_RANGE = 100_000_000L;

    private static final BigInteger RANGE = BigInteger.valueOf(ID_RANGE);

    private PathIds() {}

    public static long idFor(Path path) {
        return idFor(path.toAbsolutePath().normalize().toString());
    }

    /**
     * Real path of {@code path}; for a file that no longer exists, the real path of its parent joined
     * with the file name, so ids of deleted files still match the ids they were indexed under.
     */
    public static Path canonicalize(Path path) {
        try {
            return path.toRealPath();
        } catch (java.io.IOException e) {
            Path abs = path.toAbsolutePath().normalize();
            Path parent = abs.getParent();
            if (parent != null && abs.getFileName() != null) {
                try {
                    return parent.toRealPath().resolve(abs.getFileName());
                } catch (java.io.IOException ignored) {
                    // parent is gone too
                }
            }
            return abs;
        }
    }

    public static long idFor(String absolutePath) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(absolutePath.getBytes(StandardCharsets.UTF_8));
            return new BigInteger(1, digest).mod(RANGE).longValue();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
