package com.example.treesync.metadata;

import java.time.Instant;
import java.util.Optional;

/**
 * A file found under an endpoint, keyed by its path relative to the endpoint root.
 */
public record FileRecord(
        String relativePath,
        Instant lastWriteTimeUtc,
        long size,
        Optional<String> contentHash
) {
    public FileRecord(String relativePath, Instant lastWriteTimeUtc, long size) {
        this(relativePath, lastWriteTimeUtc, size, Optional.empty());
    }

    /**
     * Returns a copy carrying the given SHA-256 hex digest.
     */
    public FileRecord withContentHash(String sha256) {
        return new FileRecord(relativePath, lastWriteTimeUtc, size, Optional.of(sha256));
    }
}
