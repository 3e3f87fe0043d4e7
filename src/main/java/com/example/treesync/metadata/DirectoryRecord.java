package com.example.treesync.metadata;

import java.time.Instant;

/**
 * A directory found under an endpoint, keyed by its path relative to the endpoint root.
 */
public record DirectoryRecord(
        String relativePath,
        Instant lastWriteTimeUtc
) {
}
