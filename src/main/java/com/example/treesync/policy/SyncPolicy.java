package com.example.treesync.policy;

/**
 * Fully resolved policy for one run.
 */
public record SyncPolicy(
        Direction direction,
        boolean purge,
        boolean recurse,
        boolean checkHash,
        boolean skipDelete,
        boolean skipExisting,
        boolean skipFiles,
        boolean createPath,
        boolean createDestination
) {
    public SyncPolicy {
        if (direction == null) {
            throw new IllegalArgumentException("direction is required");
        }
    }
}
