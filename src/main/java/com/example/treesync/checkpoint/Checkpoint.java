package com.example.treesync.checkpoint;

import java.time.Instant;

/**
 * Time of the last successful synchronization of one endpoint pair.
 */
public record Checkpoint(
        String instanceKey,
        Instant lastSyncTime
) {
}
