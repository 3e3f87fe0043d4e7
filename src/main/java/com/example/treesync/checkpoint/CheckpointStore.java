package com.example.treesync.checkpoint;

import com.example.treesync.Endpoint;

import java.io.IOException;
import java.time.Instant;
import java.util.Optional;

public interface CheckpointStore {
    /**
     * Returns the stored checkpoint for the pair. Unreadable or inconsistent data is
     * reported as empty so the caller falls back to a full comparison.
     */
    Optional<Checkpoint> load(Endpoint path, Endpoint destination, String instanceKey);

    /**
     * Overwrites the checkpoint for the pair.
     */
    void save(Endpoint path, Endpoint destination, String instanceKey, Instant lastSyncTime) throws IOException;
}
