package com.example.treesync.checkpoint;

import java.util.Locale;

public enum CheckpointStrategy {
    /** Mapping document stored next to the endpoints. */
    SIDECAR,
    /** Extended attribute written on both endpoint directories. */
    ATTACHED;

    public static CheckpointStrategy fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown checkpoint strategy: " + name, ex);
        }
    }
}
