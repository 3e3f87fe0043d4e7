package com.example.treesync.checkpoint;

import com.example.treesync.scan.ContentHasher;

import java.nio.file.Path;

/**
 * Builds the fixed-length key identifying one synchronized (host, path, destination) triple.
 */
public final class InstanceKey {
    private InstanceKey() {
    }

    public static String of(String hostIdentity, Path path, Path destination) {
        if (hostIdentity == null || hostIdentity.isBlank()) {
            throw new IllegalArgumentException("hostIdentity must not be blank");
        }
        String identity = hostIdentity + "|" + path.toAbsolutePath().normalize() + "|" + "=>" + "|"
                + destination.toAbsolutePath().normalize();
        return ContentHasher.sha256(identity);
    }
}
