package com.example.treesync;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * One of the two directory trees taking part in a run.
 */
public record Endpoint(
        Path absolutePath,
        boolean exists
) {
    public static Endpoint of(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        return new Endpoint(normalized, Files.isDirectory(normalized));
    }

    /**
     * Resolves a relative path as produced by the scanner against this endpoint's root.
     */
    public Path resolve(String relativePath) {
        return absolutePath.resolve(relativePath);
    }
}
