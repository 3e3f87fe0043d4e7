package com.example.treesync;

/**
 * A failed operation on a single file or directory. Recorded, never rethrown.
 */
public record ItemError(
        String item,
        Operation operation,
        String cause
) {
}
