package com.example.treesync;

/**
 * A mutation performed (or, in preview mode, planned) on one item.
 */
public record SyncAction(
        Operation operation,
        String item
) {
}
