package com.example.treesync.policy;

import java.util.Optional;

/**
 * Explicitly supplied policy fields. Empty values fall back to the preset.
 */
public record PolicyOverrides(
        Optional<Direction> direction,
        Optional<Boolean> purge,
        Optional<Boolean> recurse,
        Optional<Boolean> checkHash,
        Optional<Boolean> skipDelete,
        Optional<Boolean> skipExisting,
        Optional<Boolean> skipFiles,
        Optional<Boolean> createPath,
        Optional<Boolean> createDestination
) {
    public static PolicyOverrides none() {
        return new PolicyOverrides(
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                Optional.empty()
        );
    }
}
