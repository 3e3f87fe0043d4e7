package com.example.treesync;

import com.example.treesync.checkpoint.CheckpointStrategy;
import com.example.treesync.policy.PolicyOverrides;
import com.example.treesync.policy.PolicyResolver;
import com.example.treesync.policy.Preset;
import com.example.treesync.policy.SyncPolicy;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Immutable runtime settings for one synchronization job.
 */
public record SyncConfig(
        Path path,
        Path destination,
        Preset preset,
        PolicyOverrides overrides,
        CheckpointStrategy checkpointStrategy,
        Optional<Path> checkpointFile,
        Optional<String> hostIdentity,
        boolean preview,
        boolean followLinks,
        List<String> excludeFilePatterns,
        List<String> excludeDirectoryPatterns,
        Optional<Path> reportFile
) {
    public SyncPolicy policy() {
        return PolicyResolver.resolve(preset, overrides);
    }
}
