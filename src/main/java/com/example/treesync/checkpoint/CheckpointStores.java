package com.example.treesync.checkpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Selects the checkpoint backing for a pair of endpoints.
 */
public final class CheckpointStores {
    private static final Logger LOGGER = LoggerFactory.getLogger(CheckpointStores.class);

    private CheckpointStores() {
    }

    /**
     * Creates the requested store. The attached strategy falls back to a sidecar document when
     * either endpoint lives on a file store without user-defined attributes. The sidecar
     * document defaults to the root of the destination.
     */
    public static CheckpointStore create(CheckpointStrategy strategy,
                                         Optional<Path> checkpointFile,
                                         Path path,
                                         Path destination) {
        if (strategy == CheckpointStrategy.ATTACHED) {
            if (AttachedMetadataCheckpointStore.isSupported(nearestExisting(path))
                    && AttachedMetadataCheckpointStore.isSupported(nearestExisting(destination))) {
                return new AttachedMetadataCheckpointStore();
            }
            LOGGER.warn("Attached checkpoint metadata is not supported for {} and {}; using a sidecar document",
                    path, destination);
        }
        return checkpointFile
                .map(SidecarCheckpointStore::new)
                .orElseGet(() -> SidecarCheckpointStore.inDirectory(destination));
    }

    private static Path nearestExisting(Path path) {
        Path current = path.toAbsolutePath().normalize();
        while (current != null && !Files.exists(current)) {
            current = current.getParent();
        }
        return current == null ? path.toAbsolutePath().getRoot() : current;
    }
}
