package com.example.treesync.checkpoint;

import com.example.treesync.Endpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.UserDefinedFileAttributeView;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Stores the checkpoint as a user-defined attribute on both endpoint directories.
 * A checkpoint is only trusted when both copies are present and agree, so replacing one
 * side wholesale (e.g. restoring it from a backup) forces a full comparison.
 */
public final class AttachedMetadataCheckpointStore implements CheckpointStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(AttachedMetadataCheckpointStore.class);
    static final String ATTRIBUTE_PREFIX = "treesync.";

    /**
     * Returns true when the file store holding {@code directory} supports user-defined attributes.
     */
    public static boolean isSupported(Path directory) {
        try {
            return Files.getFileStore(directory).supportsFileAttributeView(UserDefinedFileAttributeView.class);
        } catch (IOException ex) {
            LOGGER.debug("Cannot inspect file store of {}", directory, ex);
            return false;
        }
    }

    @Override
    public Optional<Checkpoint> load(Endpoint path, Endpoint destination, String instanceKey) {
        if (!path.exists() || !destination.exists()) {
            return Optional.empty();
        }
        try {
            OptionalLong pathTicks = read(path.absolutePath(), instanceKey);
            OptionalLong destinationTicks = read(destination.absolutePath(), instanceKey);
            if (pathTicks.isEmpty() && destinationTicks.isEmpty()) {
                return Optional.empty();
            }
            if (pathTicks.isEmpty() || destinationTicks.isEmpty()
                    || pathTicks.getAsLong() != destinationTicks.getAsLong()) {
                LOGGER.warn("Checkpoint attributes on {} and {} disagree; running a full comparison",
                        path.absolutePath(), destination.absolutePath());
                return Optional.empty();
            }
            return Optional.of(new Checkpoint(instanceKey, Ticks.toInstant(pathTicks.getAsLong())));
        } catch (IOException | NumberFormatException ex) {
            LOGGER.warn("Ignoring unreadable checkpoint attribute for {}", instanceKey, ex);
            return Optional.empty();
        }
    }

    @Override
    public void save(Endpoint path, Endpoint destination, String instanceKey, Instant lastSyncTime) throws IOException {
        byte[] value = Long.toString(Ticks.fromInstant(lastSyncTime)).getBytes(StandardCharsets.US_ASCII);
        write(path.absolutePath(), instanceKey, value);
        write(destination.absolutePath(), instanceKey, value);
        LOGGER.debug("Saved checkpoint {} for {}", lastSyncTime, instanceKey);
    }

    private OptionalLong read(Path directory, String instanceKey) throws IOException {
        UserDefinedFileAttributeView view = view(directory);
        String name = ATTRIBUTE_PREFIX + instanceKey;
        if (!view.list().contains(name)) {
            return OptionalLong.empty();
        }
        ByteBuffer buffer = ByteBuffer.allocate(view.size(name));
        view.read(name, buffer);
        buffer.flip();
        return OptionalLong.of(Long.parseLong(StandardCharsets.US_ASCII.decode(buffer).toString().trim()));
    }

    private void write(Path directory, String instanceKey, byte[] value) throws IOException {
        view(directory).write(ATTRIBUTE_PREFIX + instanceKey, ByteBuffer.wrap(value));
    }

    private UserDefinedFileAttributeView view(Path directory) throws IOException {
        UserDefinedFileAttributeView view = Files.getFileAttributeView(directory, UserDefinedFileAttributeView.class);
        if (view == null) {
            throw new IOException("User-defined attributes are not available on " + directory);
        }
        return view;
    }
}
