package com.example.treesync.checkpoint;

import com.example.treesync.Endpoint;
import com.example.treesync.scan.ExclusionFilter;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Keeps checkpoints in a JSON document mapping instance keys to tick counts.
 * Several endpoint pairs may share one document.
 */
public final class SidecarCheckpointStore implements CheckpointStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(SidecarCheckpointStore.class);
    private static final TypeReference<TreeMap<String, Long>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final Path documentPath;

    public SidecarCheckpointStore(Path documentPath) {
        this.mapper = new ObjectMapper();
        this.documentPath = documentPath.toAbsolutePath().normalize();
    }

    /**
     * Store whose document lives in the root of the given directory.
     */
    public static SidecarCheckpointStore inDirectory(Path directory) {
        return new SidecarCheckpointStore(directory.resolve(ExclusionFilter.CHECKPOINT_FILE_NAME));
    }

    @Override
    public Optional<Checkpoint> load(Endpoint path, Endpoint destination, String instanceKey) {
        try {
            Long ticks = readDocument().get(instanceKey);
            if (ticks == null) {
                return Optional.empty();
            }
            return Optional.of(new Checkpoint(instanceKey, Ticks.toInstant(ticks)));
        } catch (IOException ex) {
            LOGGER.warn("Ignoring unreadable checkpoint document {}", documentPath, ex);
            return Optional.empty();
        }
    }

    @Override
    public synchronized void save(Endpoint path, Endpoint destination, String instanceKey, Instant lastSyncTime) throws IOException {
        TreeMap<String, Long> document;
        try {
            document = readDocument();
        } catch (IOException ex) {
            LOGGER.warn("Replacing unreadable checkpoint document {}", documentPath, ex);
            document = new TreeMap<>();
        }
        document.put(instanceKey, Ticks.fromInstant(lastSyncTime));

        Files.createDirectories(documentPath.getParent());
        Path temp = documentPath.resolveSibling(documentPath.getFileName() + ExclusionFilter.TEMP_SUFFIX);
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), document);
        try {
            Files.move(temp, documentPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(temp, documentPath, StandardCopyOption.REPLACE_EXISTING);
        }
        LOGGER.debug("Saved checkpoint {} for {}", lastSyncTime, instanceKey);
    }

    /**
     * Exposes the underlying document path.
     */
    public Path path() {
        return documentPath;
    }

    private TreeMap<String, Long> readDocument() throws IOException {
        if (!Files.exists(documentPath)) {
            return new TreeMap<>();
        }
        try (Reader reader = Files.newBufferedReader(documentPath)) {
            Map<String, Long> raw = mapper.readValue(reader, DOCUMENT_TYPE);
            return raw == null ? new TreeMap<>() : new TreeMap<>(raw);
        }
    }
}
