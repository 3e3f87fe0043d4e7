package com.example.treesync.checkpoint;

import com.example.treesync.Endpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.UserDefinedFileAttributeView;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class AttachedMetadataCheckpointStoreTest {
    private static final String KEY = "pair";
    private static final Instant SYNC_TIME = Instant.parse("2024-06-01T10:15:30Z");

    @TempDir
    Path tempDir;

    private Endpoint path;
    private Endpoint destination;
    private final AttachedMetadataCheckpointStore store = new AttachedMetadataCheckpointStore();

    @BeforeEach
    void setUp() throws Exception {
        path = new Endpoint(Files.createDirectory(tempDir.resolve("a")), true);
        destination = new Endpoint(Files.createDirectory(tempDir.resolve("b")), true);
        assumeTrue(AttachedMetadataCheckpointStore.isSupported(tempDir), "user-defined attributes unsupported");
    }

    @Test
    void roundTripsWhenBothSidesAgree() throws Exception {
        assertTrue(store.load(path, destination, KEY).isEmpty());

        store.save(path, destination, KEY, SYNC_TIME);

        assertEquals(SYNC_TIME, store.load(path, destination, KEY).orElseThrow().lastSyncTime());
    }

    @Test
    void disagreeingSidesForceFullComparison() throws Exception {
        store.save(path, destination, KEY, SYNC_TIME);
        writeAttribute(destination.absolutePath(), Long.toString(Ticks.fromInstant(SYNC_TIME.plusSeconds(60))));

        assertTrue(store.load(path, destination, KEY).isEmpty());
    }

    @Test
    void replacedSideWithoutAttributeForcesFullComparison() throws Exception {
        store.save(path, destination, KEY, SYNC_TIME);
        Files.delete(destination.absolutePath());
        Files.createDirectory(destination.absolutePath());

        assertTrue(store.load(path, destination, KEY).isEmpty());
    }

    private static void writeAttribute(Path directory, String value) throws Exception {
        UserDefinedFileAttributeView view = Files.getFileAttributeView(directory, UserDefinedFileAttributeView.class);
        view.write(AttachedMetadataCheckpointStore.ATTRIBUTE_PREFIX + KEY,
                ByteBuffer.wrap(value.getBytes(StandardCharsets.US_ASCII)));
    }
}
