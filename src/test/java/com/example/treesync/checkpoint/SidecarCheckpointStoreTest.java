package com.example.treesync.checkpoint;

import com.example.treesync.Endpoint;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SidecarCheckpointStoreTest {
    @TempDir
    Path tempDir;

    @Test
    void missingDocumentMeansNoCheckpoint() {
        SidecarCheckpointStore store = SidecarCheckpointStore.inDirectory(tempDir);

        assertTrue(store.load(endpoint("a"), endpoint("b"), "key").isEmpty());
    }

    @Test
    void savesTicksKeyedByInstanceAndOverwrites() throws Exception {
        SidecarCheckpointStore store = new SidecarCheckpointStore(tempDir.resolve("state/checkpoints.json"));
        Instant first = Instant.parse("2024-01-01T00:00:00Z");
        Instant second = Instant.parse("2024-02-01T00:00:00Z");

        store.save(endpoint("a"), endpoint("b"), "pair-1", first);
        store.save(endpoint("c"), endpoint("d"), "pair-2", first);
        store.save(endpoint("a"), endpoint("b"), "pair-1", second);

        Optional<Checkpoint> loaded = store.load(endpoint("a"), endpoint("b"), "pair-1");
        assertEquals(second, loaded.orElseThrow().lastSyncTime());
        assertEquals(first, store.load(endpoint("c"), endpoint("d"), "pair-2").orElseThrow().lastSyncTime());

        JsonNode document = new ObjectMapper().readTree(store.path().toFile());
        assertEquals(2, document.size());
        assertEquals(Ticks.fromInstant(second), document.get("pair-1").asLong());
    }

    @Test
    void unreadableDocumentIsTreatedAsAbsentAndReplacedOnSave() throws Exception {
        SidecarCheckpointStore store = SidecarCheckpointStore.inDirectory(tempDir);
        Files.writeString(store.path(), "{ not json");

        assertTrue(store.load(endpoint("a"), endpoint("b"), "key").isEmpty());

        Instant now = Instant.parse("2024-05-05T05:05:05Z");
        store.save(endpoint("a"), endpoint("b"), "key", now);
        assertEquals(now, store.load(endpoint("a"), endpoint("b"), "key").orElseThrow().lastSyncTime());
    }

    private Endpoint endpoint(String name) {
        return new Endpoint(tempDir.resolve(name), false);
    }
}
