package com.example.treesync;

import com.example.treesync.metadata.FileRecord;
import com.example.treesync.policy.PolicyOverrides;
import com.example.treesync.policy.PolicyResolver;
import com.example.treesync.policy.Preset;
import com.example.treesync.policy.SyncPolicy;
import com.example.treesync.scan.ExclusionFilter;
import com.example.treesync.scan.TreeScanner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReconciliationExecutorTest {
    @TempDir
    Path tempDir;

    @Test
    void hashFailureIsReportedAgainstTheFileThatFailed() throws Exception {
        Path source = Files.createDirectory(tempDir.resolve("source"));
        Path target = Files.createDirectory(tempDir.resolve("target"));
        Files.writeString(source.resolve("x.txt"), "x");
        Instant mtime = Instant.parse("2024-01-01T00:00:00Z");
        // The target record points at a file that vanished after the scan.
        DiffResult.CommonFile common = new DiffResult.CommonFile(
                new FileRecord("x.txt", mtime, 1L),
                new FileRecord("x.txt", mtime.plusSeconds(60), 1L));
        DiffResult diff = new DiffResult(Endpoint.of(source), Endpoint.of(target),
                new TreeMap<>(), new TreeMap<>(), new TreeMap<>(Map.of("x.txt", common)),
                new TreeMap<>(), new TreeMap<>(),
                new TreeSet<>(), new TreeSet<>(), new TreeSet<>(), new TreeSet<>(), new TreeSet<>());
        SyncPolicy policy = PolicyResolver.resolve(Preset.MIRROR, new PolicyOverrides(
                Optional.empty(), Optional.empty(), Optional.empty(), Optional.of(true), Optional.empty(),
                Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty()));
        RunJournal journal = new RunJournal();

        new ReconciliationExecutor(new TreeScanner(), false).execute(diff, policy, journal);

        List<ItemError> errors = journal.toResult(Instant.now(), false).errors();
        assertEquals(1, errors.size());
        assertEquals(Operation.HASH_FILE, errors.get(0).operation());
        assertEquals(Endpoint.of(target).resolve("x.txt").toString(), errors.get(0).item());
        assertEquals("x", Files.readString(source.resolve("x.txt")));
    }

    @Test
    void purgeKeepsRelocatedCheckpointDocument() throws Exception {
        Path target = Files.createDirectories(tempDir.resolve("target/state"));
        Files.writeString(target.resolve("sync-state.json"), "{}");
        Files.writeString(target.resolve("junk.txt"), "junk");
        Files.createDirectories(tempDir.resolve("target/empty"));
        TreeScanner scanner = new TreeScanner(new ExclusionFilter(List.of(), List.of(), List.of("sync-state.json")), false);
        RunJournal journal = new RunJournal();

        new ReconciliationExecutor(scanner, false).purge(Endpoint.of(tempDir.resolve("target")), journal);

        SyncResult result = journal.toResult(Instant.now(), false);
        assertFalse(result.hasErrors(), () -> "unexpected errors " + result.errors());
        assertTrue(Files.exists(target.resolve("sync-state.json")));
        assertFalse(Files.exists(target.resolve("junk.txt")));
        assertFalse(Files.exists(tempDir.resolve("target/empty")));
        assertEquals(2, result.count(Operation.PURGE));
    }
}
