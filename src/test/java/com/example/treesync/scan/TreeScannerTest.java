package com.example.treesync.scan;

import com.example.treesync.Endpoint;
import com.example.treesync.metadata.FileRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TreeScannerTest {
    @TempDir
    Path root;

    @Test
    void listsRelativePathsWithForwardSlashes() throws Exception {
        Files.createDirectories(root.resolve("docs/archive"));
        Files.writeString(root.resolve("readme.txt"), "hello");
        Files.writeString(root.resolve("docs/archive/2023.txt"), "old");
        Instant mtime = Instant.parse("2023-12-31T23:59:59Z");
        Files.setLastModifiedTime(root.resolve("readme.txt"), FileTime.from(mtime));

        ScanResult result = new TreeScanner().scan(Endpoint.of(root), true);

        assertEquals(Set.of("readme.txt", "docs/archive/2023.txt"), result.files().keySet());
        assertEquals(Set.of("docs", "docs/archive"), result.directories().keySet());
        FileRecord readme = result.files().get("readme.txt");
        assertEquals(mtime, readme.lastWriteTimeUtc());
        assertEquals(5L, readme.size());
        assertTrue(readme.contentHash().isEmpty());
    }

    @Test
    void withoutRecursionOnlyListsDirectChildren() throws Exception {
        Files.createDirectories(root.resolve("sub"));
        Files.writeString(root.resolve("top.txt"), "a");
        Files.writeString(root.resolve("sub/deep.txt"), "b");

        ScanResult result = new TreeScanner().scan(Endpoint.of(root), false);

        assertEquals(Set.of("top.txt"), result.files().keySet());
        assertEquals(Set.of("sub"), result.directories().keySet());
    }

    @Test
    void skipsReservedAndExcludedNames() throws Exception {
        Files.createDirectories(root.resolve("$RECYCLE.BIN"));
        Files.writeString(root.resolve("$RECYCLE.BIN/trash.txt"), "x");
        Files.writeString(root.resolve(ExclusionFilter.CHECKPOINT_FILE_NAME), "{}");
        Files.writeString(root.resolve(".report.txt.1234" + ExclusionFilter.TEMP_SUFFIX), "partial");
        Files.writeString(root.resolve("Thumbs.db"), "x");
        Files.writeString(root.resolve("keep.txt"), "x");

        TreeScanner scanner = new TreeScanner(new ExclusionFilter(List.of("Thumbs.db"), List.of("$RECYCLE.BIN")), false);
        ScanResult result = scanner.scan(Endpoint.of(root), true);

        assertEquals(Set.of("keep.txt"), result.files().keySet());
        assertTrue(result.directories().isEmpty());
    }

    @Test
    void skipsConfiguredReservedNamesLiterally() throws Exception {
        Files.createDirectories(root.resolve("nested"));
        Files.writeString(root.resolve("nested/state[1].json"), "{}");
        Files.writeString(root.resolve("state1.json"), "{}");

        TreeScanner scanner = new TreeScanner(new ExclusionFilter(List.of(), List.of(), List.of("state[1].json")), false);
        ScanResult result = scanner.scan(Endpoint.of(root), true);

        assertEquals(Set.of("state1.json"), result.files().keySet());
    }

    @Test
    void missingEndpointScansEmpty() {
        ScanResult result = new TreeScanner().scan(Endpoint.of(root.resolve("absent")), true);

        assertTrue(result.files().isEmpty());
        assertTrue(result.directories().isEmpty());
    }

    @Test
    void hashesOnDemand() throws Exception {
        Files.writeString(root.resolve("a.txt"), "abc");
        TreeScanner scanner = new TreeScanner();
        Endpoint endpoint = Endpoint.of(root);
        FileRecord record = scanner.scan(endpoint, true).files().get("a.txt");

        FileRecord hashed = scanner.hash(endpoint, record);

        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", hashed.contentHash().orElseThrow());
    }
}
