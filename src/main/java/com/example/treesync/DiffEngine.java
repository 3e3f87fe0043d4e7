package com.example.treesync;

import com.example.treesync.checkpoint.Checkpoint;
import com.example.treesync.metadata.DirectoryRecord;
import com.example.treesync.metadata.FileRecord;
import com.example.treesync.policy.SyncPolicy;
import com.example.treesync.scan.ScanResult;

import java.time.Instant;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Classifies the two scanned trees into the sets the executor acts on.
 * <p>
 * Items written at or after the checkpoint are "new", everything else is "old". Without a
 * checkpoint every item is new, so nothing can be classified as stale.
 * <ul>
 *   <li>missing at target: new(source) minus new(target)</li>
 *   <li>missing at source: new(target) minus new(source), only for {@code BOTH}</li>
 *   <li>common: all(source) intersected with all(target)</li>
 *   <li>stale at target: old(target) minus common</li>
 *   <li>stale at source: old(source) minus common</li>
 * </ul>
 * Files and directories are classified independently; paths are compared as exact strings.
 */
public final class DiffEngine {

    public DiffResult diff(Endpoint source,
                           Endpoint target,
                           ScanResult sourceScan,
                           ScanResult targetScan,
                           Optional<Checkpoint> checkpoint,
                           SyncPolicy policy) {
        Optional<Instant> fence = checkpoint.map(Checkpoint::lastSyncTime);
        boolean both = policy.direction().allowsReverse();

        NavigableMap<String, FileRecord> newSourceFiles = filterByAge(sourceScan.files(), FileRecord::lastWriteTimeUtc, fence, true);
        NavigableMap<String, FileRecord> newTargetFiles = filterByAge(targetScan.files(), FileRecord::lastWriteTimeUtc, fence, true);
        NavigableMap<String, FileRecord> oldSourceFiles = filterByAge(sourceScan.files(), FileRecord::lastWriteTimeUtc, fence, false);
        NavigableMap<String, FileRecord> oldTargetFiles = filterByAge(targetScan.files(), FileRecord::lastWriteTimeUtc, fence, false);

        NavigableMap<String, DiffResult.CommonFile> commonFiles = new TreeMap<>();
        for (Map.Entry<String, FileRecord> entry : sourceScan.files().entrySet()) {
            FileRecord other = targetScan.files().get(entry.getKey());
            if (other != null) {
                commonFiles.put(entry.getKey(), new DiffResult.CommonFile(entry.getValue(), other));
            }
        }

        NavigableSet<String> newSourceDirectories = filterByAge(sourceScan.directories(), DirectoryRecord::lastWriteTimeUtc, fence, true).navigableKeySet();
        NavigableSet<String> newTargetDirectories = filterByAge(targetScan.directories(), DirectoryRecord::lastWriteTimeUtc, fence, true).navigableKeySet();
        NavigableSet<String> oldSourceDirectories = filterByAge(sourceScan.directories(), DirectoryRecord::lastWriteTimeUtc, fence, false).navigableKeySet();
        NavigableSet<String> oldTargetDirectories = filterByAge(targetScan.directories(), DirectoryRecord::lastWriteTimeUtc, fence, false).navigableKeySet();
        NavigableSet<String> commonDirectories = new TreeSet<>(sourceScan.directories().keySet());
        commonDirectories.retainAll(targetScan.directories().keySet());

        return new DiffResult(
                source,
                target,
                minus(newSourceFiles, newTargetFiles.keySet()),
                both ? minus(newTargetFiles, newSourceFiles.keySet()) : new TreeMap<>(),
                commonFiles,
                minus(oldTargetFiles, commonFiles.keySet()),
                minus(oldSourceFiles, commonFiles.keySet()),
                minus(newSourceDirectories, newTargetDirectories),
                both ? minus(newTargetDirectories, newSourceDirectories) : new TreeSet<>(),
                commonDirectories,
                minus(oldTargetDirectories, commonDirectories),
                minus(oldSourceDirectories, commonDirectories)
        );
    }

    private static <T> NavigableMap<String, T> filterByAge(NavigableMap<String, T> records,
                                                          Function<T, Instant> lastWrite,
                                                          Optional<Instant> fence,
                                                          boolean wantNew) {
        NavigableMap<String, T> result = new TreeMap<>();
        for (Map.Entry<String, T> entry : records.entrySet()) {
            boolean isNew = fence.isEmpty() || !lastWrite.apply(entry.getValue()).isBefore(fence.get());
            if (isNew == wantNew) {
                result.put(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    private static <T> NavigableMap<String, T> minus(NavigableMap<String, T> records, Set<String> excluded) {
        NavigableMap<String, T> result = new TreeMap<>(records);
        result.keySet().removeAll(excluded);
        return result;
    }

    private static NavigableSet<String> minus(NavigableSet<String> paths, Set<String> excluded) {
        NavigableSet<String> result = new TreeSet<>(paths);
        result.removeAll(excluded);
        return result;
    }
}
