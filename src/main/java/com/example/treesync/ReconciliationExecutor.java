package com.example.treesync;

import com.example.treesync.metadata.FileRecord;
import com.example.treesync.policy.SyncPolicy;
import com.example.treesync.scan.ExclusionFilter;
import com.example.treesync.scan.TreeScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Applies a {@link DiffResult} to the two endpoints in a fixed order: directories, missing files,
 * common files, then stale items. Each item is handled in isolation; a failure is recorded
 * in the journal and the run moves on to the next item.
 */
public final class ReconciliationExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReconciliationExecutor.class);
    private static final Comparator<Located> SHALLOW_FIRST = Comparator
            .comparingInt((Located located) -> depth(located.relativePath()))
            .thenComparing(Located::relativePath);

    private final TreeScanner scanner;
    private final boolean preview;

    public ReconciliationExecutor(TreeScanner scanner, boolean preview) {
        this.scanner = scanner;
        this.preview = preview;
    }

    /**
     * Removes every file, link and directory under the target endpoint, whatever the exclusion
     * patterns say. Only the engine's reserved files, and the directories that still hold them,
     * are left in place. Links are removed as links.
     */
    void purge(Endpoint target, RunJournal journal) {
        if (!target.exists()) {
            return;
        }
        ExclusionFilter filter = scanner.filter();
        LOGGER.info("Purging everything under {}", target.absolutePath());
        try {
            Path root = target.absolutePath().toRealPath();
            Files.walkFileTree(root, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!filter.isReserved(file)) {
                        delete(file, Operation.PURGE, journal);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException ex) {
                    journal.fail(Operation.PURGE, file, ex);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path directory, IOException failure) {
                    if (failure != null) {
                        journal.fail(Operation.PURGE, directory, failure);
                        return FileVisitResult.CONTINUE;
                    }
                    if (directory.equals(root)) {
                        return FileVisitResult.CONTINUE;
                    }
                    try {
                        if (!preview && !isEmpty(directory)) {
                            LOGGER.debug("Keeping {}: it holds reserved files", directory);
                            return FileVisitResult.CONTINUE;
                        }
                    } catch (IOException ex) {
                        journal.fail(Operation.PURGE, directory, ex);
                        return FileVisitResult.CONTINUE;
                    }
                    delete(directory, Operation.PURGE, journal);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException ex) {
            journal.fail(Operation.PURGE, target.absolutePath(), ex);
        }
    }

    void execute(DiffResult diff, SyncPolicy policy, RunJournal journal) {
        Endpoint source = diff.source();
        Endpoint target = diff.target();
        boolean both = policy.direction().allowsReverse();

        if (policy.recurse()) {
            List<Located> missing = new ArrayList<>();
            diff.directoriesMissingAtTarget().forEach(path -> missing.add(new Located(target, path)));
            if (both) {
                diff.directoriesMissingAtSource().forEach(path -> missing.add(new Located(source, path)));
            }
            missing.sort(SHALLOW_FIRST);
            for (Located directory : missing) {
                createDirectory(directory.path(), journal);
            }
        }

        if (!policy.skipFiles()) {
            copyMissing(diff.filesMissingAtTarget(), diff.commonFiles().keySet(), source, target, journal);
            if (both) {
                copyMissing(diff.filesMissingAtSource(), diff.commonFiles().keySet(), target, source, journal);
            }
        }

        if (!policy.skipExisting() && !policy.skipFiles()) {
            for (DiffResult.CommonFile common : diff.commonFiles().values()) {
                resolveCommon(common, source, target, policy, journal);
            }
        }

        if (!policy.skipDelete()) {
            deleteStale(diff, policy, journal);
        }
    }

    private void copyMissing(Map<String, FileRecord> missing,
                             Set<String> common,
                             Endpoint from,
                             Endpoint to,
                             RunJournal journal) {
        for (String relativePath : missing.keySet()) {
            // Paths present on both sides are settled by conflict resolution.
            if (common.contains(relativePath)) {
                continue;
            }
            copy(from.resolve(relativePath), to.resolve(relativePath), Operation.COPY_FILE, journal);
        }
    }

    private void resolveCommon(DiffResult.CommonFile common,
                               Endpoint source,
                               Endpoint target,
                               SyncPolicy policy,
                               RunJournal journal) {
        FileRecord sourceRecord = common.source();
        FileRecord targetRecord = common.target();
        if (policy.checkHash()) {
            try {
                sourceRecord = scanner.hash(source, sourceRecord);
            } catch (IOException ex) {
                journal.fail(Operation.HASH_FILE, source.resolve(sourceRecord.relativePath()), ex);
                return;
            }
            try {
                targetRecord = scanner.hash(target, targetRecord);
            } catch (IOException ex) {
                journal.fail(Operation.HASH_FILE, target.resolve(targetRecord.relativePath()), ex);
                return;
            }
            if (sourceRecord.contentHash().equals(targetRecord.contentHash())) {
                return;
            }
        } else if (sourceRecord.lastWriteTimeUtc().equals(targetRecord.lastWriteTimeUtc())) {
            return;
        }

        String relativePath = sourceRecord.relativePath();
        boolean targetWins = policy.direction().allowsReverse()
                && targetRecord.lastWriteTimeUtc().isAfter(sourceRecord.lastWriteTimeUtc());
        if (targetWins) {
            copy(target.resolve(relativePath), source.resolve(relativePath), Operation.REPLACE_FILE, journal);
        } else {
            copy(source.resolve(relativePath), target.resolve(relativePath), Operation.REPLACE_FILE, journal);
        }
    }

    private void deleteStale(DiffResult diff, SyncPolicy policy, RunJournal journal) {
        boolean reverse = policy.direction().allowsReverse();
        if (!policy.skipFiles()) {
            for (String relativePath : diff.staleFilesAtTarget().keySet()) {
                delete(diff.target().resolve(relativePath), Operation.DELETE_FILE, journal);
            }
            if (reverse) {
                for (String relativePath : diff.staleFilesAtSource().keySet()) {
                    delete(diff.source().resolve(relativePath), Operation.DELETE_FILE, journal);
                }
            }
        }
        if (!policy.recurse()) {
            return;
        }
        List<Located> stale = new ArrayList<>();
        diff.staleDirectoriesAtTarget().forEach(path -> stale.add(new Located(diff.target(), path)));
        if (reverse) {
            diff.staleDirectoriesAtSource().forEach(path -> stale.add(new Located(diff.source(), path)));
        }
        stale.sort(SHALLOW_FIRST.reversed());
        for (Located directory : stale) {
            Path path = directory.path();
            try {
                if (!Files.isDirectory(path)) {
                    continue;
                }
                if (!isEmpty(path)) {
                    LOGGER.debug("Keeping non-empty directory {}", path);
                    continue;
                }
            } catch (IOException ex) {
                journal.fail(Operation.DELETE_DIRECTORY, path, ex);
                continue;
            }
            delete(path, Operation.DELETE_DIRECTORY, journal);
        }
    }

    private void createDirectory(Path directory, RunJournal journal) {
        if (Files.isDirectory(directory)) {
            return;
        }
        try {
            if (!preview) {
                Files.createDirectories(directory);
            }
            journal.record(Operation.CREATE_DIRECTORY, directory);
        } catch (IOException ex) {
            journal.fail(Operation.CREATE_DIRECTORY, directory, ex);
        }
    }

    /**
     * Copies through a sibling temp file which is then moved over the destination, so an
     * interrupted copy never leaves a partially written file under the real name.
     */
    private void copy(Path from, Path to, Operation operation, RunJournal journal) {
        if (preview) {
            journal.record(operation, to);
            return;
        }
        Path temp = to.resolveSibling("." + to.getFileName() + "." + UUID.randomUUID() + ExclusionFilter.TEMP_SUFFIX);
        try {
            Files.createDirectories(to.getParent());
            Files.copy(from, temp, StandardCopyOption.COPY_ATTRIBUTES, StandardCopyOption.REPLACE_EXISTING);
            try {
                Files.move(temp, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, to, StandardCopyOption.REPLACE_EXISTING);
            }
            journal.record(operation, to);
        } catch (IOException ex) {
            discard(temp, ex);
            journal.fail(operation, to, ex);
        }
    }

    private void delete(Path path, Operation operation, RunJournal journal) {
        try {
            if (preview) {
                if (Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
                    journal.record(operation, path);
                }
                return;
            }
            if (Files.deleteIfExists(path)) {
                journal.record(operation, path);
            }
        } catch (IOException ex) {
            journal.fail(operation, path, ex);
        }
    }

    private static void discard(Path temp, IOException failure) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException ex) {
            failure.addSuppressed(ex);
        }
    }

    private static boolean isEmpty(Path directory) throws IOException {
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            return !stream.iterator().hasNext();
        }
    }

    private static int depth(String relativePath) {
        int depth = 1;
        for (int i = 0; i < relativePath.length(); i++) {
            if (relativePath.charAt(i) == '/') {
                depth++;
            }
        }
        return depth;
    }

    private record Located(Endpoint endpoint, String relativePath) {
        Path path() {
            return endpoint.resolve(relativePath);
        }
    }
}
