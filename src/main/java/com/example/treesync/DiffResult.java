package com.example.treesync;

import com.example.treesync.metadata.FileRecord;

import java.util.NavigableMap;
import java.util.NavigableSet;

/**
 * Classified relative paths produced by {@link DiffEngine}. File maps carry the record of the
 * side the path was found on; directories are plain relative paths.
 */
public record DiffResult(
        Endpoint source,
        Endpoint target,
        NavigableMap<String, FileRecord> filesMissingAtTarget,
        NavigableMap<String, FileRecord> filesMissingAtSource,
        NavigableMap<String, CommonFile> commonFiles,
        NavigableMap<String, FileRecord> staleFilesAtTarget,
        NavigableMap<String, FileRecord> staleFilesAtSource,
        NavigableSet<String> directoriesMissingAtTarget,
        NavigableSet<String> directoriesMissingAtSource,
        NavigableSet<String> commonDirectories,
        NavigableSet<String> staleDirectoriesAtTarget,
        NavigableSet<String> staleDirectoriesAtSource
) {
    /**
     * A file present on both sides.
     */
    public record CommonFile(FileRecord source, FileRecord target) {
    }

    public String summary() {
        return String.format(
                "files: missingAtTarget=%d, missingAtSource=%d, common=%d, staleAtTarget=%d, staleAtSource=%d; "
                        + "directories: missingAtTarget=%d, missingAtSource=%d, common=%d, staleAtTarget=%d, staleAtSource=%d",
                filesMissingAtTarget.size(),
                filesMissingAtSource.size(),
                commonFiles.size(),
                staleFilesAtTarget.size(),
                staleFilesAtSource.size(),
                directoriesMissingAtTarget.size(),
                directoriesMissingAtSource.size(),
                commonDirectories.size(),
                staleDirectoriesAtTarget.size(),
                staleDirectoriesAtSource.size());
    }
}
