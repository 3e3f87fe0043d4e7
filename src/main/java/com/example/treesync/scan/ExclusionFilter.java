package com.example.treesync.scan;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Glob-based name filter applied while scanning. Patterns match the entry's file name only.
 */
public final class ExclusionFilter {
    /** Name of the sidecar checkpoint document kept inside an endpoint. */
    public static final String CHECKPOINT_FILE_NAME = ".treesync-checkpoint.json";
    /** Suffix of in-flight copies that have not been moved into place yet. */
    public static final String TEMP_SUFFIX = ".treesync-tmp";

    private final Set<String> reservedNames;
    private final List<PathMatcher> fileMatchers;
    private final List<PathMatcher> directoryMatchers;

    public ExclusionFilter(List<String> excludeFilePatterns, List<String> excludeDirectoryPatterns) {
        this(excludeFilePatterns, excludeDirectoryPatterns, List.of());
    }

    /**
     * @param reservedNames extra file names owned by the engine, such as a relocated checkpoint
     *                     document; matched literally
     */
    public ExclusionFilter(List<String> excludeFilePatterns,
                           List<String> excludeDirectoryPatterns,
                           Collection<String> reservedNames) {
        this.reservedNames = new TreeSet<>(reservedNames);
        this.reservedNames.add(CHECKPOINT_FILE_NAME);
        this.fileMatchers = excludeFilePatterns.stream()
                .map(ExclusionFilter::globMatcher)
                .toList();
        this.directoryMatchers = excludeDirectoryPatterns.stream()
                .map(ExclusionFilter::globMatcher)
                .toList();
    }

    /**
     * Filter that only hides the engine's own bookkeeping files.
     */
    public static ExclusionFilter reservedOnly() {
        return new ExclusionFilter(List.of(), List.of());
    }

    public boolean excludesFile(Path file) {
        return isReserved(file) || matchesAny(fileMatchers, file);
    }

    /**
     * True for the engine's bookkeeping files: checkpoint documents and in-flight copies. These
     * are never synchronized or purged.
     */
    public boolean isReserved(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return false;
        }
        String value = name.toString();
        return reservedNames.contains(value) || value.endsWith(TEMP_SUFFIX);
    }

    public boolean excludesDirectory(Path directory) {
        return matchesAny(directoryMatchers, directory);
    }

    private static boolean matchesAny(List<PathMatcher> matchers, Path path) {
        Path name = path.getFileName();
        if (name == null) {
            return false;
        }
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(name)) {
                return true;
            }
        }
        return false;
    }

    private static PathMatcher globMatcher(String pattern) {
        return FileSystems.getDefault().getPathMatcher("glob:" + pattern);
    }
}
