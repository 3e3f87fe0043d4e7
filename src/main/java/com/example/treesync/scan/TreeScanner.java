package com.example.treesync.scan;

import com.example.treesync.Endpoint;
import com.example.treesync.metadata.DirectoryRecord;
import com.example.treesync.metadata.FileRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

/**
 * Enumerates the files and subdirectories of an endpoint without modifying it.
 * Traversal is breadth-first; unreadable entries are logged and skipped.
 */
public final class TreeScanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(TreeScanner.class);

    private final ExclusionFilter filter;
    private final boolean followLinks;

    public TreeScanner(ExclusionFilter filter, boolean followLinks) {
        this.filter = filter;
        this.followLinks = followLinks;
    }

    public TreeScanner() {
        this(ExclusionFilter.reservedOnly(), false);
    }

    public ExclusionFilter filter() {
        return filter;
    }

    /**
     * Scans the endpoint. With {@code recurse == false} only its direct children are listed.
     */
    public ScanResult scan(Endpoint endpoint, boolean recurse) {
        Path root = endpoint.absolutePath();
        NavigableMap<String, FileRecord> files = new TreeMap<>();
        NavigableMap<String, DirectoryRecord> directories = new TreeMap<>();
        if (!endpoint.exists()) {
            return new ScanResult(files, directories);
        }
        Set<Path> visited = new HashSet<>();
        LinkOption[] linkOptions = followLinks ? new LinkOption[0] : new LinkOption[]{LinkOption.NOFOLLOW_LINKS};

        Deque<Path> pending = new ArrayDeque<>();
        pending.addLast(root);
        while (!pending.isEmpty()) {
            Path current = pending.removeFirst();
            if (followLinks && !markVisited(visited, current)) {
                LOGGER.warn("Skipping {}: directory link cycle", current);
                continue;
            }
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(current)) {
                for (Path entry : stream) {
                    if (!followLinks && Files.isSymbolicLink(entry)) {
                        continue;
                    }
                    BasicFileAttributes attrs;
                    try {
                        attrs = Files.readAttributes(entry, BasicFileAttributes.class, linkOptions);
                    } catch (IOException ex) {
                        LOGGER.warn("Failed to read attributes for {}", entry, ex);
                        continue;
                    }
                    String relativePath = relativize(root, entry);
                    if (attrs.isDirectory()) {
                        if (filter.excludesDirectory(entry)) {
                            continue;
                        }
                        directories.put(relativePath, new DirectoryRecord(relativePath, attrs.lastModifiedTime().toInstant()));
                        if (recurse) {
                            pending.addLast(entry);
                        }
                    } else if (attrs.isRegularFile()) {
                        if (filter.excludesFile(entry)) {
                            continue;
                        }
                        files.put(relativePath, new FileRecord(relativePath, attrs.lastModifiedTime().toInstant(), attrs.size()));
                    }
                }
            } catch (IOException ex) {
                LOGGER.warn("Failed to list directory {}", current, ex);
            }
        }
        LOGGER.debug("Scanned {}: {} files, {} directories", root, files.size(), directories.size());
        return new ScanResult(files, directories);
    }

    /**
     * Computes the content hash of a scanned file on demand.
     */
    public FileRecord hash(Endpoint endpoint, FileRecord record) throws IOException {
        if (record.contentHash().isPresent()) {
            return record;
        }
        return record.withContentHash(ContentHasher.sha256(endpoint.resolve(record.relativePath())));
    }

    static String relativize(Path root, Path entry) {
        return root.relativize(entry).toString().replace('\\', '/');
    }

    private boolean markVisited(Set<Path> visited, Path directory) {
        try {
            return visited.add(directory.toRealPath());
        } catch (IOException ex) {
            LOGGER.warn("Failed to resolve {}", directory, ex);
            return false;
        }
    }
}
