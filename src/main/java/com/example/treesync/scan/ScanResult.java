package com.example.treesync.scan;

import com.example.treesync.metadata.DirectoryRecord;
import com.example.treesync.metadata.FileRecord;

import java.util.NavigableMap;

/**
 * Files and directories of one endpoint, ordered by relative path.
 */
public record ScanResult(
        NavigableMap<String, FileRecord> files,
        NavigableMap<String, DirectoryRecord> directories
) {
}
