package com.example.treesync;

import com.example.treesync.checkpoint.CheckpointStrategy;
import com.example.treesync.policy.Direction;
import com.example.treesync.policy.PolicyOverrides;
import com.example.treesync.policy.Preset;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class ConfigLoader {
    private static final String DEFAULT_PRESET = "Sync";
    private static final List<String> DEFAULT_EXCLUDE_FILES = List.of(
            "Thumbs.db",
            "desktop.ini",
            "ehthumbs.db",
            ".DS_Store"
    );
    private static final List<String> DEFAULT_EXCLUDE_DIRECTORIES = List.of(
            "$RECYCLE.BIN",
            "System Volume Information"
    );

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public SyncConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        if (raw.path == null || raw.path.isBlank()) {
            throw new IllegalArgumentException("Config must include a path.");
        }
        if (raw.destination == null || raw.destination.isBlank()) {
            throw new IllegalArgumentException("Config must include a destination.");
        }

        Preset preset = Preset.fromName(optionalString(raw.preset, DEFAULT_PRESET));
        PolicyOverrides overrides = new PolicyOverrides(
                Optional.ofNullable(raw.direction).filter(value -> !value.isBlank()).map(Direction::fromName),
                Optional.ofNullable(raw.purge),
                Optional.ofNullable(raw.recurse),
                Optional.ofNullable(raw.checkHash),
                Optional.ofNullable(raw.skipDelete),
                Optional.ofNullable(raw.skipExisting),
                Optional.ofNullable(raw.skipFiles),
                Optional.ofNullable(raw.createPath),
                Optional.ofNullable(raw.createDestination)
        );
        CheckpointStrategy strategy = CheckpointStrategy.fromName(optionalString(raw.checkpointStrategy, "sidecar"));
        Optional<Path> checkpointFile = Optional.ofNullable(raw.checkpointFile)
                .filter(value -> !value.isBlank())
                .map(Path::of);
        Optional<String> hostIdentity = Optional.ofNullable(raw.hostIdentity).filter(value -> !value.isBlank());
        Optional<Path> reportFile = Optional.ofNullable(raw.reportFile)
                .filter(value -> !value.isBlank())
                .map(Path::of);

        return new SyncConfig(
                Path.of(raw.path),
                Path.of(raw.destination),
                preset,
                overrides,
                strategy,
                checkpointFile,
                hostIdentity,
                raw.preview != null && raw.preview,
                raw.followLinks != null && raw.followLinks,
                mergePatterns(DEFAULT_EXCLUDE_FILES, raw.excludeFilePatterns),
                mergePatterns(DEFAULT_EXCLUDE_DIRECTORIES, raw.excludeDirectoryPatterns),
                reportFile
        );
    }

    private List<String> mergePatterns(List<String> defaults, List<String> overrides) {
        List<String> merged = new ArrayList<>(defaults);
        if (overrides != null) {
            for (String pattern : overrides) {
                if (pattern == null || pattern.isBlank() || merged.contains(pattern)) {
                    continue;
                }
                merged.add(pattern);
            }
        }
        return List.copyOf(merged);
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String path;
        public String destination;
        public String preset;
        public String direction;
        public Boolean purge;
        public Boolean recurse;
        public Boolean checkHash;
        public Boolean skipDelete;
        public Boolean skipExisting;
        public Boolean skipFiles;
        public Boolean createPath;
        public Boolean createDestination;
        public String checkpointStrategy;
        public String checkpointFile;
        public String hostIdentity;
        public Boolean preview;
        public Boolean followLinks;
        public List<String> excludeFilePatterns;
        public List<String> excludeDirectoryPatterns;
        public String reportFile;
    }
}
