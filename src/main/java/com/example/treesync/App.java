package com.example.treesync;

import com.example.treesync.checkpoint.CheckpointStore;
import com.example.treesync.checkpoint.CheckpointStores;
import com.example.treesync.scan.ExclusionFilter;
import com.example.treesync.scan.TreeScanner;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ITEM_ERRORS = 1;
    static final int EXIT_FATAL = 2;

    private App() {
    }

    public static void main(String[] args) throws Exception {
        // Basic CLI contract: a single JSON config file path is required.
        if (args.length < 1) {
            LOGGER.error("Usage: java -jar tree-sync.jar <config.json>");
            System.exit(EXIT_FATAL);
        }
        SyncConfig config = new ConfigLoader().load(Path.of(args[0]));
        System.exit(run(config));
    }

    /**
     * Runs the configured job and maps its outcome to a process exit status.
     */
    static int run(SyncConfig config) throws IOException {
        CheckpointStore checkpointStore = CheckpointStores.create(
                config.checkpointStrategy(),
                config.checkpointFile(),
                config.path(),
                config.destination());
        List<String> reservedNames = config.checkpointFile()
                .map(file -> List.of(file.getFileName().toString()))
                .orElse(List.of());
        TreeScanner scanner = new TreeScanner(
                new ExclusionFilter(config.excludeFilePatterns(), config.excludeDirectoryPatterns(), reservedNames),
                config.followLinks());
        RunCoordinator coordinator = new RunCoordinator(checkpointStore, scanner, Clock.systemUTC(), config.preview());
        String hostIdentity = config.hostIdentity().orElseGet(App::localHostName);

        SyncResult result;
        try {
            result = coordinator.synchronize(config.path(), config.destination(), config.policy(), hostIdentity);
        } catch (EndpointException ex) {
            LOGGER.error("Synchronization aborted: {}", ex.getMessage(), ex);
            return EXIT_FATAL;
        }

        if (config.reportFile().isPresent()) {
            writeReport(config.reportFile().get(), result);
        }
        for (ItemError error : result.errors()) {
            LOGGER.error("{} failed for {}: {}", error.operation(), error.item(), error.cause());
        }
        return result.hasErrors() ? EXIT_ITEM_ERRORS : EXIT_OK;
    }

    private static void writeReport(Path reportFile, SyncResult result) throws IOException {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        Path parent = reportFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(reportFile.toFile(), result);
        LOGGER.info("Wrote run report to {}", reportFile);
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException ex) {
            LOGGER.warn("Cannot resolve the local host name; using 'localhost' for checkpoint keys", ex);
            return "localhost";
        }
    }
}
