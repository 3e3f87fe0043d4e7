package com.example.treesync;

import com.example.treesync.checkpoint.Checkpoint;
import com.example.treesync.checkpoint.CheckpointStore;
import com.example.treesync.checkpoint.InstanceKey;
import com.example.treesync.policy.SyncPolicy;
import com.example.treesync.scan.ScanResult;
import com.example.treesync.scan.TreeScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Entry point of the engine: resolves the endpoints, scans both trees, diffs them against the
 * stored checkpoint, applies the result and advances the checkpoint to the time the run began.
 */
public final class RunCoordinator {
    private static final Logger LOGGER = LoggerFactory.getLogger(RunCoordinator.class);

    private final CheckpointStore checkpointStore;
    private final TreeScanner scanner;
    private final DiffEngine diffEngine;
    private final ReconciliationExecutor executor;
    private final Clock clock;
    private final boolean preview;

    public RunCoordinator(CheckpointStore checkpointStore) {
        this(checkpointStore, new TreeScanner(), Clock.systemUTC(), false);
    }

    public RunCoordinator(CheckpointStore checkpointStore, TreeScanner scanner, Clock clock, boolean preview) {
        this.checkpointStore = checkpointStore;
        this.scanner = scanner;
        this.diffEngine = new DiffEngine();
        this.executor = new ReconciliationExecutor(scanner, preview);
        this.clock = clock;
        this.preview = preview;
    }

    /**
     * Runs one synchronization pass between {@code path} and {@code destination}.
     *
     * @param hostIdentity identifies the machine running the pass; part of the checkpoint key
     * @throws EndpointException if an endpoint is missing and may not be created, or cannot be created
     */
    public SyncResult synchronize(Path path, Path destination, SyncPolicy policy, String hostIdentity)
            throws EndpointException {
        // Captured before scanning so that writes racing with this run are new on the next one.
        Instant runStart = clock.instant();

        Endpoint requestedPath = Endpoint.of(path);
        Endpoint requestedDestination = Endpoint.of(destination);
        Endpoint pathEndpoint = resolveEndpoint(requestedPath, policy.createPath(), "path");
        Endpoint destinationEndpoint = resolveEndpoint(requestedDestination, policy.createDestination(), "destination");
        checkDisjoint(pathEndpoint, destinationEndpoint);
        boolean rootCreated = !requestedPath.exists() || !requestedDestination.exists();

        String instanceKey = InstanceKey.of(hostIdentity, pathEndpoint.absolutePath(), destinationEndpoint.absolutePath());
        Endpoint source = policy.direction().pathIsSource() ? pathEndpoint : destinationEndpoint;
        Endpoint target = policy.direction().pathIsSource() ? destinationEndpoint : pathEndpoint;
        LOGGER.info("Synchronizing {} -> {} ({})", source.absolutePath(), target.absolutePath(), policy);

        RunJournal journal = new RunJournal();
        Optional<Checkpoint> checkpoint = checkpointStore.load(pathEndpoint, destinationEndpoint, instanceKey);
        if (rootCreated && checkpoint.isPresent()) {
            // The stored checkpoint describes a tree that no longer exists.
            LOGGER.warn("Ignoring checkpoint for {}: an endpoint root was missing at the start of this run",
                    instanceKey);
            checkpoint = Optional.empty();
        }
        if (policy.purge()) {
            executor.purge(target, journal);
            // Nothing on the target is stale after a purge; compare everything.
            checkpoint = Optional.empty();
        }
        checkpoint.ifPresentOrElse(
                value -> LOGGER.info("Last synchronized at {}", value.lastSyncTime()),
                () -> LOGGER.info("No checkpoint; running a full comparison"));

        ScanResult sourceScan = scanner.scan(source, policy.recurse());
        ScanResult targetScan = scanner.scan(target, policy.recurse());
        DiffResult diff = diffEngine.diff(source, target, sourceScan, targetScan, checkpoint, policy);
        LOGGER.info("Diff computed: {}", diff.summary());

        executor.execute(diff, policy, journal);

        if (!preview) {
            try {
                checkpointStore.save(pathEndpoint, destinationEndpoint, instanceKey, runStart);
            } catch (IOException ex) {
                journal.fail(Operation.SAVE_CHECKPOINT, destinationEndpoint.absolutePath(), ex);
            }
        }

        SyncResult result = journal.toResult(runStart, preview);
        LOGGER.info("Synchronization {}: {} actions, {} errors",
                preview ? "previewed" : "completed", result.actions().size(), result.errors().size());
        return result;
    }

    private Endpoint resolveEndpoint(Endpoint endpoint, boolean create, String role) throws EndpointException {
        if (endpoint.exists()) {
            return endpoint;
        }
        if (Files.exists(endpoint.absolutePath())) {
            throw new EndpointException("The " + role + " " + endpoint.absolutePath() + " is not a directory.");
        }
        if (!create) {
            throw new EndpointException("The " + role + " " + endpoint.absolutePath() + " does not exist.");
        }
        if (preview) {
            LOGGER.info("Would create {} {}", role, endpoint.absolutePath());
            return endpoint;
        }
        try {
            Files.createDirectories(endpoint.absolutePath());
        } catch (IOException ex) {
            throw new EndpointException("Cannot create the " + role + " " + endpoint.absolutePath(), ex);
        }
        LOGGER.info("Created {} {}", role, endpoint.absolutePath());
        return new Endpoint(endpoint.absolutePath(), true);
    }

    private static void checkDisjoint(Endpoint path, Endpoint destination) throws EndpointException {
        Path a = path.absolutePath();
        Path b = destination.absolutePath();
        if (a.startsWith(b) || b.startsWith(a)) {
            throw new EndpointException("The path " + a + " and destination " + b + " overlap.");
        }
    }
}
