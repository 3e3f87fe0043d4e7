package com.example.treesync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects the actions and item failures of one run in order.
 */
final class RunJournal {
    private static final Logger LOGGER = LoggerFactory.getLogger(RunJournal.class);

    private final List<SyncAction> actions = new ArrayList<>();
    private final List<ItemError> errors = new ArrayList<>();

    void record(Operation operation, Path item) {
        LOGGER.debug("{} {}", operation, item);
        actions.add(new SyncAction(operation, item.toString()));
    }

    void fail(Operation operation, Path item, Exception cause) {
        LOGGER.warn("{} failed for {}", operation, item, cause);
        errors.add(new ItemError(item.toString(), operation, describe(cause)));
    }

    SyncResult toResult(Instant newCheckpointTime, boolean preview) {
        return new SyncResult(newCheckpointTime, actions, errors, preview);
    }

    private static String describe(Exception cause) {
        String message = cause.getMessage();
        return message == null
                ? cause.getClass().getSimpleName()
                : cause.getClass().getSimpleName() + ": " + message;
    }
}
