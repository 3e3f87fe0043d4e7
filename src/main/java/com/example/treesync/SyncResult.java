package com.example.treesync;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one run. Whether a non-empty error list counts as failure is the caller's decision.
 */
public record SyncResult(
        Instant newCheckpointTime,
        List<SyncAction> actions,
        List<ItemError> errors,
        boolean preview
) {
    public SyncResult {
        actions = List.copyOf(actions);
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public long count(Operation operation) {
        return actions.stream().filter(action -> action.operation() == operation).count();
    }
}
