package com.example.treesync.policy;

/**
 * Expands a preset plus overrides into a {@link SyncPolicy}.
 */
public final class PolicyResolver {
    private static final boolean DEFAULT_PURGE = false;
    private static final boolean DEFAULT_RECURSE = true;
    private static final boolean DEFAULT_CHECK_HASH = false;
    private static final boolean DEFAULT_SKIP_FILES = false;
    private static final boolean DEFAULT_CREATE_PATH = false;
    private static final boolean DEFAULT_CREATE_DESTINATION = false;

    private PolicyResolver() {
    }

    public static SyncPolicy resolve(Preset preset) {
        return resolve(preset, PolicyOverrides.none());
    }

    public static SyncPolicy resolve(Preset preset, PolicyOverrides overrides) {
        return new SyncPolicy(
                overrides.direction().orElse(preset.direction()),
                overrides.purge().orElse(DEFAULT_PURGE),
                overrides.recurse().orElse(DEFAULT_RECURSE),
                overrides.checkHash().orElse(DEFAULT_CHECK_HASH),
                overrides.skipDelete().orElse(preset.skipDelete()),
                overrides.skipExisting().orElse(preset.skipExisting()),
                overrides.skipFiles().orElse(DEFAULT_SKIP_FILES),
                overrides.createPath().orElse(DEFAULT_CREATE_PATH),
                overrides.createDestination().orElse(DEFAULT_CREATE_DESTINATION)
        );
    }
}
