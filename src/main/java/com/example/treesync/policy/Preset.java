package com.example.treesync.policy;

import java.util.Locale;

/**
 * Named policy presets and the defaults each one supplies.
 */
public enum Preset {
    SYNC(Direction.BOTH, false, false),
    MERGE(Direction.BOTH, true, false),
    MIRROR(Direction.FORWARD, false, false),
    CONTRIBUTE(Direction.FORWARD, true, false),
    MISSING(Direction.FORWARD, true, true);

    private final Direction direction;
    private final boolean skipDelete;
    private final boolean skipExisting;

    Preset(Direction direction, boolean skipDelete, boolean skipExisting) {
        this.direction = direction;
        this.skipDelete = skipDelete;
        this.skipExisting = skipExisting;
    }

    public Direction direction() {
        return direction;
    }

    public boolean skipDelete() {
        return skipDelete;
    }

    public boolean skipExisting() {
        return skipExisting;
    }

    /**
     * Parses a preset name case-insensitively; unknown names are rejected.
     */
    public static Preset fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Preset name must not be blank.");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown preset: " + name, ex);
        }
    }
}
