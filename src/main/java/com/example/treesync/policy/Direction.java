package com.example.treesync.policy;

import java.util.Locale;

/**
 * Which endpoint may receive copies and deletions derived from the other.
 */
public enum Direction {
    FORWARD {
        @Override
        public boolean allowsReverse() {
            return false;
        }
    },
    REVERSE {
        @Override
        public boolean allowsReverse() {
            return false;
        }
    },
    BOTH {
        @Override
        public boolean allowsReverse() {
            return true;
        }
    };

    /**
     * Returns true when the source-role endpoint may be written to as well.
     */
    public abstract boolean allowsReverse();

    /**
     * Returns true when the path endpoint takes the source role.
     */
    public boolean pathIsSource() {
        return this != REVERSE;
    }

    public static Direction fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown direction: " + name, ex);
        }
    }
}
