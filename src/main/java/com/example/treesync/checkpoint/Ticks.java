package com.example.treesync.checkpoint;

import java.time.Instant;

/**
 * Converts between {@link Instant} and a 64-bit tick count of 100 ns intervals
 * since 0001-01-01T00:00:00Z, the persisted checkpoint encoding.
 */
public final class Ticks {
    static final long TICKS_PER_SECOND = 10_000_000L;
    static final long UNIX_EPOCH_TICKS = 621_355_968_000_000_000L;

    private Ticks() {
    }

    public static long fromInstant(Instant instant) {
        return UNIX_EPOCH_TICKS + instant.getEpochSecond() * TICKS_PER_SECOND + instant.getNano() / 100;
    }

    public static Instant toInstant(long ticks) {
        long sinceEpoch = ticks - UNIX_EPOCH_TICKS;
        long seconds = Math.floorDiv(sinceEpoch, TICKS_PER_SECOND);
        long nanos = Math.floorMod(sinceEpoch, TICKS_PER_SECOND) * 100;
        return Instant.ofEpochSecond(seconds, nanos);
    }
}
