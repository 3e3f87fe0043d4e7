package com.example.treesync.policy;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PolicyResolverTest {
    @Test
    void presetsSupplyDirectionAndDeletionDefaults() {
        assertPreset(Preset.SYNC, Direction.BOTH, false, false);
        assertPreset(Preset.MERGE, Direction.BOTH, true, false);
        assertPreset(Preset.MIRROR, Direction.FORWARD, false, false);
        assertPreset(Preset.CONTRIBUTE, Direction.FORWARD, true, false);
        assertPreset(Preset.MISSING, Direction.FORWARD, true, true);
    }

    @Test
    void unlistedFieldsUseEngineDefaults() {
        SyncPolicy policy = PolicyResolver.resolve(Preset.SYNC);

        assertFalse(policy.purge());
        assertTrue(policy.recurse());
        assertFalse(policy.checkHash());
        assertFalse(policy.skipFiles());
        assertFalse(policy.createPath());
        assertFalse(policy.createDestination());
    }

    @Test
    void explicitOverridesWin() {
        PolicyOverrides overrides = new PolicyOverrides(
                Optional.of(Direction.REVERSE),
                Optional.of(true),
                Optional.of(false),
                Optional.of(true),
                Optional.of(false),
                Optional.of(false),
                Optional.empty(),
                Optional.empty(),
                Optional.of(true)
        );

        SyncPolicy policy = PolicyResolver.resolve(Preset.MISSING, overrides);

        assertEquals(Direction.REVERSE, policy.direction());
        assertTrue(policy.purge());
        assertFalse(policy.recurse());
        assertTrue(policy.checkHash());
        assertFalse(policy.skipDelete());
        assertFalse(policy.skipExisting());
        assertFalse(policy.skipFiles());
        assertTrue(policy.createDestination());
    }

    @Test
    void presetNamesAreCaseInsensitiveAndUnknownNamesRejected() {
        assertEquals(Preset.CONTRIBUTE, Preset.fromName("Contribute"));
        assertEquals(Preset.MIRROR, Preset.fromName(" mirror "));
        assertThrows(IllegalArgumentException.class, () -> Preset.fromName("Backup"));
        assertThrows(IllegalArgumentException.class, () -> Preset.fromName(""));
    }

    @Test
    void onlyBothAllowsReverseWrites() {
        assertFalse(Direction.FORWARD.allowsReverse());
        assertFalse(Direction.REVERSE.allowsReverse());
        assertTrue(Direction.BOTH.allowsReverse());
        assertFalse(Direction.REVERSE.pathIsSource());
    }

    private static void assertPreset(Preset preset, Direction direction, boolean skipDelete, boolean skipExisting) {
        SyncPolicy policy = PolicyResolver.resolve(preset);
        assertEquals(direction, policy.direction(), preset.name());
        assertEquals(skipDelete, policy.skipDelete(), preset.name());
        assertEquals(skipExisting, policy.skipExisting(), preset.name());
    }
}
