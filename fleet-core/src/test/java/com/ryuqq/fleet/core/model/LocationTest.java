package com.ryuqq.fleet.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LocationTest {

    @Test
    void distanceTo_ReturnsEuclideanDistance() {
        // Given
        Location a = new Location("X1-A1", 0, 0, Set.of(), false);
        Location b = new Location("X1-B2", 3, 4, Set.of(), false);

        // Then
        assertEquals(5.0, a.distanceTo(b), 1e-9);
        assertEquals(5.0, b.distanceTo(a), 1e-9);
        assertEquals(0.0, a.distanceTo(a), 1e-9);
    }

    @Test
    void traits_AreCopiedDefensively() {
        // Given
        Set<String> traits = new HashSet<>(Set.of("ICE_CRYSTALS"));
        Location location = new Location("X1-A1", 0, 0, traits, true);

        // When
        traits.add("MARKETPLACE");

        // Then
        assertTrue(location.hasTrait("ICE_CRYSTALS"));
        assertFalse(location.hasTrait("MARKETPLACE"));
    }

    @Test
    void nullTraits_BecomeEmpty() {
        Location location = new Location("X1-A1", 0, 0, null, false);

        assertTrue(location.traits().isEmpty());
    }

    @Test
    void blankSymbol_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Location(" ", 0, 0, Set.of(), false));
    }
}
