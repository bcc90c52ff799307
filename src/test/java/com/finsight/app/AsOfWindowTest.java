package com.finsight.app;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AsOfWindowTest {
    private static final Duration SIX_HOURS = Duration.ofHours(6);

    @Test
    void floor_shouldAlignToUtcWindows() {
        Instant expected = Instant.parse("2024-06-03T12:00:00Z");

        assertEquals(expected, AsOfWindow.floor(Instant.parse("2024-06-03T12:00:00Z"), SIX_HOURS));
        assertEquals(expected, AsOfWindow.floor(Instant.parse("2024-06-03T13:27:41Z"), SIX_HOURS));
        assertEquals(expected, AsOfWindow.floor(Instant.parse("2024-06-03T17:59:59.999Z"), SIX_HOURS));
        assertEquals(Instant.parse("2024-06-03T18:00:00Z"), AsOfWindow.floor(Instant.parse("2024-06-03T18:00:00Z"), SIX_HOURS));
    }

    @Test
    void next_shouldReturnFollowingBoundary() {
        assertEquals(Instant.parse("2024-06-04T00:00:00Z"), AsOfWindow.next(Instant.parse("2024-06-03T19:05:00Z"), SIX_HOURS));
        assertEquals(Instant.parse("2024-06-03T13:00:00Z"),
                AsOfWindow.next(Instant.parse("2024-06-03T12:00:00Z"), Duration.ofHours(1)));
    }

    @Test
    void floor_shouldRejectSubSecondIntervals() {
        assertThrows(IllegalArgumentException.class, () -> AsOfWindow.floor(Instant.EPOCH, Duration.ofMillis(500)));
        assertThrows(IllegalArgumentException.class, () -> AsOfWindow.floor(Instant.EPOCH, null));
    }
}
