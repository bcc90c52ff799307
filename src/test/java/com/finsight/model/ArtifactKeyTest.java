package com.finsight.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArtifactKeyTest {

    @Test
    void objectKeyShouldFollowSymbolKindVersionLayout() {
        ArtifactKey key = ArtifactKey.version(Symbol.of("aapl"), ArtifactKind.FORECAST, "20240603T120000Z");

        assertEquals("AAPL/forecast/20240603T120000Z", key.objectKey());
        assertEquals("AAPL/insight/latest", ArtifactKey.latest(Symbol.of("AAPL"), ArtifactKind.INSIGHT).objectKey());
        assertEquals(key, ArtifactKey.parse("AAPL/forecast/20240603T120000Z"));
        assertTrue(ArtifactKey.parse("MSFT/raw/latest").isLatest());
    }

    @Test
    void versionShouldDeriveFromAsOfInUtc() {
        String version = ArtifactKey.versionFor(Instant.parse("2024-06-03T12:00:00Z"));

        assertEquals("20240603T120000Z", version);
        assertEquals(Optional.of(Instant.parse("2024-06-03T12:00:00Z")), ArtifactKey.asOfOf(version));
        assertEquals(Optional.of(Instant.parse("2024-06-03T12:00:00Z")), ArtifactKey.asOfOf(version + ".2"));
        assertFalse(ArtifactKey.asOfOf("garbage-version").isPresent());
    }

    @Test
    void malformedKeysShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> ArtifactKey.parse("AAPL/forecast"));
        assertThrows(IllegalArgumentException.class, () -> ArtifactKey.version(Symbol.of("AAPL"), ArtifactKind.RAW, " "));
        assertThrows(IllegalArgumentException.class, () -> ArtifactKey.parse("AAPL/unknown/latest"));
    }
}
