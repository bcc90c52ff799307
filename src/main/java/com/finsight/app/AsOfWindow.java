package com.finsight.app;

import java.time.Duration;
import java.time.Instant;

/**
 * UTC epoch-aligned scheduling windows. Every instant inside one window maps to the same asOf.
 */
public final class AsOfWindow {
    private AsOfWindow() {
    }

    public static Instant floor(Instant now, Duration interval) {
        long seconds = requirePositive(interval);
        long epoch = now.getEpochSecond();
        return Instant.ofEpochSecond(epoch - Math.floorMod(epoch, seconds));
    }

    public static Instant next(Instant now, Duration interval) {
        return floor(now, interval).plusSeconds(requirePositive(interval));
    }

    private static long requirePositive(Duration interval) {
        long seconds = interval == null ? 0L : interval.getSeconds();
        if (seconds <= 0L) {
            throw new IllegalArgumentException("interval must be at least one second: " + interval);
        }
        return seconds;
    }
}
