package com.finsight.data;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Enforces a minimum spacing between requests to one provider, shared across worker threads.
 */
final class RequestPacer {
    private final long pauseNanos;
    private final AtomicLong lastRequestAtNanos = new AtomicLong(0L);

    RequestPacer(long pauseMs) {
        this.pauseNanos = Math.max(0L, pauseMs) * 1_000_000L;
    }

    void await() throws InterruptedException {
        if (pauseNanos <= 0L) {
            return;
        }
        while (true) {
            long prev = lastRequestAtNanos.get();
            long now = System.nanoTime();
            long nextAllowed = prev == 0L ? now : prev + pauseNanos;
            if (now < nextAllowed) {
                TimeUnit.NANOSECONDS.sleep(nextAllowed - now);
                continue;
            }
            if (lastRequestAtNanos.compareAndSet(prev, now)) {
                return;
            }
        }
    }
}
