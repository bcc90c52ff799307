package com.finsight.runner;

/**
 * Bounded exponential backoff: the wait before attempt {@code n+1} is {@code backoffMs * 2^(n-1)}, capped.
 */
public final class RetryPolicy {

    /**
     * Sleep hook; tests replace it to record delays instead of waiting.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    public static final Sleeper THREAD_SLEEPER = Thread::sleep;

    private final int maxAttempts;
    private final long backoffMs;
    private final long maxBackoffMs;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, long backoffMs, long maxBackoffMs, Sleeper sleeper) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMs = Math.max(0L, backoffMs);
        this.maxBackoffMs = Math.max(0L, maxBackoffMs);
        this.sleeper = sleeper == null ? THREAD_SLEEPER : sleeper;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Delay after the given failed attempt (1-based).
     */
    public long delayAfter(int attempt) {
        int shift = Math.max(0, Math.min(30, attempt - 1));
        long delay = backoffMs << shift;
        if (delay < 0L || delay > maxBackoffMs) {
            return maxBackoffMs;
        }
        return delay;
    }

    public void pause(int attempt) throws InterruptedException {
        long delay = delayAfter(attempt);
        if (delay > 0L) {
            sleeper.sleep(delay);
        }
    }
}
