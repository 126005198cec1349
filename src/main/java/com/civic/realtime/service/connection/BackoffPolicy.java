package com.civic.realtime.service.connection;

import com.civic.realtime.service.config.RealtimeConfig;

import java.util.Random;

/**
 * Exponential backoff with bounded jitter.
 *
 * {@code delay(n) = min(base * 2^n + jitter, maxDelay)} where the jitter is
 * drawn from {@code [0, min(maxJitter, base * 2^n))}. Bounding the jitter by
 * the exponential term keeps consecutive delays non-decreasing.
 */
public class BackoffPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final long maxJitterMs;
    private final Random random;

    public BackoffPolicy(long baseDelayMs, long maxDelayMs, long maxJitterMs, Random random) {
        if (baseDelayMs < 0 || maxJitterMs < 0 || maxDelayMs < baseDelayMs) {
            throw RealtimeException.invalidConfiguration(String.format(
                    "Invalid backoff: base=%d, max=%d, jitter=%d", baseDelayMs, maxDelayMs, maxJitterMs));
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.maxJitterMs = maxJitterMs;
        this.random = random;
    }

    public static BackoffPolicy from(RealtimeConfig.Reconnect config, Random random) {
        return new BackoffPolicy(config.getBaseDelayMs(), config.getMaxDelayMs(), config.getMaxJitterMs(), random);
    }

    /**
     * Computes the delay before the given zero-based attempt.
     */
    public long delayFor(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must not be negative: " + attempt);
        }
        long exponential = exponential(attempt);
        if (exponential >= maxDelayMs) {
            return maxDelayMs;
        }
        long jitterBound = Math.min(Math.min(maxJitterMs, exponential), maxDelayMs - exponential);
        long jitter = jitterBound > 0 ? (long) (random.nextDouble() * jitterBound) : 0;
        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    private long exponential(int attempt) {
        if (baseDelayMs == 0) return 0;
        if (attempt >= Long.SIZE - 2 || baseDelayMs > (Long.MAX_VALUE >> attempt)) {
            return Long.MAX_VALUE;
        }
        return baseDelayMs << attempt;
    }
}
