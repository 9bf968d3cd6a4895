package io.jobgtm.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Declarative retry settings for one external call site.
 *
 * @param maxAttempts    total attempts including the first one
 * @param initialBackoff wait before the second attempt
 * @param maxBackoff     upper bound for any wait
 * @param timeout        per-attempt timeout; an attempt running longer counts as failed
 * @param backoff        how the wait grows between attempts
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, Duration timeout,
                          Backoff backoff) {

    public enum Backoff {
        FIXED,
        EXPONENTIAL
    }

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(backoff, "backoff");
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff < initialBackoff");
        }
    }

    public static RetryPolicy exponential(int maxAttempts, Duration initial, Duration max, Duration timeout) {
        return new RetryPolicy(maxAttempts, initial, max, timeout, Backoff.EXPONENTIAL);
    }

    public static RetryPolicy fixed(int maxAttempts, Duration interval, Duration timeout) {
        return new RetryPolicy(maxAttempts, interval, interval, timeout, Backoff.FIXED);
    }

    /**
     * Wait before attempt number {@code attempt} (2-based; the first attempt never waits).
     */
    public Duration backoffBefore(int attempt) {
        if (attempt <= 1) return Duration.ZERO;
        if (backoff == Backoff.FIXED) return initialBackoff;
        int shift = Math.min(attempt - 2, 30);
        long millis = initialBackoff.toMillis() << shift;
        if (millis < 0 || millis > maxBackoff.toMillis()) return maxBackoff;
        return Duration.ofMillis(millis);
    }
}
