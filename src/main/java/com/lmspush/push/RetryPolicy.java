package com.lmspush.push;

import java.time.Duration;

/**
 * Bounded retry with exponential backoff.
 *
 * {@code retryCount} is the number of failed retryable attempts so far. A push may be
 * attempted again while {@code retryCount < maxRetries}; the wait before the next attempt
 * is {@code initialBackoff * multiplier^(retryCount - 1)}, capped at {@code maxBackoff}.
 */
public record RetryPolicy(int maxRetries, Duration initialBackoff, double multiplier, Duration maxBackoff) {

    public RetryPolicy {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("Max retries must be at least 1");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("Initial backoff must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Multiplier must be at least 1.0");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("Max backoff cannot be shorter than initial backoff");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30));
    }

    public boolean allowsRetry(int retryCount) {
        return retryCount < maxRetries;
    }

    public Duration backoffFor(int retryCount) {
        if (retryCount < 1) {
            return Duration.ZERO;
        }
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, retryCount - 1);
        if (millis >= maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis((long) millis);
    }
}
