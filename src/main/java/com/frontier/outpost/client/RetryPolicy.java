package com.frontier.outpost.client;

import java.time.Duration;

/**
 * Retry budget and exponential backoff for one logical request.
 *
 * The delay before retry {@code i} (0-based) is {@code backoffBase * backoffFactor^i},
 * capped at {@code maxDelay}. No jitter: the delay depends on the attempt index only.
 */
public record RetryPolicy(
    int maxRetries,
    Duration backoffBase,
    double backoffFactor,
    Duration maxDelay
) {

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, was " + maxRetries);
        }
        if (backoffBase == null || backoffBase.isZero() || backoffBase.isNegative()) {
            throw new IllegalArgumentException("backoffBase must be > 0, was " + backoffBase);
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be >= 1, was " + backoffFactor);
        }
        if (maxDelay != null && maxDelay.isNegative()) {
            throw new IllegalArgumentException("maxDelay must not be negative, was " + maxDelay);
        }
    }

    public RetryPolicy(int maxRetries, Duration backoffBase, double backoffFactor) {
        this(maxRetries, backoffBase, backoffFactor, null);
    }

    /**
     * Single attempt; used for non-idempotent writes.
     */
    public static RetryPolicy noRetries() {
        return new RetryPolicy(0, Duration.ofSeconds(1), 1.0, null);
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    public RetryPolicy withMaxRetries(int retries) {
        return new RetryPolicy(retries, backoffBase, backoffFactor, maxDelay);
    }

    public Duration delayFor(int attemptIndex) {
        double millis = backoffBase.toMillis() * Math.pow(backoffFactor, attemptIndex);
        Duration delay = Duration.ofMillis((long) Math.min(millis, Long.MAX_VALUE));
        if (maxDelay != null && delay.compareTo(maxDelay) > 0) {
            return maxDelay;
        }
        return delay;
    }
}
