package io.github.drompincen.payverify.runtime.verification.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry schedule for a single collaborator call. The wait before retry {@code n}
 * is {@code initialBackoff * 2^(n-1)}, with no jitter.
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration attemptTimeout, Duration overallTimeout) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(1);
    public static final Duration DEFAULT_ATTEMPT_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_OVERALL_TIMEOUT = Duration.ofMinutes(5);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(attemptTimeout, "attemptTimeout");
        Objects.requireNonNull(overallTimeout, "overallTimeout");
        if (initialBackoff.isNegative() || attemptTimeout.isNegative() || attemptTimeout.isZero()
                || overallTimeout.isNegative() || overallTimeout.isZero()) {
            throw new IllegalArgumentException("Retry durations must be positive");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_BACKOFF,
                DEFAULT_ATTEMPT_TIMEOUT, DEFAULT_OVERALL_TIMEOUT);
    }

    /** Backoff applied before the given retry, 1-based. */
    public Duration backoffBefore(int retry) {
        return initialBackoff.multipliedBy(1L << (retry - 1));
    }
}
