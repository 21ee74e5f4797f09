package io.scanhive.runtime.health;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded retry with exponential backoff: the wait after attempt {@code n} (1-based) is
 * {@code initialBackoff * 2^(n-1)}, capped at {@code maxBackoff}.
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("backoff must not be negative");
        }
    }

    public static RetryPolicy exponential(int maxAttempts, Duration unit, int maxUnits) {
        return new RetryPolicy(maxAttempts, unit, unit.multipliedBy(maxUnits));
    }

    public Duration backoffAfter(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt is 1-based");
        }
        int shift = Math.min(attempt - 1, 30);
        Duration wait = initialBackoff.multipliedBy(1L << shift);
        return wait.compareTo(maxBackoff) > 0 ? maxBackoff : wait;
    }
}
