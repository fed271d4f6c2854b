package com.duckql.runtime;

import com.duckql.config.EngineConfig;
import com.duckql.exception.DuckQLException;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * How often and how patiently failed executions are retried.
 *
 * <p>The delay before retrying after failed attempt {@code n} (1-based) is
 * {@code baseDelay * backoffMultiplier^(n-1)}.
 *
 * @param maxAttempts total attempts including the first (at least 1)
 * @param baseDelay delay before the first retry
 * @param backoffMultiplier growth factor per retry (at least 1.0)
 * @param retryable decides which failures may be retried
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, double backoffMultiplier,
                          Predicate<DuckQLException> retryable) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be non-negative");
        }
        if (backoffMultiplier < 1.0 || Double.isNaN(backoffMultiplier) || Double.isInfinite(backoffMultiplier)) {
            throw new IllegalArgumentException("backoffMultiplier must be a finite value >= 1.0");
        }
        Objects.requireNonNull(retryable, "retryable must not be null");
    }

    /**
     * Creates a policy retrying the error kinds marked retryable.
     */
    public static RetryPolicy of(int maxAttempts, Duration baseDelay, double backoffMultiplier) {
        return new RetryPolicy(maxAttempts, baseDelay, backoffMultiplier, DuckQLException::isRetryable);
    }

    public static RetryPolicy defaults() {
        return of(3, Duration.ofMillis(100), 2.0);
    }

    public static RetryPolicy noRetry() {
        return of(1, Duration.ZERO, 1.0);
    }

    public static RetryPolicy fromConfig(EngineConfig config) {
        return of(config.maxAttempts, config.baseRetryDelay, config.backoffMultiplier);
    }

    /**
     * Returns whether another attempt should follow a failure.
     *
     * @param error the classified failure
     * @param attempt the attempt that failed (1-based)
     * @return true if the error is retryable and attempts remain
     */
    public boolean shouldRetry(DuckQLException error, int attempt) {
        return attempt < maxAttempts && retryable.test(error);
    }

    /**
     * Returns the delay before retrying after the given failed attempt.
     *
     * @param attempt the attempt that failed (1-based)
     * @return the backoff delay
     */
    public Duration delayAfter(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be at least 1");
        }
        double millis = baseDelay.toNanos() / 1_000_000.0 * Math.pow(backoffMultiplier, attempt - 1);
        return Duration.ofNanos(Math.round(millis * 1_000_000.0));
    }
}
