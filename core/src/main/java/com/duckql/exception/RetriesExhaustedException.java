package com.duckql.exception;

import java.util.Objects;

/**
 * Exception surfaced when a retryable failure persists through every
 * allowed attempt.
 *
 * <p>The last underlying error is available as {@link #getLastError()} (and
 * as the cause); the context repeats its code so that callers matching on
 * context alone still see the root kind.
 */
public class RetriesExhaustedException extends DuckQLException {

    private final int attempts;
    private final DuckQLException lastError;

    public RetriesExhaustedException(DuckQLException lastError, int attempts, String correlationId) {
        super("Query failed after " + attempts + " attempt" + (attempts == 1 ? "" : "s") + ": "
                + Objects.requireNonNull(lastError, "lastError must not be null").getMessage(),
            ErrorKind.RETRIES_EXHAUSTED, lastError.getContext(), lastError.getSuggestions(), lastError);
        this.attempts = attempts;
        this.lastError = lastError;
        putContext("attempts", attempts);
        putContext("last_error", lastError.getErrorCode());
        withCorrelationId(correlationId);
    }

    public int getAttempts() {
        return attempts;
    }

    public DuckQLException getLastError() {
        return lastError;
    }

    @Override
    public String getUserMessage() {
        return "The database did not respond successfully after " + attempts
            + " attempts. " + lastError.getUserMessage();
    }
}
