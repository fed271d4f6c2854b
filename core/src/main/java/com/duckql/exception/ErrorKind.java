package com.duckql.exception;

/**
 * Stable error-kind codes carried by every {@link DuckQLException}.
 *
 * <p>The codes are part of the public contract: clients and log processors
 * match on {@link #code()}, so existing values must never be renamed.
 */
public enum ErrorKind {

    /** Unknown table/column, depth exceeded, malformed filter, type mismatch. */
    VALIDATION_ERROR(false),

    /** The engine rejected the compiled statement (syntax, constraint, binder). */
    QUERY_ERROR(false),

    /** Engine unreachable, connection lost, or pool exhausted. */
    CONNECTION_ERROR(true),

    /** Lock timeout, write conflict, or transient I/O. */
    TRANSIENT_ENGINE_ERROR(true),

    /** A retryable failure persisted past the configured number of attempts. */
    RETRIES_EXHAUSTED(false),

    /** The caller cancelled the execution. */
    CANCELLED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Returns the stable code string for this kind.
     *
     * @return the error code
     */
    public String code() {
        return name();
    }

    /**
     * Returns whether failures of this kind are expected to resolve on retry.
     *
     * @return true for connection and transient engine errors
     */
    public boolean isRetryable() {
        return retryable;
    }
}
