package com.duckql.exception;

import java.util.List;
import java.util.Map;

/**
 * Exception thrown when the engine cannot be reached or no pooled
 * connection becomes available in time.
 *
 * <p>Retryable: the executor retries it up to the configured number of
 * attempts before surfacing it.
 */
public class ConnectionException extends DuckQLException {

    private static final List<String> DEFAULT_SUGGESTIONS = List.of(
        "Check that the database file exists and is accessible",
        "Verify the process has the necessary permissions",
        "Ensure the database is not locked by another process",
        "Increase the pool size if many queries run concurrently"
    );

    public ConnectionException(String message) {
        this(message, null, null);
    }

    public ConnectionException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public ConnectionException(String message, Throwable cause, Map<String, Object> context) {
        super(message, ErrorKind.CONNECTION_ERROR, context, DEFAULT_SUGGESTIONS, cause);
    }
}
