package com.duckql.logging;

import com.duckql.exception.DuckQLException;
import com.duckql.generator.CompiledQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Structured query lifecycle logging.
 *
 * <p>Binds the request's correlation identifier to the SLF4J MDC under
 * {@link #MDC_KEY} so every line logged while working on the request
 * (by any class) carries it. An execution hops between worker and
 * scheduler threads, so the context is bound at the start of each unit of
 * work on the thread running it and cleared in a {@code finally} block:
 * <pre>
 *   QueryLogger.startQuery(correlationId);
 *   try {
 *       ...
 *       QueryLogger.logExecution(elapsedMs, rows);
 *   } finally {
 *       QueryLogger.clearContext();
 *   }
 * </pre>
 */
public final class QueryLogger {

    private static final Logger logger = LoggerFactory.getLogger(QueryLogger.class);

    /** MDC key holding the correlation identifier. */
    public static final String MDC_KEY = "correlationId";

    private QueryLogger() {}

    /**
     * Binds a correlation identifier to the current thread.
     *
     * @param correlationId the request's correlation identifier
     */
    public static void startQuery(String correlationId) {
        MDC.put(MDC_KEY, correlationId);
    }

    /**
     * Logs the first dispatch of a request.
     *
     * @param query the compiled statement
     */
    public static void logStart(CompiledQuery query) {
        logger.debug("Query started: {} on '{}'", query.kind().code(), query.table());
    }

    /**
     * Logs a compiled statement. SQL text is included only when query
     * logging is enabled; the placeholder count always is.
     *
     * @param query the compiled statement
     * @param includeSql whether to log the SQL text
     */
    public static void logCompilation(CompiledQuery query, boolean includeSql) {
        if (includeSql) {
            logger.debug("Compiled SQL ({} params): {}", query.params().size(), query.sql());
        } else {
            logger.debug("Compiled {} query on '{}' ({} params)",
                query.kind().code(), query.table(), query.params().size());
        }
    }

    /**
     * Logs a retryable failure that will be retried.
     *
     * @param attempt the attempt that failed (1-based)
     * @param error the classified failure
     * @param nextDelayMs the backoff before the next attempt
     */
    public static void logAttemptFailure(int attempt, DuckQLException error, long nextDelayMs) {
        logger.warn("Attempt {} failed with {}: {} (retrying in {}ms)",
            attempt, error.getErrorCode(), error.getMessage(), nextDelayMs);
    }

    /**
     * Logs a successful statement execution.
     *
     * @param execTimeMs engine time in milliseconds
     * @param rowCount rows returned
     */
    public static void logExecution(long execTimeMs, long rowCount) {
        logger.debug("Executed in {}ms, {} rows", execTimeMs, rowCount);
    }

    /**
     * Logs completion of a request.
     *
     * @param totalTimeMs total time including retries, in milliseconds
     * @param attempts attempts used
     */
    public static void completeQuery(long totalTimeMs, int attempts) {
        logger.debug("Query completed in {}ms after {} attempt(s)", totalTimeMs, attempts);
    }

    /**
     * Logs the error finally surfaced for a request.
     *
     * @param error the surfaced error
     */
    public static void logError(DuckQLException error) {
        logger.error("Query failed [{}]: {}", error.getErrorCode(), error.getMessage());
    }

    /**
     * Returns the correlation identifier bound to the current thread.
     *
     * @return the identifier, or null if none is bound
     */
    public static String getCorrelationId() {
        return MDC.get(MDC_KEY);
    }

    /**
     * Removes the correlation identifier from the current thread.
     */
    public static void clearContext() {
        MDC.remove(MDC_KEY);
    }
}
