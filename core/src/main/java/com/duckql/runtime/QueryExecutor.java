package com.duckql.runtime;

import com.duckql.exception.ConnectionException;
import com.duckql.exception.DuckQLException;
import com.duckql.exception.ErrorClassifier;
import com.duckql.exception.QueryCancelledException;
import com.duckql.exception.QueryExecutionException;
import com.duckql.exception.RetriesExhaustedException;
import com.duckql.generator.CompiledQuery;
import com.duckql.logging.QueryLogger;
import com.duckql.metrics.MetricSample;
import com.duckql.metrics.MetricsAggregator;
import com.duckql.schema.ComputedField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs compiled statements on pooled connections, retrying transient
 * failures with exponential backoff.
 *
 * <p>Each execution runs on a worker pool with one thread per pooled
 * connection, so the caller's thread is never blocked on engine I/O or on
 * connection acquisition. A retry is not a loop: after a retryable failure
 * the connection is released, the next attempt is scheduled on a timer
 * after the backoff delay, and only then handed back to a worker.
 *
 * <p>Failure handling:
 * <ul>
 *   <li>Fatal errors (syntax, binder, constraint, conversion) complete the
 *       execution at once, without a second attempt</li>
 *   <li>Retryable errors (connection, lock, transient I/O, pool exhaustion)
 *       are retried up to {@link RetryPolicy#maxAttempts()}; intermediate
 *       failures are logged, the last is surfaced as a
 *       {@link RetriesExhaustedException}</li>
 *   <li>Cancelling the returned future cancels a pending attempt or backoff;
 *       an attempt already running on the engine finishes but its result is
 *       discarded</li>
 * </ul>
 *
 * <p>Every execution records exactly one {@link MetricSample}, whichever way
 * it ends.
 *
 * <p>Example usage:
 * <pre>
 *   QueryExecutor executor = new QueryExecutor(pool, RetryPolicy.defaults(), metrics);
 *   QueryResult result = executor.submit(builder.build(request)).join();
 * </pre>
 *
 * @see DuckDBConnectionManager
 * @see RetryPolicy
 */
public class QueryExecutor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    private final DuckDBConnectionManager pool;
    private final RetryPolicy retryPolicy;
    private final MetricsAggregator metrics;
    private final StatementRunner runner;
    private final boolean queryLogging;
    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;
    private final Set<Execution> inFlight = ConcurrentHashMap.newKeySet();
    private volatile boolean closed = false;

    /**
     * Creates an executor with JDBC statement execution and SQL logging off.
     *
     * @param pool the connection pool
     * @param retryPolicy the retry policy
     * @param metrics the aggregator receiving one sample per execution
     */
    public QueryExecutor(DuckDBConnectionManager pool, RetryPolicy retryPolicy, MetricsAggregator metrics) {
        this(pool, retryPolicy, metrics, new JdbcStatementRunner(), false);
    }

    /**
     * Creates an executor.
     *
     * @param pool the connection pool; its size sets the worker count
     * @param retryPolicy the retry policy
     * @param metrics the aggregator receiving one sample per execution
     * @param runner runs statements on a connection
     * @param queryLogging whether compiled SQL text is logged
     */
    public QueryExecutor(DuckDBConnectionManager pool, RetryPolicy retryPolicy, MetricsAggregator metrics,
                         StatementRunner runner, boolean queryLogging) {
        this.pool = Objects.requireNonNull(pool, "pool must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.queryLogging = queryLogging;

        AtomicInteger workerIds = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(pool.getPoolSize(), r -> {
            Thread t = new Thread(r, "duckql-worker-" + workerIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "duckql-retry-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Submits a statement under a fresh correlation identifier.
     *
     * @param query the compiled statement
     * @return a future completing with the result, or exceptionally with a
     *         {@link DuckQLException}
     */
    public CompletableFuture<QueryResult> submit(CompiledQuery query) {
        return submit(query, DuckQLException.newCorrelationId());
    }

    /**
     * Submits a statement.
     *
     * @param query the compiled statement
     * @param correlationId identifier shared by all attempts, log lines and errors
     * @return a future completing with the result, or exceptionally with a
     *         {@link DuckQLException}
     */
    public CompletableFuture<QueryResult> submit(CompiledQuery query, String correlationId) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(correlationId, "correlationId must not be null");

        Execution execution = new Execution(query, correlationId);
        if (closed) {
            execution.fail(new ConnectionException("Query executor is closed").withCorrelationId(correlationId));
            return execution.future;
        }

        inFlight.add(execution);
        execution.future.whenComplete((result, error) -> {
            inFlight.remove(execution);
            if (execution.future.isCancelled()) {
                execution.onCancelled();
            }
        });
        execution.dispatch();
        return execution.future;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    /**
     * Stops accepting work. Pending executions are failed; executions
     * running on the engine finish first, up to a short grace period.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        scheduler.shutdownNow();
        for (Execution execution : new ArrayList<>(inFlight)) {
            execution.cancelPending();
            execution.fail(new ConnectionException("Query executor is closed")
                .withCorrelationId(execution.correlationId));
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Workers did not finish within 5s, interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Query executor closed");
    }

    /**
     * One submitted statement and its retry state.
     */
    private final class Execution {
        private final CompiledQuery query;
        private final String correlationId;
        private final CompletableFuture<QueryResult> future = new CompletableFuture<>();
        private final AtomicInteger attempts = new AtomicInteger();
        private final AtomicBoolean recorded = new AtomicBoolean();
        private final Instant submittedAt = Instant.now();
        private final long startNanos = System.nanoTime();
        private volatile Future<?> pending;

        Execution(CompiledQuery query, String correlationId) {
            this.query = query;
            this.correlationId = correlationId;
        }

        void dispatch() {
            try {
                pending = workers.submit(this::runAttempt);
            } catch (RejectedExecutionException e) {
                fail(new ConnectionException("Query executor is closed", e).withCorrelationId(correlationId));
            }
        }

        void runAttempt() {
            if (future.isDone()) {
                return;
            }
            int attempt = attempts.incrementAndGet();
            QueryLogger.startQuery(correlationId);
            try {
                if (attempt == 1) {
                    QueryLogger.logStart(query);
                    QueryLogger.logCompilation(query, queryLogging);
                }

                long execStart = System.nanoTime();
                StatementRunner.Rows rows;
                try (PooledConnection conn = pool.borrowConnection()) {
                    rows = runner.run(conn.get(), query);
                }
                long execMs = (System.nanoTime() - execStart) / 1_000_000;

                QueryResult result = shape(rows, attempt);
                QueryLogger.logExecution(execMs, result.rowCount());
                QueryLogger.completeQuery(result.elapsed().toMillis(), attempt);

                if (recorded.compareAndSet(false, true)) {
                    metrics.ingest(MetricSample.success(correlationId, query.table(), query.kind(),
                        result.elapsed(), submittedAt, result.rowCount(), attempt - 1));
                }
                future.complete(result);
            } catch (SQLException e) {
                onFailure(ErrorClassifier.classify(e, query.sql(), query.table()), attempt);
            } catch (DuckQLException e) {
                onFailure(e, attempt);
            } catch (RuntimeException e) {
                onFailure(new QueryExecutionException(
                    "Failed to materialize results: " + e.getMessage(), e, query.sql()), attempt);
            } catch (Error e) {
                // the caller's future must be completed before rethrowing
                DuckQLException aborted = new QueryExecutionException(
                    "Execution aborted: " + e, e, query.sql()).withCorrelationId(correlationId);
                QueryLogger.logError(aborted);
                fail(aborted);
                throw e;
            } finally {
                QueryLogger.clearContext();
            }
        }

        private void onFailure(DuckQLException error, int attempt) {
            error.withCorrelationId(correlationId);

            if (retryPolicy.shouldRetry(error, attempt) && !closed) {
                Duration delay = retryPolicy.delayAfter(attempt);
                QueryLogger.logAttemptFailure(attempt, error, delay.toMillis());
                if (future.isDone()) {
                    return;
                }
                try {
                    pending = scheduler.schedule(this::dispatch, delay.toNanos(), TimeUnit.NANOSECONDS);
                } catch (RejectedExecutionException e) {
                    fail(new ConnectionException("Query executor is closed", e).withCorrelationId(correlationId));
                }
                return;
            }

            DuckQLException surfaced = retryPolicy.retryable().test(error)
                ? new RetriesExhaustedException(error, attempt, correlationId)
                : error;
            QueryLogger.logError(surfaced);
            fail(surfaced);
        }

        void fail(DuckQLException error) {
            if (recorded.compareAndSet(false, true)) {
                metrics.ingest(MetricSample.failure(correlationId, query.table(), query.kind(), elapsed(),
                    submittedAt, Math.max(0, attempts.get() - 1), error.getKind(), error.getMessage()));
            }
            future.completeExceptionally(error);
        }

        void onCancelled() {
            cancelPending();
            if (recorded.compareAndSet(false, true)) {
                DuckQLException cancelled = new QueryCancelledException(query.table()).withCorrelationId(correlationId);
                metrics.ingest(MetricSample.failure(correlationId, query.table(), query.kind(), elapsed(),
                    submittedAt, Math.max(0, attempts.get() - 1), cancelled.getKind(), cancelled.getMessage()));
                logger.debug("Execution {} cancelled after {} attempt(s)", correlationId, attempts.get());
            }
        }

        void cancelPending() {
            Future<?> task = pending;
            if (task != null) {
                task.cancel(false);
            }
        }

        private Duration elapsed() {
            return Duration.ofNanos(System.nanoTime() - startNanos);
        }

        /**
         * Adds computed fields and trims rows to the requested columns.
         */
        private QueryResult shape(StatementRunner.Rows rows, int attempt) {
            List<String> columns = query.resultColumns().isEmpty() ? rows.columns() : query.resultColumns();
            boolean trim = query.hasComputedFields() || !columns.equals(rows.columns());

            List<Map<String, Object>> shaped = rows.rows();
            if (trim) {
                shaped = new ArrayList<>(rows.rows().size());
                for (Map<String, Object> row : rows.rows()) {
                    Map<String, Object> full = row;
                    if (query.hasComputedFields()) {
                        full = new LinkedHashMap<>(row);
                        for (ComputedField field : query.computedFields()) {
                            full.put(field.name(), field.apply(row));
                        }
                    }
                    Map<String, Object> out = new LinkedHashMap<>();
                    for (String column : columns) {
                        out.put(column, full.get(column));
                    }
                    shaped.add(out);
                }
            }
            return new QueryResult(shaped, columns, elapsed(), attempt, correlationId);
        }
    }
}
