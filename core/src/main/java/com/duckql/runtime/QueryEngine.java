package com.duckql.runtime;

import com.duckql.config.EngineConfig;
import com.duckql.exception.DuckQLException;
import com.duckql.generator.CompiledQuery;
import com.duckql.generator.QueryBuilder;
import com.duckql.generator.QueryRequest;
import com.duckql.logging.QueryLogger;
import com.duckql.metrics.MetricsAggregator;
import com.duckql.metrics.MetricsSnapshot;
import com.duckql.schema.ComputedField;
import com.duckql.schema.ComputedFieldRegistry;
import com.duckql.schema.SchemaIntrospector;
import com.duckql.schema.SchemaRegistry;
import com.duckql.validation.QueryDepthGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * Owns everything needed to answer query requests against one database:
 * connection pool, executor, metrics, schema and computed-field registries
 * and the depth guard.
 *
 * <p>An engine is constructed explicitly, started once and closed once;
 * there is no shared global state, so several engines can coexist.
 * <pre>
 *   try (QueryEngine engine = new QueryEngine(EngineConfig.defaults().withMaxQueryDepth(5))) {
 *       engine.start();
 *       QueryResult result = engine.execute(QueryRequest.list("sales").limit(10).build());
 *       MetricsSnapshot metrics = engine.metrics();
 *   }
 * </pre>
 *
 * <p>Request flow: depth guard, then compilation, then the executor.
 * Validation errors are thrown from the calling thread and never reach the
 * executor; execution errors complete the returned future.
 */
public class QueryEngine implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

    private final EngineConfig config;
    private final SchemaRegistry suppliedSchemas;
    private final StatementRunner runner;

    private DuckDBConnectionManager pool;
    private QueryExecutor executor;
    private MetricsAggregator metrics;
    private SchemaRegistry schemas;
    private ComputedFieldRegistry computedFields;
    private QueryBuilder builder;
    private QueryDepthGuard depthGuard;
    private volatile State state = State.NEW;

    private enum State {
        NEW, RUNNING, CLOSED
    }

    /**
     * Creates an engine whose schema is read from the database at start.
     *
     * @param config the configuration
     */
    public QueryEngine(EngineConfig config) {
        this(config, null, new JdbcStatementRunner());
    }

    /**
     * Creates an engine over an externally supplied schema.
     *
     * @param config the configuration
     * @param schemas the schema registry, or null to introspect at start
     */
    public QueryEngine(EngineConfig config, SchemaRegistry schemas) {
        this(config, schemas, new JdbcStatementRunner());
    }

    /**
     * Creates an engine with a custom statement runner.
     *
     * @param config the configuration
     * @param schemas the schema registry, or null to introspect at start
     * @param runner runs statements on pooled connections
     */
    public QueryEngine(EngineConfig config, SchemaRegistry schemas, StatementRunner runner) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.suppliedSchemas = schemas;
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
    }

    /**
     * Opens the pool, loads the schema if none was supplied and starts the
     * executor.
     *
     * @return this engine
     * @throws IllegalStateException if already started or closed
     */
    public synchronized QueryEngine start() {
        if (state != State.NEW) {
            throw new IllegalStateException("Engine cannot be started in state " + state);
        }

        DuckDBConnectionManager.Configuration poolConfig = config.databasePath == null
            ? DuckDBConnectionManager.Configuration.inMemory()
            : DuckDBConnectionManager.Configuration.persistent(config.databasePath);
        poolConfig.withPoolSize(config.effectivePoolSize()).withAcquireTimeout(config.acquireTimeout);

        this.pool = new DuckDBConnectionManager(poolConfig);
        try {
            this.schemas = suppliedSchemas != null ? suppliedSchemas : introspect(pool);
            this.computedFields = new ComputedFieldRegistry(schemas);
            this.builder = new QueryBuilder(schemas, computedFields);
            this.depthGuard = QueryDepthGuard.of(config.maxQueryDepth);
            this.metrics = new MetricsAggregator(config.metricsCapacity, config.slowQueryThreshold,
                config.slowQueryListSize, config.recentErrorListSize, pool::statistics);
            this.executor = new QueryExecutor(pool, RetryPolicy.fromConfig(config), metrics, runner,
                config.queryLogging);
        } catch (RuntimeException e) {
            pool.close();
            state = State.CLOSED;
            throw e;
        }

        state = State.RUNNING;
        logger.info("Query engine started: {} tables, {}", schemas.size(), config);
        return this;
    }

    private static SchemaRegistry introspect(DuckDBConnectionManager pool) {
        try (PooledConnection conn = pool.borrowConnection()) {
            return new SchemaIntrospector(conn.get()).introspect();
        }
    }

    /**
     * Registers a computed field for a table.
     *
     * @param table the table
     * @param name the field name
     * @param sourceColumns columns the resolver reads
     * @param resolver pure function of the row
     * @return the registered field
     * @throws com.duckql.exception.ValidationException if the registration
     *         does not fit the schema
     */
    public ComputedField registerComputedField(String table, String name, List<String> sourceColumns,
                                               Function<Map<String, Object>, Object> resolver) {
        requireRunning();
        return computedFields.register(table, name, sourceColumns, resolver);
    }

    /**
     * Validates and compiles a request without running it.
     *
     * @param request the request
     * @return the compiled statement
     * @throws com.duckql.exception.ValidationException if the request is too
     *         deep or does not fit the schema
     */
    public CompiledQuery compile(QueryRequest request) {
        requireRunning();
        Objects.requireNonNull(request, "request must not be null");
        depthGuard.check(request.selection());
        return builder.build(request);
    }

    /**
     * Validates, compiles and submits a request.
     *
     * @param request the request
     * @return a future completing with the result
     * @throws com.duckql.exception.ValidationException (synchronously) if the
     *         request is invalid; the exception carries the request's
     *         correlation identifier
     */
    public CompletableFuture<QueryResult> submit(QueryRequest request) {
        String correlationId = DuckQLException.newCorrelationId();
        return executor.submit(compileFor(request, correlationId), correlationId);
    }

    /**
     * Runs a request and waits for the result.
     *
     * @param request the request
     * @return the result
     * @throws DuckQLException if validation or execution fails
     */
    public QueryResult execute(QueryRequest request) {
        return await(submit(request));
    }

    /**
     * Runs several requests concurrently and returns their results in
     * request order. All requests are validated before any is submitted.
     *
     * @param requests the requests
     * @return the results, one per request
     * @throws DuckQLException the first failure in request order
     */
    public List<QueryResult> executeAll(List<QueryRequest> requests) {
        Objects.requireNonNull(requests, "requests must not be null");

        List<String> ids = new ArrayList<>(requests.size());
        List<CompiledQuery> compiled = new ArrayList<>(requests.size());
        for (QueryRequest request : requests) {
            String correlationId = DuckQLException.newCorrelationId();
            ids.add(correlationId);
            compiled.add(compileFor(request, correlationId));
        }

        List<CompletableFuture<QueryResult>> futures = new ArrayList<>(compiled.size());
        for (int i = 0; i < compiled.size(); i++) {
            futures.add(executor.submit(compiled.get(i), ids.get(i)));
        }

        List<QueryResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<QueryResult> future : futures) {
            results.add(await(future));
        }
        return results;
    }

    private CompiledQuery compileFor(QueryRequest request, String correlationId) {
        requireRunning();
        QueryLogger.startQuery(correlationId);
        try {
            return compile(request);
        } catch (DuckQLException e) {
            e.withCorrelationId(correlationId);
            logger.debug("Rejected {}: {}", request, e.getMessage());
            throw e;
        } finally {
            QueryLogger.clearContext();
        }
    }

    private static QueryResult await(CompletableFuture<QueryResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof DuckQLException) {
                throw (DuckQLException) e.getCause();
            }
            throw e;
        }
    }

    /**
     * Summarizes executions since start or the last reset.
     *
     * @return the metrics snapshot
     */
    public MetricsSnapshot metrics() {
        requireRunning();
        return metrics.summarize();
    }

    public MetricsAggregator metricsAggregator() {
        requireRunning();
        return metrics;
    }

    public PoolStatistics poolStatistics() {
        requireRunning();
        return pool.statistics();
    }

    public SchemaRegistry schemas() {
        requireRunning();
        return schemas;
    }

    public QueryDepthGuard depthGuard() {
        requireRunning();
        return depthGuard;
    }

    public boolean isRunning() {
        return state == State.RUNNING;
    }

    private void requireRunning() {
        if (state != State.RUNNING) {
            throw new IllegalStateException("Query engine is not running (state " + state + ")");
        }
    }

    /**
     * Stops the executor and closes the pool. Safe to call more than once.
     */
    @Override
    public synchronized void close() {
        if (state == State.CLOSED) {
            return;
        }
        boolean wasRunning = state == State.RUNNING;
        state = State.CLOSED;
        if (wasRunning) {
            executor.close();
            pool.close();
            logger.info("Query engine closed");
        }
    }
}
