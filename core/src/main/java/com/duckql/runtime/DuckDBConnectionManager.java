package com.duckql.runtime;

import com.duckql.exception.ConnectionException;
import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-size pool of DuckDB connections to one database.
 *
 * <p>All pooled connections are duplicates of a single root connection, so
 * they share one database instance; for an in-memory database this is the
 * only way for several connections to see the same tables.
 *
 * <p>The free list is the single point of mutual exclusion: a connection is
 * owned by whoever took it off the list until it is released. Each slot
 * also carries a busy flag, flipped with compare-and-set on acquire and
 * release, so a double release is detected and ignored instead of putting
 * a connection on the list twice.
 *
 * <p>Example usage:
 * <pre>
 *   try (DuckDBConnectionManager manager =
 *            new DuckDBConnectionManager(Configuration.inMemory().withPoolSize(4))) {
 *       try (PooledConnection conn = manager.borrowConnection()) {
 *           // Execute queries...
 *       }
 *   }
 * </pre>
 *
 * @see PooledConnection
 * @see QueryExecutor
 */
public class DuckDBConnectionManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBConnectionManager.class);

    private final String jdbcUrl;
    private final DuckDBConnection root;
    private final BlockingQueue<PoolEntry> freeList;
    private final int poolSize;
    private final Duration acquireTimeout;
    private volatile boolean closed = false;

    private final AtomicInteger inUse = new AtomicInteger();
    private final AtomicInteger peakInUse = new AtomicInteger();
    private final AtomicLong acquisitions = new AtomicLong();
    private final AtomicLong timeouts = new AtomicLong();
    private final AtomicLong replacements = new AtomicLong();
    private final AtomicLong totalWaitNanos = new AtomicLong();

    /**
     * Creates a connection manager with default in-memory configuration.
     */
    public DuckDBConnectionManager() {
        this(Configuration.inMemory());
    }

    /**
     * Creates a connection manager with the specified configuration.
     *
     * @param config the configuration
     * @throws ConnectionException if the database cannot be opened
     */
    public DuckDBConnectionManager(Configuration config) {
        Objects.requireNonNull(config, "config must not be null");

        this.jdbcUrl = config.inMemory ? "jdbc:duckdb:" : "jdbc:duckdb:" + config.databasePath;
        this.poolSize = config.poolSize > 0 ? config.poolSize :
                        Math.min(Runtime.getRuntime().availableProcessors(), 8);
        this.acquireTimeout = config.acquireTimeout;
        this.freeList = new ArrayBlockingQueue<>(poolSize);

        List<PoolEntry> created = new ArrayList<>(poolSize);
        DuckDBConnection rootConnection = null;
        try {
            rootConnection = openRoot();
            for (int i = 0; i < poolSize; i++) {
                PoolEntry entry = new PoolEntry(i, duplicate(rootConnection));
                created.add(entry);
                freeList.offer(entry);
            }
        } catch (SQLException e) {
            for (PoolEntry entry : created) {
                closeQuietly(entry.connection);
            }
            if (rootConnection != null) {
                closeQuietly(rootConnection);
            }
            throw new ConnectionException("Failed to initialize connection pool for " + jdbcUrl, e);
        }

        this.root = rootConnection;
        logger.info("Connection pool ready: {} connections to {}", poolSize, jdbcUrl);
    }

    /**
     * Borrows a connection, waiting up to the configured acquire timeout for
     * one to become free.
     *
     * @return an exclusive loan that returns the connection when closed
     * @throws ConnectionException if the pool is closed, exhausted for the
     *         whole timeout, or the wait is interrupted
     */
    public PooledConnection borrowConnection() {
        if (closed) {
            throw new ConnectionException("Connection manager is closed");
        }

        long waitStart = System.nanoTime();
        PoolEntry entry;
        try {
            entry = freeList.poll(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("Interrupted while waiting for connection", e);
        }

        if (entry == null) {
            timeouts.incrementAndGet();
            throw new ConnectionException("Connection pool exhausted - timeout after "
                + acquireTimeout.toMillis() + "ms", null, Map.<String, Object>of("pool_size", poolSize));
        }

        if (!entry.busy.compareAndSet(false, true)) {
            throw new IllegalStateException("Pool slot " + entry.slot + " was on the free list while owned");
        }

        if (closed) {
            entry.busy.set(false);
            closeQuietly(entry.connection);
            throw new ConnectionException("Connection manager is closed");
        }

        totalWaitNanos.addAndGet(System.nanoTime() - waitStart);
        acquisitions.incrementAndGet();
        int owned = inUse.incrementAndGet();
        peakInUse.accumulateAndGet(owned, Math::max);

        if (!isConnectionValid(entry.connection)) {
            replace(entry);
        }

        return new PooledConnection(entry, this);
    }

    /**
     * Returns a slot to the free list. Invalid connections are replaced
     * first; after shutdown the connection is closed instead.
     */
    void release(PoolEntry entry) {
        if (!entry.busy.compareAndSet(true, false)) {
            logger.warn("Ignoring release of pool slot {} that is not owned", entry.slot);
            return;
        }
        inUse.decrementAndGet();

        if (closed) {
            closeQuietly(entry.connection);
            return;
        }

        if (!isConnectionValid(entry.connection)) {
            logger.warn("Invalid connection detected in slot {}, replacing", entry.slot);
            replace(entry);
        }

        if (!freeList.offer(entry)) {
            logger.warn("Free list full, closing connection of slot {}", entry.slot);
            closeQuietly(entry.connection);
        }
    }

    private void replace(PoolEntry entry) {
        closeQuietly(entry.connection);
        try {
            entry.connection = duplicate(root);
            replacements.incrementAndGet();
        } catch (SQLException e) {
            logger.warn("Failed to create replacement connection for slot {}: {}", entry.slot, e.getMessage());
        }
    }

    private boolean isConnectionValid(DuckDBConnection conn) {
        try {
            return conn != null && !conn.isClosed() && conn.isValid(5);
        } catch (SQLException e) {
            return false;
        }
    }

    private DuckDBConnection openRoot() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        DuckDBConnection duckConn = conn.unwrap(DuckDBConnection.class);

        try (Statement stmt = duckConn.createStatement()) {
            // Non-interactive use
            stmt.execute("SET enable_progress_bar=false");
        }
        return duckConn;
    }

    private static DuckDBConnection duplicate(DuckDBConnection root) throws SQLException {
        return (DuckDBConnection) root.duplicate();
    }

    private static void closeQuietly(DuckDBConnection conn) {
        try {
            if (conn != null && !conn.isClosed()) {
                conn.close();
            }
        } catch (SQLException e) {
            logger.debug("Error closing connection: {}", e.getMessage());
        }
    }

    /**
     * Returns current pool usage.
     *
     * @return the statistics
     */
    public PoolStatistics statistics() {
        long acquired = acquisitions.get();
        double averageWait = acquired == 0 ? 0.0 : totalWaitNanos.get() / 1_000_000.0 / acquired;
        return new PoolStatistics(poolSize, inUse.get(), freeList.size(), peakInUse.get(),
                                  acquired, timeouts.get(), replacements.get(), averageWait);
    }

    /**
     * Closes the pool. Free connections are closed now; connections still on
     * loan are closed when released.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        PoolEntry entry;
        while ((entry = freeList.poll()) != null) {
            closeQuietly(entry.connection);
        }
        closeQuietly(root);

        logger.info("Connection pool closed ({} acquisitions, {} timeouts)", acquisitions.get(), timeouts.get());
    }

    public int getPoolSize() {
        return poolSize;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * A pool slot: a connection and its ownership flag.
     */
    static final class PoolEntry {
        private final int slot;
        private final AtomicBoolean busy = new AtomicBoolean(false);
        private volatile DuckDBConnection connection;

        PoolEntry(int slot, DuckDBConnection connection) {
            this.slot = slot;
            this.connection = connection;
        }

        int slot() {
            return slot;
        }

        DuckDBConnection connection() {
            return connection;
        }
    }

    /**
     * Configuration for the connection manager.
     */
    public static class Configuration {
        /** Whether to use in-memory database */
        public boolean inMemory = true;

        /** Database file path (for persistent databases) */
        public String databasePath = null;

        /** Connection pool size (0 = auto-detect) */
        public int poolSize = 0;

        /** Longest wait for a free connection */
        public Duration acquireTimeout = Duration.ofSeconds(30);

        public static Configuration inMemory() {
            return new Configuration();
        }

        public static Configuration persistent(String path) {
            Configuration config = new Configuration();
            config.inMemory = false;
            config.databasePath = Objects.requireNonNull(path, "path must not be null");
            return config;
        }

        public Configuration withPoolSize(int size) {
            if (size < 0) {
                throw new IllegalArgumentException("poolSize must be non-negative");
            }
            this.poolSize = size;
            return this;
        }

        public Configuration withAcquireTimeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout must not be null");
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("acquireTimeout must be positive");
            }
            this.acquireTimeout = timeout;
            return this;
        }
    }
}
