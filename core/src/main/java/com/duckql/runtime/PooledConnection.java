package com.duckql.runtime;

import org.duckdb.DuckDBConnection;

import java.util.Objects;

/**
 * Exclusive loan of a pooled DuckDB connection.
 *
 * <p>Implements the loan pattern: the connection goes back to the pool when
 * this handle is closed, on every exit path.
 * <pre>
 *   try (PooledConnection conn = manager.borrowConnection()) {
 *       runner.run(conn.get(), query);
 *   } // released here, also on exception
 * </pre>
 *
 * <p>A handle belongs to one execution and is not shared between threads.
 *
 * @see DuckDBConnectionManager
 */
public class PooledConnection implements AutoCloseable {

    private final DuckDBConnectionManager.PoolEntry entry;
    private final DuckDBConnectionManager manager;
    private boolean released = false;

    PooledConnection(DuckDBConnectionManager.PoolEntry entry, DuckDBConnectionManager manager) {
        this.entry = Objects.requireNonNull(entry, "entry must not be null");
        this.manager = Objects.requireNonNull(manager, "manager must not be null");
    }

    /**
     * Returns the underlying DuckDB connection.
     *
     * @return the connection
     * @throws IllegalStateException if the loan was already returned
     */
    public DuckDBConnection get() {
        if (released) {
            throw new IllegalStateException("Connection already released to pool");
        }
        return entry.connection();
    }

    /**
     * Returns the pool slot this loan holds.
     *
     * @return the slot number, from 0 to pool size - 1
     */
    public int slot() {
        return entry.slot();
    }

    /**
     * Returns the connection to the pool. Idempotent.
     */
    @Override
    public void close() {
        if (!released) {
            released = true;
            manager.release(entry);
        }
    }

    public boolean isReleased() {
        return released;
    }
}
