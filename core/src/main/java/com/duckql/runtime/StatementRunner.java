package com.duckql.runtime;

import com.duckql.generator.CompiledQuery;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Runs one compiled statement on one connection and materializes its rows.
 *
 * <p>The executor owns connection handling, retries and metrics; a runner
 * only talks to the engine. {@link JdbcStatementRunner} is the production
 * implementation.
 */
@FunctionalInterface
public interface StatementRunner {

    /**
     * Executes a statement.
     *
     * @param connection the connection, exclusively owned for the call
     * @param query the compiled statement
     * @return the materialized rows
     * @throws SQLException if the engine reports a failure
     */
    Rows run(Connection connection, CompiledQuery query) throws SQLException;

    /**
     * Materialized rows: column names in projection order, and one
     * column-to-value map per row, iterating in the same order.
     */
    record Rows(List<String> columns, List<Map<String, Object>> rows) {
        public Rows {
            columns = List.copyOf(columns);
            rows = List.copyOf(rows);
        }
    }
}
