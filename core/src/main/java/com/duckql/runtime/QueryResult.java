package com.duckql.runtime;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rows returned by one execution.
 *
 * @param rows column-to-value maps in result order, each iterating in column order
 * @param columns the result columns
 * @param elapsed wall time from submission to completion, retries included
 * @param attempts attempts used (1 if the first succeeded)
 * @param correlationId the execution's correlation identifier
 */
public record QueryResult(List<Map<String, Object>> rows, List<String> columns,
                          Duration elapsed, int attempts, String correlationId) {

    public QueryResult {
        rows = List.copyOf(rows);
        columns = List.copyOf(columns);
        Objects.requireNonNull(elapsed, "elapsed must not be null");
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Returns the first row, or null if there is none. Single-item
     * operations return at most one row.
     *
     * @return the first row, or null
     */
    public Map<String, Object> firstRow() {
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Returns one column's values in row order.
     *
     * @param column the column name
     * @return the values
     * @throws IllegalArgumentException if the column is not in the result
     */
    public List<Object> column(String column) {
        if (!columns.contains(column)) {
            throw new IllegalArgumentException("Column '" + column + "' is not in the result " + columns);
        }
        return rows.stream().map(row -> row.get(column)).toList();
    }
}
