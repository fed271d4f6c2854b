package com.duckql.generator;

import java.util.Objects;

/**
 * An aggregate column of an aggregate operation, e.g. {@code SUM(amount)}
 * exposed as {@code sum_amount}.
 */
public record Aggregation(AggregateFunction function, String column) {

    /** Output name of the unconditional row count. */
    public static final String COUNT_ALIAS = "_count";

    public Aggregation {
        Objects.requireNonNull(function, "function must not be null");
        Objects.requireNonNull(column, "column must not be null");
    }

    public static Aggregation of(AggregateFunction function, String column) {
        return new Aggregation(function, column);
    }

    public static Aggregation sum(String column) {
        return new Aggregation(AggregateFunction.SUM, column);
    }

    public static Aggregation avg(String column) {
        return new Aggregation(AggregateFunction.AVG, column);
    }

    public static Aggregation min(String column) {
        return new Aggregation(AggregateFunction.MIN, column);
    }

    public static Aggregation max(String column) {
        return new Aggregation(AggregateFunction.MAX, column);
    }

    public static Aggregation count(String column) {
        return new Aggregation(AggregateFunction.COUNT, column);
    }

    /**
     * Returns the output column name: {@code <function>_<column>}.
     *
     * @return the output name
     */
    public String outputName() {
        return function.prefix() + "_" + column;
    }

    /**
     * Renders the aggregate expression.
     *
     * @return e.g. {@code SUM(amount)}
     */
    public String toSQL() {
        return function.name() + "(" + SQLQuoting.quoteIdentifierIfNeeded(column) + ")";
    }
}
