package com.duckql.generator;

import java.util.Objects;

/**
 * One ordering term: a column and a direction.
 */
public record OrderBy(String column, Direction direction) {

    public enum Direction {
        ASC, DESC
    }

    public OrderBy {
        Objects.requireNonNull(column, "column must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
    }

    public static OrderBy asc(String column) {
        return new OrderBy(column, Direction.ASC);
    }

    public static OrderBy desc(String column) {
        return new OrderBy(column, Direction.DESC);
    }
}
