package com.duckql.schema;

import java.util.Objects;

/**
 * A column of a {@link TableSchema}: name, declared DuckDB type, type
 * category and nullability.
 */
public record ColumnSchema(String name, String declaredType, ColumnType type,
                           boolean nullable, boolean primaryKey) {

    public ColumnSchema {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(declaredType, "declaredType must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    /**
     * Creates a nullable, non-key column, deriving the category from the
     * declared type.
     *
     * @param name the column name
     * @param declaredType the DuckDB type name
     * @return the column
     */
    public static ColumnSchema of(String name, String declaredType) {
        return new ColumnSchema(name, declaredType, ColumnType.fromDuckDB(declaredType), true, false);
    }

    /**
     * Creates a column, deriving the category from the declared type.
     *
     * @param name the column name
     * @param declaredType the DuckDB type name
     * @param nullable whether the column accepts NULL
     * @return the column
     */
    public static ColumnSchema of(String name, String declaredType, boolean nullable) {
        return new ColumnSchema(name, declaredType, ColumnType.fromDuckDB(declaredType), nullable, false);
    }

    /**
     * Creates a non-null primary-key column.
     *
     * @param name the column name
     * @param declaredType the DuckDB type name
     * @return the column
     */
    public static ColumnSchema primaryKey(String name, String declaredType) {
        return new ColumnSchema(name, declaredType, ColumnType.fromDuckDB(declaredType), false, true);
    }

    @Override
    public String toString() {
        return name + ": " + declaredType + (nullable ? "" : " NOT NULL") + (primaryKey ? " PRIMARY KEY" : "");
    }
}
