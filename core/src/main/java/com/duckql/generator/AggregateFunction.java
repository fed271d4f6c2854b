package com.duckql.generator;

import com.duckql.schema.ColumnType;

import java.util.Locale;

/**
 * Aggregate functions available in aggregate operations.
 */
public enum AggregateFunction {

    SUM, AVG, MIN, MAX, COUNT;

    /**
     * Returns whether the function can be applied to a column of the given
     * category. SUM and AVG need numbers, MIN and MAX an ordering, COUNT
     * anything.
     *
     * @param type the column category
     * @return true if applicable
     */
    public boolean appliesTo(ColumnType type) {
        switch (this) {
            case SUM:
            case AVG:
                return type.isNumeric();
            case MIN:
            case MAX:
                return type.isOrdered();
            default:
                return true;
        }
    }

    /**
     * Returns the DuckDB type name of the function's result, for checking
     * HAVING values.
     *
     * @param inputType the declared type of the aggregated column
     * @param inputCategory the category of the aggregated column
     * @return the result type name
     */
    public String resultType(String inputType, ColumnType inputCategory) {
        switch (this) {
            case SUM:
                return inputCategory == ColumnType.INTEGER ? "HUGEINT"
                    : inputCategory == ColumnType.DECIMAL ? "DECIMAL" : "DOUBLE";
            case AVG:
                return "DOUBLE";
            case COUNT:
                return "BIGINT";
            default:
                return inputType;
        }
    }

    public String prefix() {
        return name().toLowerCase(Locale.ROOT);
    }
}
