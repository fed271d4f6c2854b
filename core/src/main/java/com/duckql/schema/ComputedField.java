package com.duckql.schema;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * A field derived from other columns of a materialized row.
 *
 * @param table the table the field belongs to
 * @param name the field name as selected by callers
 * @param sourceColumns the real columns the resolver reads
 * @param resolver pure function from the row to the field value
 */
public record ComputedField(String table, String name, List<String> sourceColumns,
                            Function<Map<String, Object>, Object> resolver) {

    public ComputedField {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(resolver, "resolver must not be null");
        sourceColumns = List.copyOf(sourceColumns);
    }

    /**
     * Computes the field for one row.
     *
     * @param row the materialized row, containing at least the source columns
     * @return the computed value
     */
    public Object apply(Map<String, Object> row) {
        return resolver.apply(row);
    }
}
