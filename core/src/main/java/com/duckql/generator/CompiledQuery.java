package com.duckql.generator;

import com.duckql.schema.ComputedField;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A compiled statement ready for execution.
 *
 * <p>{@code params} are positional, one per {@code ?} in {@code sql}.
 * {@code resultColumns} lists the fields the caller asked for, in request
 * order; the SQL projection may contain more (source columns of computed
 * fields), which the executor trims after computing {@code computedFields}.
 *
 * <p>Compilation is pure, so a {@code CompiledQuery} is reused unchanged
 * across retry attempts.
 */
public record CompiledQuery(String sql, List<Object> params, String table, OperationKind kind,
                            List<String> resultColumns, List<ComputedField> computedFields) {

    public CompiledQuery {
        Objects.requireNonNull(sql, "sql must not be null");
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        params = Collections.unmodifiableList(List.copyOf(params));
        resultColumns = List.copyOf(resultColumns);
        computedFields = computedFields == null ? List.of() : List.copyOf(computedFields);
    }

    /**
     * Creates a query with no computed fields whose result columns are
     * exactly the projection. Used for ad-hoc statements.
     */
    public static CompiledQuery raw(String sql, List<Object> params, String table,
                                    OperationKind kind, List<String> resultColumns) {
        return new CompiledQuery(sql, params, table, kind, resultColumns, List.of());
    }

    public boolean hasComputedFields() {
        return !computedFields.isEmpty();
    }
}
