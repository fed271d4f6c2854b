package com.duckql.filter;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A compiled filter: SQL with {@code ?} placeholders and the values to bind,
 * in placeholder order.
 */
public record CompiledPredicate(String sql, List<Object> params) {

    public CompiledPredicate {
        Objects.requireNonNull(sql, "sql must not be null");
        params = Collections.unmodifiableList(List.copyOf(params));
    }

    public int placeholderCount() {
        return params.size();
    }
}
