package com.duckql.filter;

import com.duckql.exception.ValidationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A node of a filter expression tree: either a {@link Comparison} leaf or a
 * {@link Logical} connective over child nodes.
 *
 * <p>Trees are built directly with the factories here, or parsed from the
 * nested-map form produced by the request layer:
 * <pre>
 *   {"_and": [{"region": {"eq": "North"}}, {"amount": {"gte": 500}}]}
 * </pre>
 */
public sealed interface FilterNode permits FilterNode.Comparison, FilterNode.Logical {

    /** Logical connectives. */
    enum LogicalKind {
        AND, OR, NOT
    }

    /**
     * Leaf comparison {@code column operator value}.
     */
    record Comparison(String column, FilterOperator operator, Object value) implements FilterNode {
        public Comparison {
            Objects.requireNonNull(column, "column must not be null");
            Objects.requireNonNull(operator, "operator must not be null");
        }
    }

    /**
     * Connective over child filters. NOT takes exactly one child; AND and OR
     * take at least one. Arity is checked at compilation.
     */
    record Logical(LogicalKind kind, List<FilterNode> children) implements FilterNode {
        public Logical {
            Objects.requireNonNull(kind, "kind must not be null");
            children = children == null ? Collections.emptyList() : List.copyOf(children);
        }
    }

    static Comparison compare(String column, FilterOperator operator, Object value) {
        return new Comparison(column, operator, value);
    }

    static Comparison compare(String column, String operator, Object value) {
        return new Comparison(column, FilterOperator.fromName(operator), value);
    }

    static Comparison eq(String column, Object value) {
        return new Comparison(column, FilterOperator.EQ, value);
    }

    static Comparison isNull(String column) {
        return new Comparison(column, FilterOperator.IS_NULL, Boolean.TRUE);
    }

    static Logical and(FilterNode... children) {
        return new Logical(LogicalKind.AND, Arrays.asList(children));
    }

    static Logical or(FilterNode... children) {
        return new Logical(LogicalKind.OR, Arrays.asList(children));
    }

    static Logical not(FilterNode child) {
        return new Logical(LogicalKind.NOT, List.of(child));
    }

    /**
     * Parses the nested-map filter form.
     *
     * <p>Keys {@code _and} and {@code _or} take a list of filter maps,
     * {@code _not} takes one filter map; any other key is a column name
     * mapped to {@code {operator: value}}. Several keys in one map are
     * combined with AND, in map iteration order.
     *
     * @param filter the filter map
     * @return the filter tree
     * @throws ValidationException if the map is not a well-formed filter
     */
    @SuppressWarnings("unchecked")
    static FilterNode parse(Map<String, ?> filter) {
        if (filter == null || filter.isEmpty()) {
            throw ValidationException.malformed(null, "Filter must not be empty", null);
        }

        List<FilterNode> nodes = new ArrayList<>();
        for (Map.Entry<String, ?> entry : filter.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            switch (key) {
                case "_and":
                case "_or": {
                    if (!(value instanceof List)) {
                        throw ValidationException.malformed(null,
                            "'" + key + "' expects a list of filters", null);
                    }
                    List<FilterNode> children = new ArrayList<>();
                    for (Object child : (List<?>) value) {
                        children.add(parse(asFilterMap(key, child)));
                    }
                    nodes.add(new Logical("_and".equals(key) ? LogicalKind.AND : LogicalKind.OR, children));
                    break;
                }
                case "_not":
                    nodes.add(not(parse(asFilterMap(key, value))));
                    break;
                default: {
                    if (!(value instanceof Map)) {
                        throw ValidationException.malformed(null,
                            "Filter on '" + key + "' expects an {operator: value} object", null);
                    }
                    for (Map.Entry<String, ?> op : ((Map<String, ?>) value).entrySet()) {
                        nodes.add(compare(key, op.getKey(), op.getValue()));
                    }
                }
            }
        }
        return nodes.size() == 1 ? nodes.get(0) : new Logical(LogicalKind.AND, nodes);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> asFilterMap(String key, Object value) {
        if (!(value instanceof Map)) {
            throw ValidationException.malformed(null, "'" + key + "' expects filter objects", null);
        }
        return (Map<String, ?>) value;
    }
}
