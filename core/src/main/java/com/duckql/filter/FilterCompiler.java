package com.duckql.filter;

import com.duckql.exception.ValidationException;
import com.duckql.generator.SQLQuoting;
import com.duckql.schema.ColumnSchema;
import com.duckql.schema.TableSchema;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Compiles a {@link FilterNode} tree into a parameterized SQL predicate.
 *
 * <p>Every column reference is resolved against a {@link TableSchema} and
 * every value is type-checked against the column before it is bound. Values
 * never appear in the SQL text; each one becomes a {@code ?} placeholder and
 * an entry in the parameter list, in left-to-right order.
 *
 * <p>Rendering:
 * <ul>
 *   <li>{@code eq/ne/gt/gte/lt/lte/like/ilike}: {@code col OP ?}</li>
 *   <li>{@code in/not_in}: {@code col IN (?, ?, ...)}, one placeholder per element</li>
 *   <li>{@code is_null}: {@code col IS NULL} or {@code col IS NOT NULL}, nothing bound</li>
 *   <li>AND/OR: {@code (a AND b)}; NOT: {@code NOT (a)}</li>
 * </ul>
 *
 * <p>The compiler is stateless and thread-safe; compiling the same tree twice
 * yields identical output.
 */
public final class FilterCompiler {

    private final Function<String, String> columnRenderer;

    /**
     * Creates a compiler rendering columns as (conditionally quoted) identifiers.
     */
    public FilterCompiler() {
        this(SQLQuoting::quoteIdentifierIfNeeded);
    }

    /**
     * Creates a compiler with a custom column renderer, used when filter
     * names map to expressions rather than plain columns (HAVING over
     * aggregate output names).
     *
     * @param columnRenderer maps a validated column name to its SQL expression
     */
    public FilterCompiler(Function<String, String> columnRenderer) {
        this.columnRenderer = Objects.requireNonNull(columnRenderer, "columnRenderer must not be null");
    }

    /**
     * Compiles a filter tree against a table schema.
     *
     * @param node the filter root
     * @param schema the namespace column references resolve against
     * @return the predicate SQL and its parameters
     * @throws ValidationException on unknown columns, inapplicable operators,
     *         mistyped values or malformed logical nodes
     */
    public CompiledPredicate compile(FilterNode node, TableSchema schema) {
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(schema, "schema must not be null");

        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder();
        appendNode(node, schema, sql, params);
        return new CompiledPredicate(sql.toString(), params);
    }

    private void appendNode(FilterNode node, TableSchema schema, StringBuilder sql, List<Object> params) {
        if (node instanceof FilterNode.Comparison) {
            appendComparison((FilterNode.Comparison) node, schema, sql, params);
        } else {
            appendLogical((FilterNode.Logical) node, schema, sql, params);
        }
    }

    private void appendLogical(FilterNode.Logical node, TableSchema schema,
                               StringBuilder sql, List<Object> params) {
        List<FilterNode> children = node.children();

        if (node.kind() == FilterNode.LogicalKind.NOT) {
            if (children.size() != 1) {
                throw ValidationException.malformed(schema.name(),
                    "NOT requires exactly one operand, got " + children.size(),
                    "Wrap several conditions in _and or _or inside _not");
            }
            sql.append("NOT (");
            appendNode(children.get(0), schema, sql, params);
            sql.append(")");
            return;
        }

        if (children.isEmpty()) {
            throw ValidationException.malformed(schema.name(),
                node.kind() + " requires at least one operand",
                "Remove the empty _" + node.kind().name().toLowerCase() + " or add conditions to it");
        }

        String connective = " " + node.kind().name() + " ";
        sql.append("(");
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                sql.append(connective);
            }
            appendNode(children.get(i), schema, sql, params);
        }
        sql.append(")");
    }

    private void appendComparison(FilterNode.Comparison node, TableSchema schema,
                                  StringBuilder sql, List<Object> params) {
        ColumnSchema column = schema.column(node.column());
        if (column == null) {
            throw ValidationException.unknownColumn(schema.name(), node.column(), schema.columnNames());
        }

        FilterOperator op = node.operator();
        if (!op.supports(column.type())) {
            throw ValidationException.malformed(schema.name(),
                "Operator '" + op.operatorName() + "' is not supported for column '" + column.name()
                    + "' of type " + column.declaredType(),
                "Use one of: " + String.join(", ", FilterOperator.supportedNames(column.type())));
        }

        String rendered = columnRenderer.apply(column.name());
        Object value = node.value();

        if (op == FilterOperator.IS_NULL) {
            if (!(value instanceof Boolean)) {
                throw ValidationException.typeMismatch(schema.name(), column.name(), "BOOLEAN", value);
            }
            sql.append(rendered).append((Boolean) value ? " IS NULL" : " IS NOT NULL");
            return;
        }

        if (value == null) {
            throw ValidationException.malformed(schema.name(),
                "Null value for operator '" + op.operatorName() + "' on column '" + column.name() + "'",
                "Use {\"is_null\": true} to match NULL values");
        }

        if (op.isListOperator()) {
            List<Object> elements = asList(value);
            if (elements == null) {
                throw ValidationException.typeMismatch(schema.name(), column.name(),
                    "LIST of " + column.declaredType(), value);
            }
            if (elements.isEmpty()) {
                throw ValidationException.malformed(schema.name(),
                    "Operator '" + op.operatorName() + "' on column '" + column.name()
                        + "' requires a non-empty list",
                    "Remove the condition or supply at least one value");
            }
            sql.append(rendered).append(' ').append(op.sql()).append(" (");
            for (int i = 0; i < elements.size(); i++) {
                Object element = elements.get(i);
                if (element == null) {
                    throw ValidationException.malformed(schema.name(),
                        "Null element in '" + op.operatorName() + "' list for column '" + column.name() + "'",
                        "Use {\"is_null\": true} to match NULL values");
                }
                checkValue(schema, column, element);
                sql.append(i > 0 ? ", ?" : "?");
                params.add(element);
            }
            sql.append(")");
            return;
        }

        if ((op == FilterOperator.LIKE || op == FilterOperator.ILIKE) && !(value instanceof CharSequence)) {
            throw ValidationException.typeMismatch(schema.name(), column.name(), "VARCHAR pattern", value);
        }
        checkValue(schema, column, value);

        sql.append(rendered).append(' ').append(op.sql()).append(" ?");
        params.add(value);
    }

    private static void checkValue(TableSchema schema, ColumnSchema column, Object value) {
        if (!column.type().accepts(value)) {
            throw ValidationException.typeMismatch(schema.name(), column.name(), column.declaredType(), value);
        }
    }

    private static List<Object> asList(Object value) {
        if (value instanceof Collection) {
            return new ArrayList<>((Collection<?>) value);
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(Array.get(value, i));
            }
            return elements;
        }
        return null;
    }
}
