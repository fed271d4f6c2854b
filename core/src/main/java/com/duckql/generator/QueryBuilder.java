package com.duckql.generator;

import com.duckql.exception.ValidationException;
import com.duckql.filter.CompiledPredicate;
import com.duckql.filter.FilterCompiler;
import com.duckql.schema.ColumnSchema;
import com.duckql.schema.ComputedField;
import com.duckql.schema.ComputedFieldRegistry;
import com.duckql.schema.SchemaRegistry;
import com.duckql.schema.TableSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.duckql.generator.SQLQuoting.quoteIdentifierIfNeeded;

/**
 * Builds complete SELECT statements from {@link QueryRequest}s.
 *
 * <p>Single-item and list operations share projection, filter, ordering
 * and pagination assembly; single-item operations always get
 * {@code LIMIT 1}. Aggregate operations group by validated columns, project
 * the requested aggregates plus an unconditional {@code COUNT(*) AS _count},
 * and compile HAVING against the post-aggregation names.
 *
 * <p>Every statement ends with a deterministic ORDER BY: the explicit terms
 * followed by a tie-break that makes the ordering total.
 * <ul>
 *   <li>tables with a primary key: the key columns not yet ordered, ascending</li>
 *   <li>tables without one: DuckDB's {@code rowid}</li>
 *   <li>views: the projected columns not yet ordered</li>
 *   <li>aggregates: the group-by columns not yet ordered</li>
 * </ul>
 *
 * <p>The builder holds no per-query state; {@code build} is deterministic
 * and may be called from any thread.
 */
public class QueryBuilder {

    private static final Logger logger = LoggerFactory.getLogger(QueryBuilder.class);

    static final String ROW_ID = "rowid";

    private final SchemaRegistry schemas;
    private final ComputedFieldRegistry computedFields;
    private final FilterCompiler filterCompiler = new FilterCompiler();

    public QueryBuilder(SchemaRegistry schemas) {
        this(schemas, new ComputedFieldRegistry(schemas));
    }

    public QueryBuilder(SchemaRegistry schemas, ComputedFieldRegistry computedFields) {
        this.schemas = Objects.requireNonNull(schemas, "schemas must not be null");
        this.computedFields = Objects.requireNonNull(computedFields, "computedFields must not be null");
    }

    /**
     * Compiles a request into a statement.
     *
     * @param request the request
     * @return the compiled statement
     * @throws ValidationException if the request does not fit the schema
     */
    public CompiledQuery build(QueryRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        TableSchema schema = schemas.require(request.table());

        CompiledQuery query = request.kind() == OperationKind.AGGREGATE
            ? buildAggregate(request, schema)
            : buildSelect(request, schema);

        logger.debug("Compiled {} query on '{}' with {} parameters",
            query.kind().code(), query.table(), query.params().size());
        return query;
    }

    private CompiledQuery buildSelect(QueryRequest request, TableSchema schema) {
        List<String> requested = request.fields().isEmpty() ? schema.columnNames() : request.fields();

        // Real columns first in request order, then computed-field sources not already selected
        Set<String> projection = new LinkedHashSet<>();
        List<ComputedField> computed = new ArrayList<>();
        Set<String> resultColumns = new LinkedHashSet<>();
        for (String field : requested) {
            if (schema.hasColumn(field)) {
                projection.add(field);
            } else {
                ComputedField cf = computedFields.find(schema.name(), field);
                if (cf == null) {
                    throw ValidationException.unknownColumn(schema.name(), field, selectableNames(schema));
                }
                if (!computed.contains(cf)) {
                    computed.add(cf);
                }
            }
            resultColumns.add(field);
        }
        for (ComputedField cf : computed) {
            projection.addAll(cf.sourceColumns());
        }

        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ");
        appendList(sql, projection);
        sql.append(" FROM ").append(quoteIdentifierIfNeeded(schema.name()));

        if (request.where() != null) {
            CompiledPredicate predicate = filterCompiler.compile(request.where(), schema);
            sql.append(" WHERE ").append(predicate.sql());
            params.addAll(predicate.params());
        }

        List<OrderBy> ordering = new ArrayList<>();
        for (OrderBy term : request.orderBy()) {
            if (!schema.hasColumn(term.column())) {
                throw ValidationException.unknownColumn(schema.name(), term.column(), schema.columnNames());
            }
            ordering.add(term);
        }
        appendTieBreak(ordering, tieBreakColumns(schema, projection));
        appendOrderBy(sql, ordering);

        Integer limit = request.kind() == OperationKind.SINGLE ? Integer.valueOf(1) : request.limit();
        appendPagination(sql, schema.name(), limit, request.offset());

        return new CompiledQuery(sql.toString(), params, schema.name(), request.kind(),
                                 new ArrayList<>(resultColumns), computed);
    }

    private CompiledQuery buildAggregate(QueryRequest request, TableSchema schema) {
        if (request.groupBy().isEmpty()) {
            throw ValidationException.malformed(schema.name(),
                "Aggregate query on '" + schema.name() + "' requires at least one groupBy column",
                "Add groupBy columns, e.g. groupBy: [\"" + schema.columnNames().get(0) + "\"]");
        }

        Set<String> groupBy = new LinkedHashSet<>();
        for (String column : request.groupBy()) {
            if (!schema.hasColumn(column)) {
                throw ValidationException.unknownColumn(schema.name(), column, schema.columnNames());
            }
            groupBy.add(column);
        }

        List<Aggregation> requestedAggregates = request.aggregations().isEmpty()
            ? defaultAggregations(schema, groupBy)
            : request.aggregations();

        // Output namespace: group columns, aggregates by output name, then _count
        Map<String, Aggregation> aggregates = new LinkedHashMap<>();
        List<ColumnSchema> outputColumns = new ArrayList<>();
        Map<String, String> expressions = new HashMap<>();
        for (String column : groupBy) {
            outputColumns.add(schema.column(column));
            expressions.put(column, quoteIdentifierIfNeeded(column));
        }
        for (Aggregation aggregation : requestedAggregates) {
            ColumnSchema source = schema.column(aggregation.column());
            if (source == null) {
                throw ValidationException.unknownColumn(schema.name(), aggregation.column(), schema.columnNames());
            }
            if (!aggregation.function().appliesTo(source.type())) {
                throw ValidationException.malformed(schema.name(),
                    aggregation.function() + " cannot be applied to column '" + source.name()
                        + "' of type " + source.declaredType(),
                    "Apply " + aggregation.function() + " to a numeric column");
            }
            if (aggregates.putIfAbsent(aggregation.outputName(), aggregation) == null) {
                String resultType = aggregation.function().resultType(source.declaredType(), source.type());
                outputColumns.add(ColumnSchema.of(aggregation.outputName(), resultType));
                expressions.put(aggregation.outputName(), aggregation.toSQL());
            }
        }
        outputColumns.add(ColumnSchema.of(Aggregation.COUNT_ALIAS, "BIGINT"));
        expressions.put(Aggregation.COUNT_ALIAS, "COUNT(*)");

        TableSchema outputSchema = new TableSchema(schema.name(), outputColumns);

        List<String> resultColumns = outputSchema.columnNames();
        if (!request.fields().isEmpty()) {
            for (String field : request.fields()) {
                if (!outputSchema.hasColumn(field)) {
                    throw ValidationException.unknownColumn(schema.name(), field, outputSchema.columnNames());
                }
            }
            resultColumns = new ArrayList<>(new LinkedHashSet<>(request.fields()));
        }

        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ");
        appendList(sql, groupBy);
        for (Aggregation aggregation : aggregates.values()) {
            sql.append(", ").append(aggregation.toSQL())
               .append(" AS ").append(quoteIdentifierIfNeeded(aggregation.outputName()));
        }
        sql.append(", COUNT(*) AS ").append(quoteIdentifierIfNeeded(Aggregation.COUNT_ALIAS));
        sql.append(" FROM ").append(quoteIdentifierIfNeeded(schema.name()));

        if (request.where() != null) {
            CompiledPredicate predicate = filterCompiler.compile(request.where(), schema);
            sql.append(" WHERE ").append(predicate.sql());
            params.addAll(predicate.params());
        }

        sql.append(" GROUP BY ");
        appendList(sql, groupBy);

        if (request.having() != null) {
            FilterCompiler havingCompiler = new FilterCompiler(expressions::get);
            CompiledPredicate predicate = havingCompiler.compile(request.having(), outputSchema);
            sql.append(" HAVING ").append(predicate.sql());
            params.addAll(predicate.params());
        }

        List<OrderBy> ordering = new ArrayList<>();
        for (OrderBy term : request.orderBy()) {
            if (!outputSchema.hasColumn(term.column())) {
                throw ValidationException.unknownColumn(schema.name(), term.column(), outputSchema.columnNames());
            }
            ordering.add(term);
        }
        appendTieBreak(ordering, new ArrayList<>(groupBy));
        appendOrderBy(sql, ordering);

        appendPagination(sql, schema.name(), request.limit(), request.offset());

        return new CompiledQuery(sql.toString(), params, schema.name(), OperationKind.AGGREGATE,
                                 resultColumns, List.of());
    }

    /**
     * SUM, AVG, MIN and MAX of every numeric column that is not grouped on.
     */
    private static List<Aggregation> defaultAggregations(TableSchema schema, Set<String> groupBy) {
        List<Aggregation> defaults = new ArrayList<>();
        for (ColumnSchema column : schema.columns()) {
            if (column.type().isNumeric() && !groupBy.contains(column.name())) {
                defaults.add(Aggregation.sum(column.name()));
                defaults.add(Aggregation.avg(column.name()));
                defaults.add(Aggregation.min(column.name()));
                defaults.add(Aggregation.max(column.name()));
            }
        }
        return defaults;
    }

    private static List<String> tieBreakColumns(TableSchema schema, Set<String> projection) {
        if (!schema.primaryKey().isEmpty()) {
            return schema.primaryKey();
        }
        if (schema.isView()) {
            return new ArrayList<>(projection);
        }
        return List.of(ROW_ID);
    }

    private static void appendTieBreak(List<OrderBy> ordering, List<String> candidates) {
        Set<String> ordered = new LinkedHashSet<>();
        for (OrderBy term : ordering) {
            ordered.add(term.column());
        }
        for (String column : candidates) {
            if (ordered.add(column)) {
                ordering.add(OrderBy.asc(column));
            }
        }
    }

    private static void appendOrderBy(StringBuilder sql, List<OrderBy> ordering) {
        if (ordering.isEmpty()) {
            return;
        }
        sql.append(" ORDER BY ");
        for (int i = 0; i < ordering.size(); i++) {
            OrderBy term = ordering.get(i);
            if (i > 0) {
                sql.append(", ");
            }
            sql.append(quoteIdentifierIfNeeded(term.column())).append(' ').append(term.direction().name());
        }
    }

    private static void appendPagination(StringBuilder sql, String table, Integer limit, Integer offset) {
        if (limit != null) {
            if (limit < 0) {
                throw ValidationException.malformed(table, "limit must be non-negative, got " + limit, null);
            }
            sql.append(" LIMIT ").append(limit.intValue());
        }
        if (offset != null) {
            if (offset < 0) {
                throw ValidationException.malformed(table, "offset must be non-negative, got " + offset, null);
            }
            sql.append(" OFFSET ").append(offset.intValue());
        }
    }

    private static void appendList(StringBuilder sql, Iterable<String> columns) {
        boolean first = true;
        for (String column : columns) {
            if (!first) {
                sql.append(", ");
            }
            sql.append(quoteIdentifierIfNeeded(column));
            first = false;
        }
    }

    private List<String> selectableNames(TableSchema schema) {
        List<String> names = schema.columnNames();
        names.addAll(computedFields.fieldNames(schema.name()));
        return names;
    }
}
