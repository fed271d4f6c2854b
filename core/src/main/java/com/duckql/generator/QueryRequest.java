package com.duckql.generator;

import com.duckql.filter.FilterNode;
import com.duckql.validation.SelectionNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A structured query request, as delivered by the request-parsing layer.
 *
 * <p>Built per operation and discarded after compilation:
 * <pre>
 *   QueryRequest request = QueryRequest.list("sales")
 *       .fields("region", "amount")
 *       .where(FilterNode.and(
 *           FilterNode.eq("region", "North"),
 *           FilterNode.compare("amount", FilterOperator.GTE, 500)))
 *       .orderBy(OrderBy.desc("amount"))
 *       .limit(10)
 *       .build();
 * </pre>
 */
public final class QueryRequest {

    private final String table;
    private final OperationKind kind;
    private final List<String> fields;
    private final FilterNode where;
    private final List<String> groupBy;
    private final List<Aggregation> aggregations;
    private final FilterNode having;
    private final List<OrderBy> orderBy;
    private final Integer limit;
    private final Integer offset;
    private final SelectionNode selection;

    private QueryRequest(Builder builder) {
        this.table = builder.table;
        this.kind = builder.kind;
        this.fields = List.copyOf(builder.fields);
        this.where = builder.where;
        this.groupBy = List.copyOf(builder.groupBy);
        this.aggregations = List.copyOf(builder.aggregations);
        this.having = builder.having;
        this.orderBy = List.copyOf(builder.orderBy);
        this.limit = builder.limit;
        this.offset = builder.offset;
        this.selection = builder.selection;
    }

    public static Builder single(String table) {
        return new Builder(table, OperationKind.SINGLE);
    }

    public static Builder list(String table) {
        return new Builder(table, OperationKind.LIST);
    }

    public static Builder aggregate(String table) {
        return new Builder(table, OperationKind.AGGREGATE);
    }

    public String table() {
        return table;
    }

    public OperationKind kind() {
        return kind;
    }

    /**
     * Returns the selected fields; empty means every column of the table.
     */
    public List<String> fields() {
        return fields;
    }

    public FilterNode where() {
        return where;
    }

    public List<String> groupBy() {
        return groupBy;
    }

    public List<Aggregation> aggregations() {
        return aggregations;
    }

    public FilterNode having() {
        return having;
    }

    public List<OrderBy> orderBy() {
        return orderBy;
    }

    public Integer limit() {
        return limit;
    }

    public Integer offset() {
        return offset;
    }

    /**
     * Returns the selection tree the depth guard inspects. When the request
     * layer supplied none, this is a one-level tree of the selected fields.
     *
     * @return the selection tree
     */
    public SelectionNode selection() {
        return selection != null ? selection : SelectionNode.flat(table, fields);
    }

    @Override
    public String toString() {
        return "QueryRequest[" + kind.code() + " " + table + ", fields=" + fields + "]";
    }

    /**
     * Builder for {@link QueryRequest}.
     */
    public static final class Builder {
        private final String table;
        private final OperationKind kind;
        private final List<String> fields = new ArrayList<>();
        private FilterNode where;
        private final List<String> groupBy = new ArrayList<>();
        private final List<Aggregation> aggregations = new ArrayList<>();
        private FilterNode having;
        private final List<OrderBy> orderBy = new ArrayList<>();
        private Integer limit;
        private Integer offset;
        private SelectionNode selection;

        private Builder(String table, OperationKind kind) {
            this.table = Objects.requireNonNull(table, "table must not be null");
            this.kind = kind;
        }

        public Builder fields(String... names) {
            return fields(Arrays.asList(names));
        }

        public Builder fields(List<String> names) {
            fields.addAll(names);
            return this;
        }

        public Builder where(FilterNode filter) {
            this.where = filter;
            return this;
        }

        public Builder groupBy(String... columns) {
            groupBy.addAll(Arrays.asList(columns));
            return this;
        }

        public Builder aggregate(Aggregation... aggregates) {
            aggregations.addAll(Arrays.asList(aggregates));
            return this;
        }

        public Builder having(FilterNode filter) {
            this.having = filter;
            return this;
        }

        public Builder orderBy(OrderBy... terms) {
            orderBy.addAll(Arrays.asList(terms));
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(Integer offset) {
            this.offset = offset;
            return this;
        }

        public Builder selection(SelectionNode selection) {
            this.selection = selection;
            return this;
        }

        public QueryRequest build() {
            return new QueryRequest(this);
        }
    }
}
