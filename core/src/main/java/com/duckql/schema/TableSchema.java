package com.duckql.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of a table or view: its name and ordered columns.
 *
 * <p>Column lookup is case-sensitive, matching how identifiers reach the
 * compiler from the request layer.
 */
public final class TableSchema {

    private final String name;
    private final List<ColumnSchema> columns;
    private final Map<String, ColumnSchema> columnsByName;
    private final List<String> primaryKey;
    private final boolean view;

    /**
     * Creates a table schema.
     *
     * @param name the table name
     * @param columns the columns in declaration order
     */
    public TableSchema(String name, List<ColumnSchema> columns) {
        this(name, columns, false);
    }

    /**
     * Creates a table or view schema.
     *
     * @param name the table name
     * @param columns the columns in declaration order
     * @param view whether this is a view (views have no row identity)
     * @throws IllegalArgumentException if columns is empty or names repeat
     */
    public TableSchema(String name, List<ColumnSchema> columns, boolean view) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(columns, "columns must not be null");
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Table '" + name + "' must have at least one column");
        }

        Map<String, ColumnSchema> byName = new LinkedHashMap<>();
        List<String> keys = new ArrayList<>();
        for (ColumnSchema column : columns) {
            if (byName.put(column.name(), column) != null) {
                throw new IllegalArgumentException(
                    "Duplicate column '" + column.name() + "' in table '" + name + "'");
            }
            if (column.primaryKey()) {
                keys.add(column.name());
            }
        }

        this.columns = List.copyOf(columns);
        this.columnsByName = Collections.unmodifiableMap(byName);
        this.primaryKey = List.copyOf(keys);
        this.view = view;
    }

    public static TableSchema of(String name, ColumnSchema... columns) {
        return new TableSchema(name, List.of(columns));
    }

    public String name() {
        return name;
    }

    public List<ColumnSchema> columns() {
        return columns;
    }

    /**
     * Returns the column names in declaration order.
     *
     * @return the column names
     */
    public List<String> columnNames() {
        return new ArrayList<>(columnsByName.keySet());
    }

    /**
     * Returns the column with the given name, or null if not found.
     *
     * @param column the column name
     * @return the column, or null
     */
    public ColumnSchema column(String column) {
        return columnsByName.get(column);
    }

    public boolean hasColumn(String column) {
        return columnsByName.containsKey(column);
    }

    /**
     * Returns the primary-key columns in declaration order; empty if the
     * table declares none.
     *
     * @return the primary-key column names
     */
    public List<String> primaryKey() {
        return primaryKey;
    }

    public boolean isView() {
        return view;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TableSchema)) {
            return false;
        }
        TableSchema other = (TableSchema) o;
        return view == other.view && name.equals(other.name) && columns.equals(other.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, columns, view);
    }

    @Override
    public String toString() {
        return (view ? "View" : "Table") + "[" + name + ": " + columns + "]";
    }
}
