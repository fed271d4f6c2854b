package com.duckql.schema;

import com.duckql.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only mapping from table name to {@link TableSchema}.
 *
 * <p>Compilation operates generically over these descriptors; nothing is
 * generated per table.
 */
public final class SchemaRegistry {

    private final Map<String, TableSchema> tables;

    public SchemaRegistry(Collection<TableSchema> tables) {
        Objects.requireNonNull(tables, "tables must not be null");
        Map<String, TableSchema> byName = new LinkedHashMap<>();
        for (TableSchema table : tables) {
            if (byName.put(table.name(), table) != null) {
                throw new IllegalArgumentException("Duplicate table '" + table.name() + "'");
            }
        }
        this.tables = Collections.unmodifiableMap(byName);
    }

    public static SchemaRegistry of(TableSchema... tables) {
        return new SchemaRegistry(List.of(tables));
    }

    /**
     * Returns the schema of a table.
     *
     * @param table the table name
     * @return the schema
     * @throws ValidationException if the table is not registered
     */
    public TableSchema require(String table) {
        TableSchema schema = tables.get(table);
        if (schema == null) {
            throw ValidationException.unknownTable(table, tableNames());
        }
        return schema;
    }

    /**
     * Returns the schema of a table, or null if not registered.
     *
     * @param table the table name
     * @return the schema, or null
     */
    public TableSchema find(String table) {
        return tables.get(table);
    }

    public boolean contains(String table) {
        return tables.containsKey(table);
    }

    public List<String> tableNames() {
        return new ArrayList<>(tables.keySet());
    }

    public Collection<TableSchema> tables() {
        return tables.values();
    }

    public int size() {
        return tables.size();
    }
}
