package com.duckql.schema;

import com.duckql.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Registry of computed fields keyed by (table, field name).
 *
 * <p>Registration is validated against the {@link SchemaRegistry}: the table
 * must exist, every source column must be a real column, and the field name
 * must not shadow one. Lookups are safe from any thread.
 *
 * <pre>
 *   computed.register("sales", "amount_with_tax", List.of("amount"),
 *       row -> ((Number) row.get("amount")).doubleValue() * 1.2);
 * </pre>
 */
public final class ComputedFieldRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ComputedFieldRegistry.class);

    private final SchemaRegistry schemas;
    private final Map<String, Map<String, ComputedField>> fields = new ConcurrentHashMap<>();

    public ComputedFieldRegistry(SchemaRegistry schemas) {
        this.schemas = Objects.requireNonNull(schemas, "schemas must not be null");
    }

    /**
     * Registers a computed field.
     *
     * @param table the table the field belongs to
     * @param name the field name
     * @param sourceColumns the columns the resolver reads
     * @param resolver pure function of the row
     * @return the registered field
     * @throws ValidationException if the table or a source column is unknown,
     *         the name shadows a column, or the name is already registered
     */
    public ComputedField register(String table, String name, List<String> sourceColumns,
                                  Function<Map<String, Object>, Object> resolver) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(sourceColumns, "sourceColumns must not be null");
        TableSchema schema = schemas.require(table);

        if (schema.hasColumn(name)) {
            throw ValidationException.malformed(table,
                "Computed field '" + name + "' shadows a column of table '" + table + "'",
                "Choose a name that is not a column of '" + table + "'");
        }
        for (String column : sourceColumns) {
            if (!schema.hasColumn(column)) {
                throw ValidationException.unknownColumn(table, column, schema.columnNames());
            }
        }

        ComputedField field = new ComputedField(table, name, sourceColumns, resolver);
        Map<String, ComputedField> byName =
            fields.computeIfAbsent(table, t -> Collections.synchronizedMap(new LinkedHashMap<>()));
        if (byName.putIfAbsent(name, field) != null) {
            throw ValidationException.malformed(table,
                "Computed field '" + name + "' is already registered for table '" + table + "'", null);
        }

        logger.debug("Registered computed field {}.{} over {}", table, name, sourceColumns);
        return field;
    }

    /**
     * Returns a computed field, or null if none is registered under that name.
     *
     * @param table the table name
     * @param name the field name
     * @return the field, or null
     */
    public ComputedField find(String table, String name) {
        Map<String, ComputedField> byName = fields.get(table);
        return byName == null ? null : byName.get(name);
    }

    public boolean isComputed(String table, String name) {
        return find(table, name) != null;
    }

    /**
     * Returns the computed field names of a table in registration order.
     *
     * @param table the table name
     * @return the names; empty if none
     */
    public List<String> fieldNames(String table) {
        Map<String, ComputedField> byName = fields.get(table);
        if (byName == null) {
            return Collections.emptyList();
        }
        synchronized (byName) {
            return new ArrayList<>(byName.keySet());
        }
    }
}
