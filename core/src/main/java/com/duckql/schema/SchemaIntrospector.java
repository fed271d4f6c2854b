package com.duckql.schema;

import com.duckql.exception.ErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads table and view descriptors from a DuckDB catalog.
 *
 * <p>Columns come from {@code information_schema.columns} in ordinal order;
 * primary keys from {@code duckdb_constraints()}. Views are marked as such
 * since they carry no row identity.
 */
public class SchemaIntrospector {

    private static final Logger logger = LoggerFactory.getLogger(SchemaIntrospector.class);

    static final String COLUMNS_SQL =
        "SELECT c.table_name, c.column_name, c.data_type, c.is_nullable, t.table_type " +
        "FROM information_schema.columns c " +
        "JOIN information_schema.tables t " +
        "ON c.table_schema = t.table_schema AND c.table_name = t.table_name " +
        "WHERE c.table_schema = ? " +
        "ORDER BY c.table_name, c.ordinal_position";

    static final String PRIMARY_KEYS_SQL =
        "SELECT table_name, unnest(constraint_column_names) AS column_name " +
        "FROM duckdb_constraints() " +
        "WHERE constraint_type = 'PRIMARY KEY' AND schema_name = ?";

    private final Connection connection;
    private final String schemaName;

    /**
     * Creates an introspector over the {@code main} schema.
     *
     * @param connection the DuckDB connection to read the catalog with
     */
    public SchemaIntrospector(Connection connection) {
        this(connection, "main");
    }

    public SchemaIntrospector(Connection connection, String schemaName) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.schemaName = Objects.requireNonNull(schemaName, "schemaName must not be null");
    }

    /**
     * Reads every table and view of the schema.
     *
     * @return a registry of the discovered tables, in name order
     * @throws com.duckql.exception.DuckQLException if the catalog cannot be read
     */
    public SchemaRegistry introspect() {
        Map<String, Set<String>> primaryKeys = readPrimaryKeys();

        Map<String, List<ColumnSchema>> columnsByTable = new LinkedHashMap<>();
        Map<String, Boolean> views = new HashMap<>();

        try (PreparedStatement stmt = connection.prepareStatement(COLUMNS_SQL)) {
            stmt.setString(1, schemaName);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String table = rs.getString("table_name");
                    String column = rs.getString("column_name");
                    String dataType = rs.getString("data_type");
                    boolean nullable = !"NO".equalsIgnoreCase(rs.getString("is_nullable"));
                    boolean key = primaryKeys.getOrDefault(table, Set.of()).contains(column);

                    columnsByTable.computeIfAbsent(table, t -> new ArrayList<>())
                        .add(new ColumnSchema(column, dataType, ColumnType.fromDuckDB(dataType),
                                              nullable && !key, key));
                    views.put(table, "VIEW".equalsIgnoreCase(rs.getString("table_type")));
                }
            }
        } catch (SQLException e) {
            throw ErrorClassifier.classify(e, COLUMNS_SQL, null);
        }

        List<TableSchema> tables = new ArrayList<>();
        for (Map.Entry<String, List<ColumnSchema>> entry : columnsByTable.entrySet()) {
            tables.add(new TableSchema(entry.getKey(), entry.getValue(), views.get(entry.getKey())));
        }

        logger.info("Introspected {} tables from schema '{}'", tables.size(), schemaName);
        return new SchemaRegistry(tables);
    }

    private Map<String, Set<String>> readPrimaryKeys() {
        Map<String, Set<String>> keys = new HashMap<>();
        try (PreparedStatement stmt = connection.prepareStatement(PRIMARY_KEYS_SQL)) {
            stmt.setString(1, schemaName);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    keys.computeIfAbsent(rs.getString("table_name"), t -> new HashSet<>())
                        .add(rs.getString("column_name"));
                }
            }
        } catch (SQLException e) {
            throw ErrorClassifier.classify(e, PRIMARY_KEYS_SQL, null);
        }
        return keys;
    }
}
