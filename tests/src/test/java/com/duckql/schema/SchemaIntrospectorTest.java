package com.duckql.schema;

import com.duckql.test.TestBase;
import com.duckql.test.TestCategories;

import org.junit.jupiter.api.*;
import static org.assertj.core.api.Assertions.*;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;

/**
 * Integration tests for SchemaIntrospector against an in-memory DuckDB
 * catalog.
 */
@TestCategories.Tier1
@TestCategories.Integration
@DisplayName("SchemaIntrospector Integration Tests")
public class SchemaIntrospectorTest extends TestBase {

    private Connection connection;

    @Override
    protected void doSetUp() {
        try {
            connection = DriverManager.getConnection("jdbc:duckdb:");
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("CREATE TABLE users (id INTEGER PRIMARY KEY, name VARCHAR NOT NULL, "
                    + "balance DECIMAL(10,2), tags VARCHAR[], created_at TIMESTAMP)");
                stmt.execute("CREATE TABLE line_items (order_id BIGINT, line INTEGER, qty INTEGER, "
                    + "PRIMARY KEY (order_id, line))");
                stmt.execute("CREATE TABLE sales (amount FLOAT, region VARCHAR)");
                stmt.execute("CREATE VIEW north_sales AS SELECT amount, region FROM sales WHERE region = 'North'");
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to prepare catalog", e);
        }
    }

    @Override
    protected void doTearDown() {
        try {
            connection.close();
        } catch (Exception e) {
            logger.warn("Failed to close connection", e);
        }
    }

    @Test
    @DisplayName("Discovers tables and views in name order")
    void testDiscoversTables() {
        SchemaRegistry registry = new SchemaIntrospector(connection).introspect();

        assertThat(registry.tableNames()).containsExactly("line_items", "north_sales", "sales", "users");
    }

    @Test
    @DisplayName("Columns keep ordinal order, declared types and categories")
    void testColumns() {
        TableSchema users = new SchemaIntrospector(connection).introspect().require("users");

        assertThat(users.columnNames()).containsExactly("id", "name", "balance", "tags", "created_at");
        assertThat(users.column("balance").declaredType()).isEqualTo("DECIMAL(10,2)");
        assertThat(users.column("balance").type()).isEqualTo(ColumnType.DECIMAL);
        assertThat(users.column("tags").type()).isEqualTo(ColumnType.OTHER);
        assertThat(users.column("created_at").type()).isEqualTo(ColumnType.TIMESTAMP);
        assertThat(users.column("name").nullable()).isFalse();
        assertThat(users.column("balance").nullable()).isTrue();
    }

    @Test
    @DisplayName("Primary keys, including composite ones, are detected")
    void testPrimaryKeys() {
        SchemaRegistry registry = new SchemaIntrospector(connection).introspect();

        assertThat(registry.require("users").primaryKey()).containsExactly("id");
        assertThat(registry.require("line_items").primaryKey()).containsExactly("order_id", "line");
        assertThat(registry.require("sales").primaryKey()).isEmpty();
    }

    @Test
    @DisplayName("Views are marked as views")
    void testViews() {
        SchemaRegistry registry = new SchemaIntrospector(connection).introspect();

        assertThat(registry.require("north_sales").isView()).isTrue();
        assertThat(registry.require("sales").isView()).isFalse();
        assertThat(registry.require("north_sales").columnNames()).containsExactly("amount", "region");
    }

    @Test
    @DisplayName("Unknown schema yields an empty registry")
    void testEmptySchema() {
        assertThat(new SchemaIntrospector(connection, "nope").introspect().size()).isZero();
    }
}
