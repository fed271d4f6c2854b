package com.duckql.test;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Base class for tests: lifecycle hooks, Given/When/Then step logging and
 * DuckDB fixture helpers.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    @BeforeEach
    protected final void setUpBase(TestInfo testInfo) {
        logger.debug("Running: {}", testInfo.getDisplayName());
        doSetUp();
    }

    @AfterEach
    protected final void tearDownBase() {
        doTearDown();
    }

    /** Per-test setup hook. */
    protected void doSetUp() {
    }

    /** Per-test teardown hook. */
    protected void doTearDown() {
    }

    protected void logStep(String step) {
        logger.debug(step);
    }

    protected void logData(String label, Object value) {
        logger.debug("{}: {}", label, value);
    }

    /**
     * Creates a DuckDB database file and runs the given statements in it.
     * The connection is closed afterwards, so an engine can open the file.
     *
     * @param dir directory to create the file in (typically a {@code @TempDir})
     * @param statements DDL and INSERT statements
     * @return the database file path
     */
    protected static String createDatabase(Path dir, String... statements) {
        String path = dir.resolve("test.duckdb").toString();
        try (Connection conn = DriverManager.getConnection("jdbc:duckdb:" + path);
             Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create test database", e);
        }
        return path;
    }
}
