package com.duckql.exception;

import com.duckql.test.TestCategories;

import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import static org.assertj.core.api.Assertions.*;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;

/**
 * Tests for ErrorClassifier: DuckDB failures to connection, transient and
 * fatal query errors.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ErrorClassifier Tests")
public class ErrorClassifierTest {

    private static final String SQL = "SELECT nam FROM users";

    @Nested
    @DisplayName("Fatal Query Errors")
    class FatalErrors {

        @Test
        @DisplayName("Binder errors are fatal and carry the SQL")
        void testBinderError() {
            SQLException e = new SQLException(
                "Binder Error: Referenced column \"nam\" not found in FROM clause!\nCandidate bindings: \"name\"");

            DuckQLException error = ErrorClassifier.classify(e, SQL, "users");

            assertThat(error).isInstanceOf(QueryExecutionException.class);
            assertThat(error.getKind()).isEqualTo(ErrorKind.QUERY_ERROR);
            assertThat(error.isRetryable()).isFalse();
            assertThat(((QueryExecutionException) error).getFailedSQL()).isEqualTo(SQL);
            assertThat(error.getContext())
                .containsEntry("table", "users")
                .containsEntry("sql", SQL)
                .containsKey("original_error");
            assertThat(error.getSuggestions()).anySatisfy(s -> assertThat(s).contains("nam"));
            assertThat(error.getCause()).isSameAs(e);
        }

        @ParameterizedTest
        @ValueSource(strings = {
            "Parser Error: syntax error at or near \"timeout\"",
            "Binder Error: column \"lock_timeout_conflict\" not found",
            "Conversion Error: Could not convert string 'abc' to INT32",
            "Constraint Error: Duplicate key \"id: 1\" violates primary key constraint",
            "Catalog Error: Table with name sales does not exist!"
        })
        @DisplayName("Messages quoting transient words stay fatal")
        void testFatalEvenWithMarkers(String message) {
            assertThat(ErrorClassifier.classify(new SQLException(message), SQL, null))
                .isInstanceOf(QueryExecutionException.class);
            assertThat(ErrorClassifier.isRetryable(new SQLException(message))).isFalse();
        }

        @ParameterizedTest
        @ValueSource(strings = {
            "Conversion Error: Could not convert string 'lock timeout' to INTERVAL",
            "Conversion Error: Could not convert string 'connection reset' to INTERVAL",
            "Conversion Error: Could not convert string 'conflict timeout' to INTERVAL",
            "Invalid Input Error: Malformed JSON at byte 0 of input: 'database has been closed'",
            "Catalog Error: Type with name \"could not set lock\" does not exist!",
            "Out of Range Error: Cannot cast value 'interrupted' to ENUM"
        })
        @DisplayName("Fatal error classes quoting retryable wording in user values stay fatal")
        void testQuotedUserValuesStayFatal(String message) {
            DuckQLException error = ErrorClassifier.classify(new SQLException(message), SQL, "events");

            assertThat(error).isInstanceOf(QueryExecutionException.class);
            assertThat(error.getKind()).isEqualTo(ErrorKind.QUERY_ERROR);
            assertThat(error.isRetryable()).isFalse();
        }

        @Test
        @DisplayName("Transient wording outside an I/O or transaction error is fatal")
        void testUnprefixedTransientWordingIsFatal() {
            assertThat(ErrorClassifier.classify(
                new SQLException("Invalid Error: unexpected timeout value"), SQL, null))
                .isInstanceOf(QueryExecutionException.class);
        }
    }

    @Nested
    @DisplayName("Retryable Errors")
    class RetryableErrors {

        @Test
        @DisplayName("Lock failures are transient")
        void testLockFailure() {
            DuckQLException error = ErrorClassifier.classify(
                new SQLException("IO Error: Could not set lock on file \"test.duckdb\": Conflicting lock is held"),
                SQL, "sales");

            assertThat(error).isInstanceOf(TransientEngineException.class);
            assertThat(error.getKind()).isEqualTo(ErrorKind.TRANSIENT_ENGINE_ERROR);
            assertThat(error.isRetryable()).isTrue();
        }

        @Test
        @DisplayName("Write conflicts and transient JDBC types are transient")
        void testTransientTypes() {
            assertThat(ErrorClassifier.classify(
                new SQLException("TransactionContext Error: Conflict on update"), SQL, null))
                .isInstanceOf(TransientEngineException.class);
            assertThat(ErrorClassifier.classify(new SQLTimeoutException("statement timed out"), SQL, null))
                .isInstanceOf(TransientEngineException.class);
            assertThat(ErrorClassifier.classify(new SQLException("serialization failure", "40001"), SQL, null))
                .isInstanceOf(TransientEngineException.class);
        }

        @Test
        @DisplayName("SQL state class 08 and connection exceptions are connection errors")
        void testConnectionFailures() {
            DuckQLException byState = ErrorClassifier.classify(
                new SQLException("link down", "08006"), SQL, null);
            DuckQLException byType = ErrorClassifier.classify(
                new SQLNonTransientConnectionException("gone"), SQL, null);
            DuckQLException byMessage = ErrorClassifier.classify(
                new SQLException("Connection Error: database has been closed"), SQL, null);

            assertThat(byState).isInstanceOf(ConnectionException.class);
            assertThat(byState.getContext()).containsEntry("sql_state", "08006");
            assertThat(byType).isInstanceOf(ConnectionException.class);
            assertThat(byMessage.getKind()).isEqualTo(ErrorKind.CONNECTION_ERROR);
            assertThat(byMessage.isRetryable()).isTrue();
        }
    }
}
