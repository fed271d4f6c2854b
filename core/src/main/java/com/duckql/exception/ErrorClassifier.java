package com.duckql.exception;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies DuckDB JDBC failures into the engine's error taxonomy.
 *
 * <p>DuckDB reports most failures as a plain {@link SQLException} whose
 * message starts with an error class ("Binder Error: ...", "Catalog Error:
 * ..."). Classification therefore looks at the exception type and SQL state
 * first and falls back to the message prefix:
 * <ul>
 *   <li><b>Connection</b> (retryable): SQL state class 08, non-transient
 *       connection or recoverable exceptions, closed connections</li>
 *   <li><b>Transient</b> (retryable): transient exceptions, SQL state 40001,
 *       lock and write-conflict errors, interrupted or timed-out I/O</li>
 *   <li><b>Query</b> (fatal): everything else, including parser, binder,
 *       catalog, conversion and constraint errors</li>
 * </ul>
 *
 * <p>Fatal DuckDB error classes win over any retryable wording in the rest
 * of the message, since those messages quote user values. Transient
 * wording only counts inside an I/O, lock or transaction-context error.
 */
public final class ErrorClassifier {

    private static final Pattern COLUMN_NOT_FOUND =
        Pattern.compile("column (?:with name )?\"?([\\w]+)\"? (?:not found|does not exist)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TABLE_NOT_FOUND =
        Pattern.compile("Table with name \"?([\\w]+)\"? does not exist", Pattern.CASE_INSENSITIVE);

    private static final String[] CONNECTION_MARKERS = {
        "connection error",
        "connection closed",
        "connection reset",
        "connection is closed",
        "database has been closed",
        "unable to open database",
        "pool exhausted"
    };

    private static final Pattern FATAL_ERROR_CLASS = Pattern.compile(
        "^\\s*(?:conversion|catalog|binder|parser|syntax|invalid input|constraint|out of range"
            + "|not implemented|invalid type|type mismatch) error\\b");

    private static final String[] TRANSIENT_ERROR_CLASSES = {
        "io error",
        "transactioncontext error",
        "could not set lock"
    };

    private static final String[] TRANSIENT_MARKERS = {
        "could not set lock",
        "conflict",
        "transactioncontext error",
        "lock timeout",
        "temporarily unavailable",
        "interrupted",
        "timed out",
        "timeout"
    };

    private ErrorClassifier() {}

    /**
     * Converts a JDBC failure into a classified engine error.
     *
     * @param e the failure reported by the driver
     * @param sql the statement that was being executed (may be null)
     * @param table the target table (may be null)
     * @return a {@link ConnectionException}, {@link TransientEngineException}
     *         or {@link QueryExecutionException}
     */
    public static DuckQLException classify(SQLException e, String sql, String table) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        String lower = message.toLowerCase(Locale.ROOT);
        String sqlState = e.getSQLState();

        Map<String, Object> context = new LinkedHashMap<>();
        if (table != null) {
            context.put("table", table);
        }
        if (sqlState != null) {
            context.put("sql_state", sqlState);
        }
        context.put("original_error", message);

        if (!isFatalErrorClass(lower) && isConnectionFailure(e, sqlState, lower)) {
            return new ConnectionException("Database connection failed: " + message, e, context);
        }

        if (!isFatalErrorClass(lower) && isTransientFailure(e, sqlState, lower)) {
            return new TransientEngineException("Transient engine error: " + message, e, context);
        }

        return new QueryExecutionException(message, e, sql, context, fatalSuggestions(message, table));
    }

    /**
     * Returns whether a raw JDBC failure would be classified as retryable.
     *
     * @param e the failure reported by the driver
     * @return true for connection and transient failures
     */
    public static boolean isRetryable(SQLException e) {
        return classify(e, null, null).isRetryable();
    }

    private static boolean isConnectionFailure(SQLException e, String sqlState, String lower) {
        if (e instanceof SQLNonTransientConnectionException || e instanceof SQLRecoverableException) {
            return true;
        }
        if (sqlState != null && sqlState.startsWith("08")) {
            return true;
        }
        return containsAny(lower, CONNECTION_MARKERS);
    }

    private static boolean isTransientFailure(SQLException e, String sqlState, String lower) {
        if (e instanceof SQLTransientException) {
            return true;
        }
        if ("40001".equals(sqlState)) {
            return true;
        }
        for (String errorClass : TRANSIENT_ERROR_CLASSES) {
            if (lower.startsWith(errorClass)) {
                return containsAny(lower, TRANSIENT_MARKERS);
            }
        }
        return false;
    }

    private static boolean isFatalErrorClass(String lower) {
        return FATAL_ERROR_CLASS.matcher(lower).find();
    }

    private static List<String> fatalSuggestions(String message, String table) {
        List<String> suggestions = new ArrayList<>();

        Matcher column = COLUMN_NOT_FOUND.matcher(message);
        Matcher missingTable = TABLE_NOT_FOUND.matcher(message);

        if (column.find()) {
            suggestions.add("Check that column '" + column.group(1) + "' is spelled correctly");
            suggestions.add("Ensure the column exists in table '" + (table != null ? table : "unknown") + "'");
            suggestions.add("Reload the schema if the table was altered");
        } else if (missingTable.find()) {
            suggestions.add("Check that table '" + missingTable.group(1) + "' is spelled correctly");
            suggestions.add("Ensure the table has been created in the database");
        } else if (message.contains("Conversion Error") || message.contains("Cannot compare values")
                || message.contains("Type mismatch")) {
            suggestions.add("Compare numbers with numbers and strings with strings");
            suggestions.add("Check that date and timestamp values use ISO-8601 format");
        } else if (message.contains("Parser Error") || message.contains("Syntax Error")) {
            suggestions.add("This is likely a bug in SQL generation; report the request that produced it");
            suggestions.add("Try simplifying the request");
        } else if (message.contains("Constraint Error")) {
            suggestions.add("Check the table constraints for the values involved");
        }

        return suggestions;
    }

    private static boolean containsAny(String text, String[] markers) {
        for (String marker : markers) {
            if (text.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
