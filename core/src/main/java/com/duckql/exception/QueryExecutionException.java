package com.duckql.exception;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Exception thrown when DuckDB rejects a compiled statement.
 *
 * <p>This is the fatal engine failure: syntax, binder, catalog, conversion
 * or constraint errors. It is surfaced immediately with the failed SQL and
 * table context and never retried.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       QueryResult result = engine.execute(request);
 *   } catch (QueryExecutionException e) {
 *       System.err.println(e.getUserMessage());
 *       System.err.println("Failed SQL: " + e.getFailedSQL());
 *   }
 * </pre>
 */
public class QueryExecutionException extends DuckQLException {

    private static final int MAX_SQL_CONTEXT = 200;

    private final String failedSQL;

    public QueryExecutionException(String message, String sql) {
        this(message, null, sql, null, null);
    }

    public QueryExecutionException(String message, Throwable cause, String sql) {
        this(message, cause, sql, null, null);
    }

    public QueryExecutionException(String message, Throwable cause, String sql,
                                   Map<String, Object> context, List<String> suggestions) {
        super(message, ErrorKind.QUERY_ERROR, context, suggestions, cause);
        this.failedSQL = sql;
        if (sql != null) {
            putContext("sql", sql.length() > MAX_SQL_CONTEXT
                ? sql.substring(0, MAX_SQL_CONTEXT) + "..." : sql);
        }
    }

    /**
     * Returns the SQL statement that failed to execute.
     *
     * @return the failed SQL, or null if not available
     */
    public String getFailedSQL() {
        return failedSQL;
    }

    /**
     * Returns a user-friendly error message.
     *
     * <p>Translates technical DuckDB error messages into actionable guidance.
     *
     * @return user-friendly error message
     */
    @Override
    public String getUserMessage() {
        String message = getMessage();

        if (message == null) {
            return "Query execution failed. Check filter values and field names.";
        }

        if (message.contains("Binder Error") && message.contains("not found")) {
            return translateColumnNotFound(message);
        }

        if (message.contains("Conversion Error")) {
            return translateConversionError(message);
        }

        if (message.contains("Constraint Error")) {
            return "Query violates a table constraint: " + message;
        }

        if (message.contains("Syntax Error") || message.contains("Parser Error")) {
            return "Generated SQL was rejected by the parser. " +
                   "Try simplifying the request and report the failing query.";
        }

        if (message.contains("Catalog Error")) {
            return "Table or column not found in the database. " +
                   "The schema may have changed since it was loaded.";
        }

        return "Query execution failed: " + message;
    }

    private String translateColumnNotFound(String message) {
        Matcher matcher = Pattern.compile("column \"([^\"]+)\" not found").matcher(message);

        if (matcher.find()) {
            String missingColumn = matcher.group(1);

            Matcher candidates = Pattern.compile("Candidate bindings: (.+)", Pattern.CASE_INSENSITIVE)
                .matcher(message);
            if (candidates.find()) {
                return "Column '" + missingColumn + "' not found. Available columns: " + candidates.group(1);
            }

            return "Column '" + missingColumn + "' not found in table. " +
                   "Check column name spelling and case sensitivity.";
        }

        return "Column not found: " + message;
    }

    private String translateConversionError(String message) {
        Matcher matcher = Pattern.compile("Could not convert string '([^']+)' to ([A-Z0-9_]+)")
            .matcher(message);
        if (matcher.find()) {
            return "Cannot convert value '" + matcher.group(1) + "' to type " + matcher.group(2) + ". " +
                   "Check that filter values match the column types.";
        }

        return "Data type mismatch in query. " +
               "Check that filter values match the column types.";
    }
}
