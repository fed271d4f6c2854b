package com.duckql.exception;

import com.duckql.validation.NameSuggester;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Exception thrown when a request fails validation before any SQL is run.
 *
 * <p>Covers unknown tables and columns, operators that do not apply to a
 * column, filter values of the wrong type, malformed filter trees, invalid
 * pagination and over-deep selections. Validation errors are never retried
 * and never reach the executor.
 *
 * <p>Use the static factories so that context keys and suggestions stay
 * consistent:
 * <pre>
 *   throw ValidationException.unknownColumn("sales", "amout", schema.columnNames());
 *   // suggestions: ["amount"]
 * </pre>
 */
public class ValidationException extends DuckQLException {

    public ValidationException(String message) {
        this(message, null, null);
    }

    public ValidationException(String message, Map<String, Object> context, List<String> suggestions) {
        super(message, ErrorKind.VALIDATION_ERROR, context, suggestions, null);
    }

    /**
     * Creates an error for a table that is not in the schema registry.
     *
     * @param table the requested table
     * @param available the registered table names
     * @return the exception
     */
    public static ValidationException unknownTable(String table, Collection<String> available) {
        ValidationException e = new ValidationException("Table '" + table + "' not found");
        e.putContext("table", table);
        suggestNames(e, table, available);
        return e;
    }

    /**
     * Creates an error for a column reference that is not in the target table.
     *
     * @param table the target table
     * @param column the unknown column
     * @param available the column names of the table (or namespace) searched
     * @return the exception
     */
    public static ValidationException unknownColumn(String table, String column, Collection<String> available) {
        ValidationException e = new ValidationException(
            "Column '" + column + "' does not exist in table '" + table + "'");
        e.putContext("table", table);
        e.putContext("column", column);
        suggestNames(e, column, available);
        return e;
    }

    /**
     * Creates an error for a filter value whose Java type does not match the
     * declared column type.
     *
     * @param table the target table
     * @param field the column the value was compared against
     * @param expectedType the declared column type
     * @param actualValue the offending value
     * @return the exception
     */
    public static ValidationException typeMismatch(String table, String field,
                                                   String expectedType, Object actualValue) {
        ValidationException e = new ValidationException(
            "Value for '" + field + "' does not match column type " + expectedType);
        e.putContext("table", table);
        e.putContext("field", field);
        e.putContext("expected_type", expectedType);
        if (actualValue != null) {
            e.putContext("actual_value", String.valueOf(actualValue));
            e.putContext("actual_type", actualValue.getClass().getSimpleName());
        }
        e.addSuggestion("Pass a value compatible with " + expectedType + " for '" + field + "'");
        return e;
    }

    /**
     * Creates an error for a selection tree nested deeper than allowed.
     *
     * @param actual the measured depth
     * @param allowed the configured maximum
     * @return the exception
     */
    public static ValidationException depthExceeded(int actual, int allowed) {
        ValidationException e = new ValidationException(
            "Query depth (" + actual + ") exceeds maximum allowed depth (" + allowed + ")");
        e.putContext("actual_depth", actual);
        e.putContext("max_depth", allowed);
        e.addSuggestion("Reduce nesting of object selections to at most " + allowed + " levels");
        e.addSuggestion("Split the request into several shallower requests");
        return e;
    }

    /**
     * Creates an error for a structurally invalid filter or request.
     *
     * @param table the target table (may be null)
     * @param message what is wrong
     * @param suggestion how to fix it (may be null)
     * @return the exception
     */
    public static ValidationException malformed(String table, String message, String suggestion) {
        ValidationException e = new ValidationException(message);
        e.putContext("table", table);
        if (suggestion != null) {
            e.addSuggestion(suggestion);
        }
        return e;
    }

    private static void suggestNames(ValidationException e, String requested, Collection<String> available) {
        List<String> closest = NameSuggester.closest(requested, available);
        if (!closest.isEmpty()) {
            for (String name : closest) {
                e.addSuggestion(name);
            }
        } else if (available != null && !available.isEmpty()) {
            e.addSuggestion("Available names: " + String.join(", ", available));
        }
    }
}
