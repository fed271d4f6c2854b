package com.duckql.generator;

import java.util.Locale;
import java.util.Set;

/**
 * Utilities for quoting SQL identifiers in generated DuckDB statements.
 *
 * <p>Generated SQL never embeds values; only identifiers from the schema
 * registry are written into the text, and they go through here. Plain
 * names stay unquoted for readability; anything else is double-quoted
 * with internal quotes doubled.
 *
 * <p>Example usage:
 * <pre>
 *   SQLQuoting.quoteIdentifierIfNeeded("amount");      // amount
 *   SQLQuoting.quoteIdentifierIfNeeded("order");       // "order"
 *   SQLQuoting.quoteIdentifierIfNeeded("unit price");  // "unit price"
 *   SQLQuoting.quoteIdentifier("a\"b");                // "a""b"
 * </pre>
 */
public final class SQLQuoting {

    /** DuckDB reserved keywords plus the clause words generated statements use. */
    private static final Set<String> RESERVED_WORDS = Set.of(
        "ALL", "ANALYSE", "ANALYZE", "AND", "ANY", "ARRAY", "AS", "ASC", "ASYMMETRIC",
        "BETWEEN", "BOTH", "BY", "CASE", "CAST", "CHECK", "COLLATE", "COLUMN", "CONSTRAINT",
        "CREATE", "CROSS", "DEFAULT", "DEFERRABLE", "DESC", "DESCRIBE", "DISTINCT", "DO",
        "ELSE", "END", "EXCEPT", "EXISTS", "FALSE", "FETCH", "FIRST", "FOR", "FOREIGN",
        "FROM", "FULL", "GRANT", "GROUP", "HAVING", "ILIKE", "IN", "INITIALLY", "INNER",
        "INTERSECT", "INTO", "IS", "JOIN", "LAST", "LATERAL", "LEADING", "LEFT", "LIKE",
        "LIMIT", "NOT", "NULL", "NULLS", "OFFSET", "ON", "ONLY", "OR", "ORDER", "OUTER",
        "PIVOT", "PLACING", "PRIMARY", "QUALIFY", "REFERENCES", "RETURNING", "RIGHT",
        "SELECT", "SHOW", "SOME", "SUMMARIZE", "SYMMETRIC", "TABLE", "THEN", "TO",
        "TRAILING", "TRUE", "UNION", "UNIQUE", "UNPIVOT", "USING", "VARIADIC", "WHEN",
        "WHERE", "WINDOW", "WITH");

    private SQLQuoting() {}

    /**
     * Quotes an identifier unconditionally.
     *
     * @param identifier the identifier to quote
     * @return the double-quoted identifier
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Quotes an identifier only if it is not a plain, non-reserved name.
     *
     * @param identifier the identifier to conditionally quote
     * @return the identifier, quoted if necessary
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifierIfNeeded(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return needsQuoting(identifier) ? quoteIdentifier(identifier) : identifier;
    }

    /**
     * Returns whether an identifier must be quoted to be read back as the
     * same name: it starts with a digit, contains anything other than
     * ASCII letters, digits and underscores, or is a reserved word.
     *
     * @param identifier the identifier to check
     * @return true if quoting is needed
     */
    public static boolean needsQuoting(String identifier) {
        char first = identifier.charAt(0);
        if (!isAsciiLetter(first) && first != '_') {
            return true;
        }
        for (int i = 1; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (!isAsciiLetter(c) && !(c >= '0' && c <= '9') && c != '_') {
                return true;
            }
        }
        return RESERVED_WORDS.contains(identifier.toUpperCase(Locale.ROOT));
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
