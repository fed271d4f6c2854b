package com.duckql.schema;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.UUID;

/**
 * Type categories of DuckDB columns, as far as query compilation cares.
 *
 * <p>Each category knows which Java values are acceptable as filter
 * parameters against a column of that category. {@link #fromDuckDB(String)}
 * maps DuckDB's declared type names (as reported by
 * {@code information_schema.columns}) onto a category.
 */
public enum ColumnType {

    INTEGER,
    FLOATING,
    DECIMAL,
    STRING,
    BOOLEAN,
    DATE,
    TIME,
    TIMESTAMP,
    UUID,
    BLOB,
    OTHER;

    /**
     * Maps a DuckDB type name to a column category.
     *
     * @param duckdbType the DuckDB type name (e.g. "INTEGER", "DECIMAL(10,2)", "VARCHAR[]")
     * @return the category; {@link #OTHER} for nested and unknown types
     */
    public static ColumnType fromDuckDB(String duckdbType) {
        if (duckdbType == null) {
            return OTHER;
        }

        String normalized = duckdbType.toUpperCase(Locale.ROOT).trim();

        // Arrays, structs, maps and unions are compared as opaque values
        if (normalized.endsWith("]") || normalized.startsWith("STRUCT") || normalized.startsWith("MAP")
                || normalized.startsWith("UNION") || normalized.startsWith("LIST")) {
            return OTHER;
        }

        normalized = normalized.replaceAll("\\(.*\\)", "").trim();

        switch (normalized) {
            case "TINYINT":
            case "INT1":
            case "SMALLINT":
            case "INT2":
            case "SHORT":
            case "INTEGER":
            case "INT":
            case "INT4":
            case "SIGNED":
            case "BIGINT":
            case "INT8":
            case "LONG":
            case "HUGEINT":
            case "INT128":
            case "UTINYINT":
            case "USMALLINT":
            case "UINTEGER":
            case "UBIGINT":
            case "UHUGEINT":
                return INTEGER;

            case "REAL":
            case "FLOAT":
            case "FLOAT4":
            case "DOUBLE":
            case "FLOAT8":
                return FLOATING;

            case "DECIMAL":
            case "NUMERIC":
                return DECIMAL;

            case "VARCHAR":
            case "CHAR":
            case "BPCHAR":
            case "TEXT":
            case "STRING":
            case "NAME":
                return STRING;

            case "BOOLEAN":
            case "BOOL":
            case "LOGICAL":
                return BOOLEAN;

            case "DATE":
                return DATE;

            case "TIME":
            case "TIME WITH TIME ZONE":
            case "TIMETZ":
                return TIME;

            case "TIMESTAMP":
            case "DATETIME":
            case "TIMESTAMP WITHOUT TIME ZONE":
            case "TIMESTAMP WITH TIME ZONE":
            case "TIMESTAMPTZ":
            case "TIMESTAMP_S":
            case "TIMESTAMP_MS":
            case "TIMESTAMP_NS":
                return TIMESTAMP;

            case "UUID":
                return UUID;

            case "BLOB":
            case "BYTEA":
            case "BINARY":
            case "VARBINARY":
                return BLOB;

            default:
                return OTHER;
        }
    }

    /**
     * Returns whether SUM and AVG apply to columns of this category.
     *
     * @return true for integer, floating and decimal columns
     */
    public boolean isNumeric() {
        return this == INTEGER || this == FLOATING || this == DECIMAL;
    }

    /**
     * Returns whether columns of this category have a meaningful ordering
     * for range comparisons.
     *
     * @return true for numeric, string and temporal columns
     */
    public boolean isOrdered() {
        return isNumeric() || this == STRING || this == DATE || this == TIME || this == TIMESTAMP;
    }

    /**
     * Checks whether a Java value may be bound as a parameter compared
     * against a column of this category.
     *
     * @param value the candidate value (never null)
     * @return true if the value is acceptable
     */
    public boolean accepts(Object value) {
        switch (this) {
            case INTEGER:
                return isIntegral(value);
            case FLOATING:
            case DECIMAL:
                return value instanceof Number;
            case STRING:
                return value instanceof CharSequence;
            case BOOLEAN:
                return value instanceof Boolean;
            case DATE:
                return value instanceof LocalDate || parses(value, ColumnType::parseDate);
            case TIME:
                return value instanceof LocalTime || parses(value, LocalTime::parse);
            case TIMESTAMP:
                return value instanceof LocalDateTime || value instanceof Instant
                    || value instanceof OffsetDateTime || parses(value, ColumnType::parseTimestamp);
            case UUID:
                return value instanceof java.util.UUID || parses(value, java.util.UUID::fromString);
            case BLOB:
                return value instanceof byte[];
            default:
                return true;
        }
    }

    private static boolean isIntegral(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof BigDecimal) {
            BigDecimal decimal = (BigDecimal) value;
            return decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0;
        }
        return false;
    }

    private static boolean parses(Object value, java.util.function.Function<String, ?> parser) {
        if (!(value instanceof CharSequence)) {
            return false;
        }
        try {
            parser.apply(value.toString());
            return true;
        } catch (DateTimeParseException | IllegalArgumentException e) {
            return false;
        }
    }

    private static Object parseDate(String text) {
        return LocalDate.parse(text);
    }

    private static Object parseTimestamp(String text) {
        try {
            return LocalDateTime.parse(text.replace(' ', 'T'));
        } catch (DateTimeParseException e) {
            return OffsetDateTime.parse(text.replace(' ', 'T'));
        }
    }
}
