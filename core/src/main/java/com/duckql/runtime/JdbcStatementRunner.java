package com.duckql.runtime;

import com.duckql.generator.CompiledQuery;

import java.math.BigInteger;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs compiled statements through JDBC prepared statements.
 *
 * <p>Parameters are bound positionally. Java time values are bound as JDBC
 * date/timestamp values and times as TIME literals; JDBC date, time and
 * timestamp results are read back as {@code java.time} values.
 */
public class JdbcStatementRunner implements StatementRunner {

    private static final DateTimeFormatter TIME_LITERAL = DateTimeFormatter.ofPattern("HH:mm:ss.SSSSSS");

    @Override
    public Rows run(Connection connection, CompiledQuery query) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(query.sql())) {
            List<Object> params = query.params();
            for (int i = 0; i < params.size(); i++) {
                bind(stmt, i + 1, params.get(i));
            }

            try (ResultSet rs = stmt.executeQuery()) {
                ResultSetMetaData meta = rs.getMetaData();
                int columnCount = meta.getColumnCount();
                List<String> columns = new ArrayList<>(columnCount);
                for (int i = 1; i <= columnCount; i++) {
                    columns.add(meta.getColumnLabel(i));
                }

                List<Map<String, Object>> rows = new ArrayList<>();
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 1; i <= columnCount; i++) {
                        row.put(columns.get(i - 1), read(rs.getObject(i)));
                    }
                    rows.add(row);
                }
                return new Rows(columns, rows);
            }
        }
    }

    static void bind(PreparedStatement stmt, int index, Object value) throws SQLException {
        if (value instanceof LocalDate) {
            stmt.setDate(index, java.sql.Date.valueOf((LocalDate) value));
        } else if (value instanceof LocalDateTime) {
            stmt.setTimestamp(index, Timestamp.valueOf((LocalDateTime) value));
        } else if (value instanceof LocalTime) {
            // the driver has no LocalTime binding; DuckDB casts the literal to TIME
            stmt.setString(index, TIME_LITERAL.format((LocalTime) value));
        } else if (value instanceof Instant) {
            stmt.setTimestamp(index, Timestamp.from((Instant) value));
        } else if (value instanceof OffsetDateTime) {
            stmt.setTimestamp(index, Timestamp.from(((OffsetDateTime) value).toInstant()));
        } else if (value instanceof BigInteger) {
            stmt.setBigDecimal(index, new BigDecimal((BigInteger) value));
        } else if (value instanceof CharSequence) {
            stmt.setString(index, value.toString());
        } else if (value instanceof java.util.UUID) {
            stmt.setString(index, value.toString());
        } else {
            stmt.setObject(index, value);
        }
    }

    static Object read(Object value) {
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate();
        }
        if (value instanceof java.sql.Time) {
            return ((java.sql.Time) value).toLocalTime();
        }
        return value;
    }
}
