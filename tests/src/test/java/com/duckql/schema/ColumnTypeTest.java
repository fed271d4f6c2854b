package com.duckql.schema;

import com.duckql.test.TestCategories;

import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import static org.assertj.core.api.Assertions.*;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Tests for ColumnType mapping and value acceptance.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ColumnType Tests")
public class ColumnTypeTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "INTEGER, INTEGER",
        "bigint, INTEGER",
        "HUGEINT, INTEGER",
        "UBIGINT, INTEGER",
        "FLOAT, FLOATING",
        "DOUBLE, FLOATING",
        "'DECIMAL(10,2)', DECIMAL",
        "VARCHAR, STRING",
        "BOOLEAN, BOOLEAN",
        "DATE, DATE",
        "TIME, TIME",
        "TIMESTAMP, TIMESTAMP",
        "TIMESTAMP WITH TIME ZONE, TIMESTAMP",
        "UUID, UUID",
        "BLOB, BLOB",
        "'VARCHAR[]', OTHER",
        "'STRUCT(a INTEGER)', OTHER",
        "'MAP(VARCHAR, INTEGER)', OTHER",
        "INTERVAL, OTHER"
    })
    @DisplayName("DuckDB type names map to categories")
    void testFromDuckDB(String duckdbType, ColumnType expected) {
        assertThat(ColumnType.fromDuckDB(duckdbType)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Null type name maps to OTHER")
    void testNullTypeName() {
        assertThat(ColumnType.fromDuckDB(null)).isEqualTo(ColumnType.OTHER);
    }

    @Test
    @DisplayName("Category predicates")
    void testCategoryPredicates() {
        assertThat(ColumnType.DECIMAL.isNumeric()).isTrue();
        assertThat(ColumnType.STRING.isNumeric()).isFalse();
        assertThat(ColumnType.DATE.isOrdered()).isTrue();
        assertThat(ColumnType.BOOLEAN.isOrdered()).isFalse();
        assertThat(ColumnType.UUID.isOrdered()).isFalse();
    }

    @Nested
    @DisplayName("Value Acceptance")
    class ValueAcceptance {

        @Test
        @DisplayName("Integer columns take integral values only")
        void testInteger() {
            assertThat(ColumnType.INTEGER.accepts(5)).isTrue();
            assertThat(ColumnType.INTEGER.accepts(5L)).isTrue();
            assertThat(ColumnType.INTEGER.accepts(BigInteger.TEN.pow(30))).isTrue();
            assertThat(ColumnType.INTEGER.accepts(new BigDecimal("7.000"))).isTrue();
            assertThat(ColumnType.INTEGER.accepts(new BigDecimal("7.5"))).isFalse();
            assertThat(ColumnType.INTEGER.accepts(7.0)).isFalse();
            assertThat(ColumnType.INTEGER.accepts("7")).isFalse();
        }

        @Test
        @DisplayName("Floating and decimal columns take any number")
        void testFloating() {
            assertThat(ColumnType.FLOATING.accepts(1)).isTrue();
            assertThat(ColumnType.FLOATING.accepts(1.5f)).isTrue();
            assertThat(ColumnType.DECIMAL.accepts(new BigDecimal("10.25"))).isTrue();
            assertThat(ColumnType.DECIMAL.accepts("10.25")).isFalse();
        }

        @Test
        @DisplayName("Temporal columns take java.time values or ISO strings")
        void testTemporal() {
            assertThat(ColumnType.DATE.accepts(LocalDate.of(2024, 2, 29))).isTrue();
            assertThat(ColumnType.DATE.accepts("2024-02-29")).isTrue();
            assertThat(ColumnType.DATE.accepts("2023-02-29")).isFalse();
            assertThat(ColumnType.TIMESTAMP.accepts(LocalDateTime.of(2024, 1, 1, 12, 0))).isTrue();
            assertThat(ColumnType.TIMESTAMP.accepts("2024-01-01T12:00:00")).isTrue();
            assertThat(ColumnType.TIMESTAMP.accepts(20240101)).isFalse();
            assertThat(ColumnType.TIME.accepts("12:30:00")).isTrue();
        }

        @Test
        @DisplayName("Other categories")
        void testOthers() {
            assertThat(ColumnType.STRING.accepts("x")).isTrue();
            assertThat(ColumnType.STRING.accepts(1)).isFalse();
            assertThat(ColumnType.BOOLEAN.accepts(Boolean.FALSE)).isTrue();
            assertThat(ColumnType.BOOLEAN.accepts("true")).isFalse();
            assertThat(ColumnType.UUID.accepts(UUID.randomUUID())).isTrue();
            assertThat(ColumnType.UUID.accepts("not-a-uuid")).isFalse();
            assertThat(ColumnType.BLOB.accepts(new byte[] {1})).isTrue();
            assertThat(ColumnType.OTHER.accepts(new Object())).isTrue();
        }
    }
}
