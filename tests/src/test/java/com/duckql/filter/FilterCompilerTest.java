package com.duckql.filter;

import com.duckql.exception.ErrorKind;
import com.duckql.exception.ValidationException;
import com.duckql.schema.TableSchema;
import com.duckql.test.TestBase;
import com.duckql.test.TestCategories;
import com.duckql.test.TestSchemas;

import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import static org.assertj.core.api.Assertions.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Tests for FilterCompiler - filter trees to parameterized predicates.
 *
 * Tests cover:
 * - Rendering of every leaf operator and logical connective
 * - Parameter binding order and count
 * - Column, operator and value validation
 * - Malformed logical nodes
 *
 * @see FilterCompiler
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("FilterCompiler Unit Tests")
public class FilterCompilerTest extends TestBase {

    private FilterCompiler compiler;
    private TableSchema sales;
    private TableSchema users;

    @Override
    protected void doSetUp() {
        compiler = new FilterCompiler();
        sales = TestSchemas.sales();
        users = TestSchemas.users();
    }

    static Stream<FilterNode> scalarTrees() {
        return Stream.of(
            FilterNode.eq("region", "North"),
            FilterNode.and(FilterNode.eq("region", "North"), FilterNode.compare("amount", "gte", 500)),
            FilterNode.or(FilterNode.isNull("region"), FilterNode.compare("amount", "lt", 1.5)),
            FilterNode.not(FilterNode.or(FilterNode.eq("region", "a"),
                FilterNode.and(FilterNode.isNull("amount"), FilterNode.compare("region", "ilike", "%x%")))),
            FilterNode.and(FilterNode.and(FilterNode.and(FilterNode.eq("amount", 1)))));
    }

    @Nested
    @DisplayName("Leaf Operators")
    class LeafOperators {

        @Test
        @DisplayName("Comparison operators render fixed fragments with one placeholder")
        void testComparisonOperators() {
            assertThat(compiler.compile(FilterNode.compare("age", "eq", 30), users).sql()).isEqualTo("age = ?");
            assertThat(compiler.compile(FilterNode.compare("age", "ne", 30), users).sql()).isEqualTo("age != ?");
            assertThat(compiler.compile(FilterNode.compare("age", "gt", 30), users).sql()).isEqualTo("age > ?");
            assertThat(compiler.compile(FilterNode.compare("age", "gte", 30), users).sql()).isEqualTo("age >= ?");
            assertThat(compiler.compile(FilterNode.compare("age", "lt", 30), users).sql()).isEqualTo("age < ?");
            assertThat(compiler.compile(FilterNode.compare("age", "lte", 30), users).sql()).isEqualTo("age <= ?");
        }

        @Test
        @DisplayName("LIKE and ILIKE bind the pattern")
        void testLikeOperators() {
            CompiledPredicate like = compiler.compile(FilterNode.compare("email", "like", "%@example.com"), users);
            CompiledPredicate ilike = compiler.compile(FilterNode.compare("email", "ilike", "%@EXAMPLE.COM"), users);

            assertThat(like.sql()).isEqualTo("email LIKE ?");
            assertThat(like.params()).containsExactly("%@example.com");
            assertThat(ilike.sql()).isEqualTo("email ILIKE ?");
        }

        @Test
        @DisplayName("IN and NOT IN bind one placeholder per element")
        void testInOperators() {
            CompiledPredicate in = compiler.compile(
                FilterNode.compare("region", FilterOperator.IN, List.of("North", "South")), sales);
            CompiledPredicate notIn = compiler.compile(
                FilterNode.compare("age", FilterOperator.NOT_IN, new int[] {18, 21, 65}), users);

            assertThat(in.sql()).isEqualTo("region IN (?, ?)");
            assertThat(in.params()).containsExactly("North", "South");
            assertThat(notIn.sql()).isEqualTo("age NOT IN (?, ?, ?)");
            assertThat(notIn.params()).containsExactly(18, 21, 65);
        }

        @Test
        @DisplayName("is_null binds nothing")
        void testIsNull() {
            CompiledPredicate isNull = compiler.compile(FilterNode.isNull("email"), users);
            CompiledPredicate notNull = compiler.compile(FilterNode.compare("email", "is_null", false), users);

            assertThat(isNull.sql()).isEqualTo("email IS NULL");
            assertThat(isNull.params()).isEmpty();
            assertThat(notNull.sql()).isEqualTo("email IS NOT NULL");
            assertThat(notNull.params()).isEmpty();
        }

        @Test
        @DisplayName("Reserved-word columns are quoted")
        void testReservedColumnQuoted() {
            CompiledPredicate predicate = compiler.compile(FilterNode.eq("order", 3), TestSchemas.orders());

            assertThat(predicate.sql()).isEqualTo("\"order\" = ?");
        }
    }

    @Nested
    @DisplayName("Logical Connectives")
    class LogicalConnectives {

        @Test
        @DisplayName("Sales scenario: _and of region and amount")
        void testSalesScenario() {
            // Given: {_and:[{region:{eq:"North"}},{amount:{gte:500}}]}
            FilterNode filter = FilterNode.parse(Map.of("_and", List.of(
                Map.of("region", Map.of("eq", "North")),
                Map.of("amount", Map.of("gte", 500)))));

            // When
            CompiledPredicate predicate = compiler.compile(filter, sales);

            // Then
            assertThat(predicate.sql()).isEqualTo("(region = ? AND amount >= ?)");
            assertThat(predicate.params()).containsExactly("North", 500);
        }

        @Test
        @DisplayName("OR joins children; NOT wraps one child")
        void testOrAndNot() {
            FilterNode filter = FilterNode.or(
                FilterNode.eq("region", "North"),
                FilterNode.not(FilterNode.compare("amount", "lt", 100)));

            CompiledPredicate predicate = compiler.compile(filter, sales);

            assertThat(predicate.sql()).isEqualTo("(region = ? OR NOT (amount < ?))");
            assertThat(predicate.params()).containsExactly("North", 100);
        }

        @Test
        @DisplayName("Nested connectives keep left-to-right parameter order")
        void testNestedParameterOrder() {
            FilterNode filter = FilterNode.and(
                FilterNode.or(FilterNode.eq("name", "a"), FilterNode.eq("name", "b")),
                FilterNode.not(FilterNode.and(FilterNode.compare("age", "gt", 1), FilterNode.isNull("email"))),
                FilterNode.compare("id", "in", List.of(7, 8)));

            CompiledPredicate predicate = compiler.compile(filter, users);

            assertThat(predicate.sql()).isEqualTo(
                "((name = ? OR name = ?) AND NOT ((age > ? AND email IS NULL)) AND id IN (?, ?))");
            assertThat(predicate.params()).containsExactly("a", "b", 1, 7, 8);
        }

        @Test
        @DisplayName("Single-child AND still parenthesises")
        void testSingleChild() {
            assertThat(compiler.compile(FilterNode.and(FilterNode.eq("region", "x")), sales).sql())
                .isEqualTo("(region = ?)");
        }

        @Test
        @DisplayName("Empty AND is rejected")
        void testEmptyAnd() {
            assertThatThrownBy(() -> compiler.compile(FilterNode.and(), sales))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("AND requires at least one operand");
        }

        @Test
        @DisplayName("NOT with two children is rejected")
        void testNotArity() {
            FilterNode bad = new FilterNode.Logical(FilterNode.LogicalKind.NOT,
                List.of(FilterNode.eq("region", "a"), FilterNode.eq("region", "b")));

            assertThatThrownBy(() -> compiler.compile(bad, sales))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("exactly one operand");
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Unknown column suggests the closest name")
        void testUnknownColumnSuggestion() {
            assertThatThrownBy(() -> compiler.compile(FilterNode.eq("amout", 1), sales))
                .isInstanceOfSatisfying(ValidationException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
                    assertThat(e.getContext()).containsEntry("column", "amout").containsEntry("table", "sales");
                    assertThat(e.getSuggestions()).containsExactly("amount");
                });
        }

        @Test
        @DisplayName("Unknown column with no close match lists the schema")
        void testUnknownColumnListsSchema() {
            assertThatThrownBy(() -> compiler.compile(FilterNode.eq("foo", 1), sales))
                .isInstanceOfSatisfying(ValidationException.class, e -> {
                    assertThat(e.getMessage()).contains("'foo'");
                    assertThat(e.getSuggestions()).singleElement().asString()
                        .contains("amount").contains("region");
                });
        }

        @Test
        @DisplayName("Type mismatch carries field, expected type and actual value")
        void testTypeMismatch() {
            assertThatThrownBy(() -> compiler.compile(FilterNode.eq("amount", "lots"), sales))
                .isInstanceOfSatisfying(ValidationException.class, e -> assertThat(e.getContext())
                    .containsEntry("field", "amount")
                    .containsEntry("expected_type", "FLOAT")
                    .containsEntry("actual_value", "lots")
                    .containsEntry("actual_type", "String"));
        }

        @Test
        @DisplayName("Integer columns reject fractional values but accept whole BigDecimals")
        void testIntegerValues() {
            assertThatThrownBy(() -> compiler.compile(FilterNode.eq("age", 3.5), users))
                .isInstanceOf(ValidationException.class);

            assertThat(compiler.compile(FilterNode.eq("age", new BigDecimal("30.00")), users).params())
                .containsExactly(new BigDecimal("30.00"));
        }

        @Test
        @DisplayName("Date columns accept LocalDate and ISO strings only")
        void testDateValues() {
            assertThat(compiler.compile(FilterNode.compare("birth_date", "gte", "2020-01-01"), users).sql())
                .isEqualTo("birth_date >= ?");
            assertThat(compiler.compile(FilterNode.compare("birth_date", "lt", LocalDate.of(2000, 1, 1)), users)
                .params()).hasSize(1);

            assertThatThrownBy(() -> compiler.compile(FilterNode.eq("birth_date", "yesterday"), users))
                .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Operator not available for column type is rejected")
        void testUnsupportedOperator() {
            assertThatThrownBy(() -> compiler.compile(FilterNode.compare("amount", "like", "1%"), sales))
                .isInstanceOfSatisfying(ValidationException.class, e -> {
                    assertThat(e.getMessage()).contains("'like'").contains("amount");
                    assertThat(e.getSuggestions()).singleElement().asString().contains("gte");
                });

            assertThatThrownBy(() -> compiler.compile(FilterNode.compare("active", "gt", true), users))
                .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Unknown operator name is rejected")
        void testUnknownOperator() {
            assertThatThrownBy(() -> FilterNode.parse(Map.of("amount", Map.of("between", 1))))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Unknown filter operator 'between'");
        }

        @Test
        @DisplayName("Empty IN list is a compile error")
        void testEmptyInList() {
            assertThatThrownBy(() -> compiler.compile(
                    FilterNode.compare("region", FilterOperator.IN, List.of()), sales))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("non-empty list");
        }

        @Test
        @DisplayName("Null value outside is_null is rejected")
        void testNullValue() {
            assertThatThrownBy(() -> compiler.compile(FilterNode.eq("region", null), sales))
                .isInstanceOfSatisfying(ValidationException.class, e ->
                    assertThat(e.getSuggestions()).anySatisfy(s -> assertThat(s).contains("is_null")));
        }
    }

    @Nested
    @DisplayName("Parameterization Properties")
    class ParameterizationProperties {

        @ParameterizedTest
        @MethodSource("com.duckql.filter.FilterCompilerTest#scalarTrees")
        @DisplayName("Parameter count equals comparisons excluding is_null, and equals placeholder count")
        void testParameterCount(FilterNode tree) {
            CompiledPredicate predicate = compiler.compile(tree, sales);

            assertThat(predicate.params()).hasSize(countValueComparisons(tree));
            assertThat(predicate.sql().chars().filter(c -> c == '?').count())
                .isEqualTo(predicate.placeholderCount());
        }

        @ParameterizedTest
        @MethodSource("com.duckql.filter.FilterCompilerTest#scalarTrees")
        @DisplayName("Compilation is deterministic")
        void testDeterministic(FilterNode tree) {
            CompiledPredicate first = compiler.compile(tree, sales);
            CompiledPredicate second = compiler.compile(tree, sales);

            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("Injection attempts stay in the parameter list")
        void testValuesNeverInlined() {
            String attack = "North'; DROP TABLE sales; --";

            CompiledPredicate predicate = compiler.compile(FilterNode.eq("region", attack), sales);

            assertThat(predicate.sql()).isEqualTo("region = ?");
            assertThat(predicate.sql()).doesNotContain("DROP");
            assertThat(predicate.params()).containsExactly(attack);
        }

        private int countValueComparisons(FilterNode node) {
            if (node instanceof FilterNode.Comparison) {
                return ((FilterNode.Comparison) node).operator() == FilterOperator.IS_NULL ? 0 : 1;
            }
            int count = 0;
            for (FilterNode child : ((FilterNode.Logical) node).children()) {
                count += countValueComparisons(child);
            }
            return count;
        }
    }
}
