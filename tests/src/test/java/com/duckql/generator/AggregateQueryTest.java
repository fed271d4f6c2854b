package com.duckql.generator;

import com.duckql.exception.ValidationException;
import com.duckql.filter.FilterNode;
import com.duckql.test.TestBase;
import com.duckql.test.TestCategories;
import com.duckql.test.TestSchemas;

import org.junit.jupiter.api.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for aggregate statement generation: GROUP BY, aggregate aliases,
 * HAVING over output names, and ordering by aggregate outputs.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Aggregate Query Tests")
public class AggregateQueryTest extends TestBase {

    private QueryBuilder builder;

    @Override
    protected void doSetUp() {
        builder = new QueryBuilder(TestSchemas.registry());
    }

    @Test
    @DisplayName("Sum per region with unconditional _count")
    void testSumPerRegion() {
        // Given
        QueryRequest request = QueryRequest.aggregate("sales")
            .groupBy("region")
            .aggregate(Aggregation.sum("amount"))
            .build();

        // When
        CompiledQuery query = builder.build(request);

        // Then
        assertThat(query.sql()).isEqualTo(
            "SELECT region, SUM(amount) AS sum_amount, COUNT(*) AS _count FROM sales "
                + "GROUP BY region ORDER BY region ASC");
        assertThat(query.params()).isEmpty();
        assertThat(query.kind()).isEqualTo(OperationKind.AGGREGATE);
        assertThat(query.resultColumns()).containsExactly("region", "sum_amount", "_count");
    }

    @Test
    @DisplayName("Missing groupBy is a compile error")
    void testMissingGroupBy() {
        assertThatThrownBy(() -> builder.build(QueryRequest.aggregate("sales")
                .aggregate(Aggregation.sum("amount")).build()))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("requires at least one groupBy column");
    }

    @Test
    @DisplayName("Without explicit aggregates, numeric columns get SUM, AVG, MIN and MAX")
    void testDefaultAggregations() {
        CompiledQuery query = builder.build(QueryRequest.aggregate("sales").groupBy("region").build());

        assertThat(query.sql()).isEqualTo(
            "SELECT region, SUM(amount) AS sum_amount, AVG(amount) AS avg_amount, "
                + "MIN(amount) AS min_amount, MAX(amount) AS max_amount, COUNT(*) AS _count "
                + "FROM sales GROUP BY region ORDER BY region ASC");
    }

    @Test
    @DisplayName("HAVING compiles against aggregate expressions")
    void testHaving() {
        CompiledQuery query = builder.build(QueryRequest.aggregate("sales")
            .groupBy("region")
            .aggregate(Aggregation.sum("amount"))
            .having(FilterNode.and(
                FilterNode.compare("sum_amount", "gt", 1000),
                FilterNode.compare("_count", "gte", 2)))
            .build());

        assertThat(query.sql()).contains("GROUP BY region HAVING (SUM(amount) > ? AND COUNT(*) >= ?)");
        assertThat(query.params()).containsExactly(1000, 2);
    }

    @Test
    @DisplayName("WHERE parameters precede HAVING parameters")
    void testWhereThenHavingParams() {
        CompiledQuery query = builder.build(QueryRequest.aggregate("sales")
            .groupBy("region")
            .aggregate(Aggregation.max("amount"))
            .where(FilterNode.compare("amount", "gt", 100))
            .having(FilterNode.compare("max_amount", "lt", 1000))
            .build());

        assertThat(query.sql()).isEqualTo(
            "SELECT region, MAX(amount) AS max_amount, COUNT(*) AS _count FROM sales "
                + "WHERE amount > ? GROUP BY region HAVING MAX(amount) < ? ORDER BY region ASC");
        assertThat(query.params()).containsExactly(100, 1000);
    }

    @Test
    @DisplayName("Order by aggregate output then group columns, with pagination")
    void testOrderByAggregate() {
        CompiledQuery query = builder.build(QueryRequest.aggregate("sales")
            .groupBy("region")
            .aggregate(Aggregation.sum("amount"))
            .orderBy(OrderBy.desc("sum_amount"))
            .limit(2)
            .build());

        assertThat(query.sql()).endsWith("GROUP BY region ORDER BY sum_amount DESC, region ASC LIMIT 2");
    }

    @Test
    @DisplayName("Requested fields narrow the result columns")
    void testFieldsNarrowResult() {
        CompiledQuery query = builder.build(QueryRequest.aggregate("sales")
            .groupBy("region")
            .aggregate(Aggregation.avg("amount"))
            .fields("region", "avg_amount")
            .build());

        assertThat(query.resultColumns()).containsExactly("region", "avg_amount");
        assertThat(query.sql()).contains("COUNT(*) AS _count");
    }

    @Test
    @DisplayName("SUM of a VARCHAR column is rejected")
    void testSumOnString() {
        assertThatThrownBy(() -> builder.build(QueryRequest.aggregate("sales")
                .groupBy("amount")
                .aggregate(Aggregation.sum("region"))
                .build()))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("SUM")
            .hasMessageContaining("region");
    }

    @Test
    @DisplayName("COUNT applies to any column")
    void testCountAnyColumn() {
        CompiledQuery query = builder.build(QueryRequest.aggregate("users")
            .groupBy("active")
            .aggregate(Aggregation.count("email"))
            .build());

        assertThat(query.sql()).startsWith("SELECT active, COUNT(email) AS count_email, COUNT(*) AS _count");
    }

    @Test
    @DisplayName("HAVING values are type-checked against aggregate result types")
    void testHavingTypeMismatch() {
        assertThatThrownBy(() -> builder.build(QueryRequest.aggregate("sales")
                .groupBy("region")
                .aggregate(Aggregation.sum("amount"))
                .having(FilterNode.compare("_count", "gt", "many"))
                .build()))
            .isInstanceOfSatisfying(ValidationException.class, e ->
                assertThat(e.getContext()).containsEntry("expected_type", "BIGINT"));
    }

    @Test
    @DisplayName("HAVING and ORDER BY reject names outside the output")
    void testUnknownOutputName() {
        assertThatThrownBy(() -> builder.build(QueryRequest.aggregate("sales")
                .groupBy("region")
                .having(FilterNode.compare("avg_amout", "gt", 1))
                .build()))
            .isInstanceOfSatisfying(ValidationException.class, e ->
                assertThat(e.getSuggestions()).contains("avg_amount"));

        assertThatThrownBy(() -> builder.build(QueryRequest.aggregate("sales")
                .groupBy("region")
                .aggregate(Aggregation.sum("amount"))
                .orderBy(OrderBy.asc("amount"))
                .build()))
            .isInstanceOf(ValidationException.class);
    }
}
