package com.duckql.schema;

import com.duckql.exception.ValidationException;
import com.duckql.test.TestBase;
import com.duckql.test.TestCategories;
import com.duckql.test.TestSchemas;

import org.junit.jupiter.api.*;
import static org.assertj.core.api.Assertions.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ComputedFieldRegistry Tests")
public class ComputedFieldRegistryTest extends TestBase {

    private ComputedFieldRegistry registry;

    @Override
    protected void doSetUp() {
        registry = new ComputedFieldRegistry(TestSchemas.registry());
    }

    @Test
    @DisplayName("Registered fields resolve from their source columns")
    void testRegisterAndApply() {
        // Given
        ComputedField field = registry.register("users", "display", List.of("name", "email"),
            row -> row.get("name") + " <" + row.get("email") + ">");

        // When
        Map<String, Object> row = new HashMap<>();
        row.put("name", "Ada");
        row.put("email", "ada@example.com");

        // Then
        assertThat(field.apply(row)).isEqualTo("Ada <ada@example.com>");
        assertThat(registry.isComputed("users", "display")).isTrue();
        assertThat(registry.find("users", "display")).isSameAs(field);
        assertThat(registry.fieldNames("users")).containsExactly("display");
        assertThat(registry.fieldNames("sales")).isEmpty();
    }

    @Test
    @DisplayName("Names that shadow columns are rejected")
    void testShadowingRejected() {
        assertThatThrownBy(() -> registry.register("users", "email", List.of("name"), row -> null))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("shadows");
    }

    @Test
    @DisplayName("Unknown source columns and tables are rejected")
    void testUnknownSources() {
        assertThatThrownBy(() -> registry.register("users", "x", List.of("nmae"), row -> null))
            .isInstanceOfSatisfying(ValidationException.class, e ->
                assertThat(e.getSuggestions()).contains("name"));
        assertThatThrownBy(() -> registry.register("nobody", "x", List.of("id"), row -> null))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("'nobody'");
    }

    @Test
    @DisplayName("Duplicate registrations are rejected")
    void testDuplicateRejected() {
        registry.register("sales", "doubled", List.of("amount"), row -> 2 * ((Number) row.get("amount")).doubleValue());

        assertThatThrownBy(() -> registry.register("sales", "doubled", List.of("amount"), row -> 0))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("already registered");
    }
}
