package com.duckql.validation;

import com.duckql.test.TestCategories;

import org.junit.jupiter.api.*;
import static org.assertj.core.api.Assertions.*;

import java.util.List;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("NameSuggester Tests")
public class NameSuggesterTest {

    private static final List<String> USERS = List.of("id", "name", "email", "age", "created_at");

    @Test
    @DisplayName("Single typo finds the intended name")
    void testSingleTypo() {
        assertThat(NameSuggester.closest("emial", USERS)).first().isEqualTo("email");
        assertThat(NameSuggester.closest("nmae", USERS)).contains("name");
    }

    @Test
    @DisplayName("Matching is case-insensitive")
    void testCaseInsensitive() {
        assertThat(NameSuggester.closest("EMAIL", USERS)).containsExactly("email");
    }

    @Test
    @DisplayName("Distant names yield no suggestions")
    void testNoCloseMatch() {
        assertThat(NameSuggester.closest("foo", List.of("amount", "region"))).isEmpty();
    }

    @Test
    @DisplayName("At most three suggestions, closest first, ties in schema order")
    void testRankingAndCap() {
        List<String> result = NameSuggester.closest("ab", List.of("abc", "xb", "ax", "abcd", "ab_"));

        assertThat(result).hasSize(NameSuggester.MAX_SUGGESTIONS);
        assertThat(result).containsExactly("abc", "xb", "ax");
    }

    @Test
    @DisplayName("Levenshtein distance")
    void testDistance() {
        assertThat(NameSuggester.distance("kitten", "sitting")).isEqualTo(3);
        assertThat(NameSuggester.distance("", "abc")).isEqualTo(3);
        assertThat(NameSuggester.distance("same", "same")).isZero();
    }

    @Test
    @DisplayName("Null or empty inputs yield nothing")
    void testEmptyInputs() {
        assertThat(NameSuggester.closest(null, USERS)).isEmpty();
        assertThat(NameSuggester.closest("x", List.of())).isEmpty();
    }
}
