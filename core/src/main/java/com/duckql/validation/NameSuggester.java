package com.duckql.validation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Finds the names closest to a misspelled identifier.
 *
 * <p>Candidates are ranked by case-insensitive Levenshtein distance, ties
 * broken by the candidate's position in the input. Only candidates within
 * {@code max(2, length / 2)} edits are returned, at most
 * {@link #MAX_SUGGESTIONS} of them.
 */
public final class NameSuggester {

    public static final int MAX_SUGGESTIONS = 3;

    private NameSuggester() {}

    /**
     * Returns the closest candidate names to {@code requested}.
     *
     * @param requested the unknown name
     * @param candidates the valid names, in schema order
     * @return up to three close matches, best first; empty if none is close
     */
    public static List<String> closest(String requested, Collection<String> candidates) {
        if (requested == null || candidates == null || candidates.isEmpty()) {
            return Collections.emptyList();
        }

        String target = requested.toLowerCase(Locale.ROOT);
        int threshold = Math.max(2, target.length() / 2);

        List<Scored> scored = new ArrayList<>();
        int position = 0;
        for (String candidate : candidates) {
            int distance = distance(target, candidate.toLowerCase(Locale.ROOT));
            if (distance <= threshold) {
                scored.add(new Scored(candidate, distance, position));
            }
            position++;
        }

        scored.sort(Comparator.comparingInt(Scored::distance).thenComparingInt(Scored::position));

        List<String> result = new ArrayList<>();
        for (int i = 0; i < scored.size() && i < MAX_SUGGESTIONS; i++) {
            result.add(scored.get(i).name());
        }
        return result;
    }

    static int distance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];

        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }

        return previous[b.length()];
    }

    private record Scored(String name, int distance, int position) {}
}
