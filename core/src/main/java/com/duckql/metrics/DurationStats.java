package com.duckql.metrics;

import java.util.Arrays;

/**
 * Distribution of execution durations, in milliseconds.
 *
 * <p>Percentiles use the exclusive method: for {@code n} sorted values the
 * p-th percentile sits at rank {@code p * (n + 1) / 100}, interpolated
 * between neighbours and clamped to the second and second-to-last values.
 * A single value is its own percentile.
 */
public record DurationStats(int count, double min, double max, double mean,
                            double median, double p95, double p99) {

    private static final DurationStats EMPTY = new DurationStats(0, 0, 0, 0, 0, 0, 0);

    public static DurationStats empty() {
        return EMPTY;
    }

    /**
     * Computes statistics over a set of values.
     *
     * @param values durations in milliseconds (not modified)
     * @return the statistics; {@link #empty()} if there are no values
     */
    public static DurationStats of(double[] values) {
        if (values.length == 0) {
            return EMPTY;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);

        double sum = 0;
        for (double v : sorted) {
            sum += v;
        }

        return new DurationStats(sorted.length, sorted[0], sorted[sorted.length - 1],
                                 sum / sorted.length, median(sorted),
                                 percentile(sorted, 95), percentile(sorted, 99));
    }

    static double median(double[] sorted) {
        int n = sorted.length;
        if (n % 2 == 1) {
            return sorted[n / 2];
        }
        return (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
    }

    /**
     * Exclusive-method percentile of sorted values.
     *
     * @param sorted values in ascending order (non-empty)
     * @param p the percentile, 1 to 99
     * @return the interpolated percentile
     */
    static double percentile(double[] sorted, int p) {
        int n = sorted.length;
        if (n == 1) {
            return sorted[0];
        }
        long m = n + 1L;
        long j = p * m / 100;
        j = Math.max(1, Math.min(n - 1, j));
        long delta = p * m - j * 100;
        return (sorted[(int) j - 1] * (100 - delta) + sorted[(int) j] * delta) / 100.0;
    }

    public boolean isEmpty() {
        return count == 0;
    }
}
