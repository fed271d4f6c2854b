package com.duckql.metrics;

import com.duckql.runtime.PoolStatistics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable summary produced by {@link MetricsAggregator#summarize()}.
 *
 * <p>Totals, error counts and the per-kind and per-table counters cover
 * every sample since the last reset. Durations, row counts, slow queries
 * and recent errors cover the retained window only.
 */
public record MetricsSnapshot(
        long totalQueries,
        long totalErrors,
        long totalRetries,
        Map<String, Long> operationCounts,
        Map<String, Long> tableQueries,
        Map<String, Long> tableErrors,
        DurationStats durations,
        RowCountStats rowCounts,
        List<MetricSample> slowQueries,
        List<MetricSample> recentErrors,
        PoolStatistics pool,
        int retainedSamples,
        int capacity) {

    public MetricsSnapshot {
        operationCounts = Map.copyOf(operationCounts);
        tableQueries = Map.copyOf(tableQueries);
        tableErrors = Map.copyOf(tableErrors);
        slowQueries = List.copyOf(slowQueries);
        recentErrors = List.copyOf(recentErrors);
    }

    /**
     * Returns the fraction of executions that failed.
     *
     * @return errors / total, or 0.0 with no executions
     */
    public double errorRate() {
        return totalQueries == 0 ? 0.0 : (double) totalErrors / totalQueries;
    }

    /**
     * Row counts of successful executions in the retained window.
     */
    public record RowCountStats(long count, long min, long max, double mean, long total) {

        public static RowCountStats empty() {
            return new RowCountStats(0, 0, 0, 0.0, 0);
        }
    }

    /**
     * Renders the snapshot as nested maps and lists for exporters (JSON,
     * console tables).
     *
     * @return an ordered map view of the snapshot
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_queries", totalQueries);
        summary.put("total_errors", totalErrors);
        summary.put("error_rate", errorRate());
        summary.put("total_retries", totalRetries);
        summary.put("retained_samples", retainedSamples);
        summary.put("capacity", capacity);
        map.put("summary", summary);

        map.put("operations", new LinkedHashMap<>(operationCounts));

        Map<String, Object> tables = new LinkedHashMap<>();
        tables.put("queries", new LinkedHashMap<>(tableQueries));
        tables.put("errors", new LinkedHashMap<>(tableErrors));
        map.put("tables", tables);

        Map<String, Object> durationMap = new LinkedHashMap<>();
        if (!durations.isEmpty()) {
            durationMap.put("min", durations.min());
            durationMap.put("max", durations.max());
            durationMap.put("mean", durations.mean());
            durationMap.put("median", durations.median());
            durationMap.put("p95", durations.p95());
            durationMap.put("p99", durations.p99());
        }
        map.put("durations_ms", durationMap);

        Map<String, Object> rowMap = new LinkedHashMap<>();
        if (rowCounts.count() > 0) {
            rowMap.put("min", rowCounts.min());
            rowMap.put("max", rowCounts.max());
            rowMap.put("mean", rowCounts.mean());
            rowMap.put("total", rowCounts.total());
        }
        map.put("row_counts", rowMap);

        map.put("slow_queries", sampleMaps(slowQueries));
        map.put("recent_errors", sampleMaps(recentErrors));

        Map<String, Object> poolMap = new LinkedHashMap<>();
        poolMap.put("size", pool.size());
        poolMap.put("in_use", pool.inUse());
        poolMap.put("available", pool.available());
        poolMap.put("peak_in_use", pool.peakInUse());
        poolMap.put("utilization", pool.utilization());
        poolMap.put("acquisitions", pool.acquisitions());
        poolMap.put("timeouts", pool.timeouts());
        poolMap.put("average_wait_ms", pool.averageWaitMillis());
        map.put("pool", poolMap);

        return map;
    }

    static List<Map<String, Object>> sampleMaps(List<MetricSample> samples) {
        List<Map<String, Object>> list = new ArrayList<>(samples.size());
        for (MetricSample sample : samples) {
            list.add(toMap(sample));
        }
        return list;
    }

    static Map<String, Object> toMap(MetricSample sample) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("query_id", sample.correlationId());
        map.put("operation", sample.kind().code());
        map.put("table", sample.table());
        map.put("duration_ms", sample.durationMillis());
        map.put("row_count", sample.rowCount());
        map.put("retries", sample.retries());
        if (!sample.success()) {
            map.put("error_kind", sample.errorKind() == null ? null : sample.errorKind().code());
            map.put("error", sample.errorMessage());
        }
        map.put("timestamp", sample.timestamp().toString());
        return map;
    }
}
