package com.duckql.metrics;

import com.duckql.generator.OperationKind;
import com.duckql.runtime.PoolStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Collects {@link MetricSample}s from concurrent executions and summarizes them.
 *
 * <p>Samples are kept in a ring buffer of fixed capacity; once full, each
 * new sample evicts the oldest. Cumulative counters (totals, per-kind and
 * per-table counts, retries) are unaffected by eviction and only cleared by
 * {@link #reset()}.
 *
 * <p>All state is guarded by one lock held only for the few field updates
 * of an ingest, so {@link #ingest(MetricSample)} never waits on I/O.
 * {@link #summarize()} copies the window under the lock and computes
 * statistics outside it.
 */
public class MetricsAggregator {

    private static final Logger logger = LoggerFactory.getLogger(MetricsAggregator.class);

    private final int capacity;
    private final Duration slowQueryThreshold;
    private final int slowQueryListSize;
    private final int recentErrorListSize;
    private final Supplier<PoolStatistics> poolStatistics;

    private final ReentrantLock lock = new ReentrantLock();
    private final MetricSample[] ring;
    private int head = 0;
    private int size = 0;

    private long totalQueries = 0;
    private long totalErrors = 0;
    private long totalRetries = 0;
    private final Map<OperationKind, Long> operationCounts = new HashMap<>();
    private final Map<String, Long> tableQueries = new LinkedHashMap<>();
    private final Map<String, Long> tableErrors = new LinkedHashMap<>();

    /**
     * Creates an aggregator with the default limits and no pool statistics.
     *
     * @param capacity number of samples retained
     */
    public MetricsAggregator(int capacity) {
        this(capacity, Duration.ofMillis(1000), 10, 10, PoolStatistics::empty);
    }

    /**
     * Creates an aggregator.
     *
     * @param capacity number of samples retained (at least 1)
     * @param slowQueryThreshold executions slower than this are listed as slow
     * @param slowQueryListSize maximum slow queries in a snapshot
     * @param recentErrorListSize maximum recent errors in a snapshot
     * @param poolStatistics source of pool utilization for snapshots
     */
    public MetricsAggregator(int capacity, Duration slowQueryThreshold, int slowQueryListSize,
                             int recentErrorListSize, Supplier<PoolStatistics> poolStatistics) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
        this.slowQueryThreshold = Objects.requireNonNull(slowQueryThreshold, "slowQueryThreshold must not be null");
        this.slowQueryListSize = slowQueryListSize;
        this.recentErrorListSize = recentErrorListSize;
        this.poolStatistics = Objects.requireNonNull(poolStatistics, "poolStatistics must not be null");
        this.ring = new MetricSample[capacity];
    }

    /**
     * Records one execution outcome. Safe to call from any thread.
     *
     * @param sample the outcome
     */
    public void ingest(MetricSample sample) {
        Objects.requireNonNull(sample, "sample must not be null");
        lock.lock();
        try {
            ring[head] = sample;
            head = (head + 1) % capacity;
            if (size < capacity) {
                size++;
            }

            totalQueries++;
            totalRetries += sample.retries();
            operationCounts.merge(sample.kind(), 1L, Long::sum);
            tableQueries.merge(sample.table(), 1L, Long::sum);
            if (!sample.success()) {
                totalErrors++;
                tableErrors.merge(sample.table(), 1L, Long::sum);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Summarizes everything recorded since the last reset.
     *
     * @return the snapshot
     */
    public MetricsSnapshot summarize() {
        List<MetricSample> window;
        long total;
        long errors;
        long retries;
        Map<String, Long> operations = new LinkedHashMap<>();
        Map<String, Long> tables;
        Map<String, Long> tableErrorCounts;

        lock.lock();
        try {
            window = windowLocked();
            total = totalQueries;
            errors = totalErrors;
            retries = totalRetries;
            for (OperationKind kind : OperationKind.values()) {
                operations.put(kind.code(), operationCounts.getOrDefault(kind, 0L));
            }
            tables = new LinkedHashMap<>(tableQueries);
            tableErrorCounts = new LinkedHashMap<>(tableErrors);
        } finally {
            lock.unlock();
        }

        double[] durations = new double[window.size()];
        for (int i = 0; i < window.size(); i++) {
            durations[i] = window.get(i).durationMillis();
        }

        List<MetricSample> slow = new ArrayList<>();
        List<MetricSample> failed = new ArrayList<>();
        long rowSamples = 0;
        long rowMin = Long.MAX_VALUE;
        long rowMax = Long.MIN_VALUE;
        long rowTotal = 0;
        for (MetricSample sample : window) {
            if (sample.duration().compareTo(slowQueryThreshold) > 0) {
                slow.add(sample);
            }
            if (sample.success()) {
                rowSamples++;
                rowMin = Math.min(rowMin, sample.rowCount());
                rowMax = Math.max(rowMax, sample.rowCount());
                rowTotal += sample.rowCount();
            } else {
                failed.add(sample);
            }
        }

        slow.sort(Comparator.comparing(MetricSample::duration).reversed());
        List<MetricSample> slowest = slow.subList(0, Math.min(slowQueryListSize, slow.size()));
        List<MetricSample> recentErrors =
            failed.subList(Math.max(0, failed.size() - recentErrorListSize), failed.size());
        MetricsSnapshot.RowCountStats rowCounts = rowSamples == 0
            ? MetricsSnapshot.RowCountStats.empty()
            : new MetricsSnapshot.RowCountStats(rowSamples, rowMin, rowMax,
                                                (double) rowTotal / rowSamples, rowTotal);

        return new MetricsSnapshot(total, errors, retries, operations, tables, tableErrorCounts,
                                   DurationStats.of(durations), rowCounts, slowest, recentErrors,
                                   poolStatistics.get(), window.size(), capacity);
    }

    /**
     * Returns retained samples, newest last, optionally filtered.
     *
     * <p>The most recent {@code limit} samples are taken first and then
     * filtered, so fewer than {@code limit} may be returned.
     *
     * @param limit how many recent samples to consider
     * @param table keep only this table (null for all)
     * @param kind keep only this operation kind (null for all)
     * @param includeErrors whether failed executions are kept
     * @return the matching samples
     */
    public List<MetricSample> history(int limit, String table, OperationKind kind, boolean includeErrors) {
        List<MetricSample> window;
        lock.lock();
        try {
            window = windowLocked();
        } finally {
            lock.unlock();
        }

        List<MetricSample> recent = window.subList(Math.max(0, window.size() - Math.max(0, limit)), window.size());
        List<MetricSample> result = new ArrayList<>();
        for (MetricSample sample : recent) {
            if (table != null && !table.equals(sample.table())) {
                continue;
            }
            if (kind != null && kind != sample.kind()) {
                continue;
            }
            if (!includeErrors && !sample.success()) {
                continue;
            }
            result.add(sample);
        }
        return result;
    }

    /**
     * Clears all samples and counters in one step.
     */
    public void reset() {
        lock.lock();
        try {
            Arrays.fill(ring, null);
            head = 0;
            size = 0;
            totalQueries = 0;
            totalErrors = 0;
            totalRetries = 0;
            operationCounts.clear();
            tableQueries.clear();
            tableErrors.clear();
        } finally {
            lock.unlock();
        }
        logger.info("Metrics reset");
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Returns the number of samples currently retained.
     *
     * @return at most {@link #capacity()}
     */
    public int retained() {
        lock.lock();
        try {
            return size;
        } finally {
            lock.unlock();
        }
    }

    private List<MetricSample> windowLocked() {
        List<MetricSample> window = new ArrayList<>(size);
        int start = (head - size + capacity) % capacity;
        for (int i = 0; i < size; i++) {
            window.add(ring[(start + i) % capacity]);
        }
        return window;
    }
}
