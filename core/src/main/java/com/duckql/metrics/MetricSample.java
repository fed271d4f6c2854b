package com.duckql.metrics;

import com.duckql.exception.ErrorKind;
import com.duckql.generator.OperationKind;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one execution, as recorded by the executor.
 *
 * @param correlationId the execution's correlation identifier
 * @param table the target table
 * @param kind the operation kind
 * @param duration wall time from submission to completion
 * @param success whether the execution returned rows
 * @param timestamp when the execution was submitted
 * @param rowCount rows returned (0 on failure)
 * @param retries attempts beyond the first
 * @param errorKind the surfaced error kind, null on success
 * @param errorMessage the surfaced error message, null on success
 */
public record MetricSample(String correlationId, String table, OperationKind kind, Duration duration,
                           boolean success, Instant timestamp, long rowCount, int retries,
                           ErrorKind errorKind, String errorMessage) {

    public MetricSample {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(duration, "duration must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public static MetricSample success(String correlationId, String table, OperationKind kind,
                                       Duration duration, Instant timestamp, long rowCount, int retries) {
        return new MetricSample(correlationId, table, kind, duration, true, timestamp, rowCount, retries,
                                null, null);
    }

    public static MetricSample failure(String correlationId, String table, OperationKind kind,
                                       Duration duration, Instant timestamp, int retries,
                                       ErrorKind errorKind, String errorMessage) {
        return new MetricSample(correlationId, table, kind, duration, false, timestamp, 0, retries,
                                errorKind, errorMessage);
    }

    public double durationMillis() {
        return duration.toNanos() / 1_000_000.0;
    }
}
