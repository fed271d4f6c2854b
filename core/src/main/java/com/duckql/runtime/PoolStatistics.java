package com.duckql.runtime;

/**
 * Point-in-time view of connection pool usage.
 *
 * @param size total connections in the pool
 * @param inUse connections currently owned by an execution
 * @param available connections on the free list
 * @param peakInUse highest simultaneous ownership since start
 * @param acquisitions successful acquisitions since start
 * @param timeouts acquisitions that gave up waiting
 * @param replacements broken connections discarded and recreated
 * @param averageWaitMillis mean time callers waited for a connection
 */
public record PoolStatistics(int size, int inUse, int available, int peakInUse,
                             long acquisitions, long timeouts, long replacements,
                             double averageWaitMillis) {

    public static PoolStatistics empty() {
        return new PoolStatistics(0, 0, 0, 0, 0, 0, 0, 0.0);
    }

    /**
     * Returns the fraction of connections currently in use.
     *
     * @return a value between 0.0 and 1.0
     */
    public double utilization() {
        return size == 0 ? 0.0 : (double) inUse / size;
    }
}
