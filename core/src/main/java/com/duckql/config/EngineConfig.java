package com.duckql.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for a {@link com.duckql.runtime.QueryEngine}.
 *
 * <p>Defaults suit an in-memory database. Values can be set fluently or
 * read from {@code duckql.*} system properties:
 * <pre>
 *   EngineConfig config = EngineConfig.defaults()
 *       .withPoolSize(4)
 *       .withMaxAttempts(5)
 *       .withMaxQueryDepth(6);
 *
 *   // -Dduckql.poolSize=4 -Dduckql.maxDepth=6
 *   EngineConfig fromProps = EngineConfig.fromSystemProperties();
 * </pre>
 */
public class EngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    public static final String PROP_DATABASE = "duckql.database";
    public static final String PROP_POOL_SIZE = "duckql.poolSize";
    public static final String PROP_MAX_ATTEMPTS = "duckql.retry.maxAttempts";
    public static final String PROP_BASE_DELAY_MS = "duckql.retry.baseDelayMs";
    public static final String PROP_BACKOFF_MULTIPLIER = "duckql.retry.backoffMultiplier";
    public static final String PROP_ACQUIRE_TIMEOUT_MS = "duckql.pool.acquireTimeoutMs";
    public static final String PROP_SLOW_QUERY_MS = "duckql.metrics.slowQueryMs";
    public static final String PROP_METRICS_CAPACITY = "duckql.metrics.capacity";
    public static final String PROP_MAX_DEPTH = "duckql.maxDepth";
    public static final String PROP_QUERY_LOGGING = "duckql.queryLogging";

    /** Database file path; null for an in-memory database */
    public String databasePath = null;

    /** Connection pool and worker size (0 = min(available processors, 8)) */
    public int poolSize = 0;

    /** Total attempts per execution, including the first */
    public int maxAttempts = 3;

    /** Delay before the first retry */
    public Duration baseRetryDelay = Duration.ofMillis(100);

    /** Factor applied to the delay for each further retry */
    public double backoffMultiplier = 2.0;

    /** Longest wait for a free connection before a pool-exhaustion error */
    public Duration acquireTimeout = Duration.ofSeconds(30);

    /** Executions slower than this are listed as slow queries */
    public Duration slowQueryThreshold = Duration.ofMillis(1000);

    /** Number of slow queries kept in a metrics snapshot */
    public int slowQueryListSize = 10;

    /** Number of recent errors kept in a metrics snapshot */
    public int recentErrorListSize = 10;

    /** Maximum selection depth; null disables the depth guard */
    public Integer maxQueryDepth = null;

    /** Number of metric samples retained */
    public int metricsCapacity = 10_000;

    /** Whether compiled SQL text is logged */
    public boolean queryLogging = false;

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * Creates a configuration from {@code duckql.*} system properties.
     * Missing properties keep their defaults; malformed ones are logged and
     * ignored.
     *
     * @return the configuration
     */
    public static EngineConfig fromSystemProperties() {
        EngineConfig config = new EngineConfig();

        String database = System.getProperty(PROP_DATABASE);
        if (database != null && !database.isBlank()) {
            config.databasePath = database;
        }

        config.poolSize = intProperty(PROP_POOL_SIZE, config.poolSize, 0);
        config.maxAttempts = intProperty(PROP_MAX_ATTEMPTS, config.maxAttempts, 1);
        config.baseRetryDelay = Duration.ofMillis(
            longProperty(PROP_BASE_DELAY_MS, config.baseRetryDelay.toMillis(), 0));
        config.acquireTimeout = Duration.ofMillis(
            longProperty(PROP_ACQUIRE_TIMEOUT_MS, config.acquireTimeout.toMillis(), 1));
        config.slowQueryThreshold = Duration.ofMillis(
            longProperty(PROP_SLOW_QUERY_MS, config.slowQueryThreshold.toMillis(), 0));
        config.metricsCapacity = intProperty(PROP_METRICS_CAPACITY, config.metricsCapacity, 1);

        String multiplier = System.getProperty(PROP_BACKOFF_MULTIPLIER);
        if (multiplier != null) {
            try {
                double value = Double.parseDouble(multiplier);
                if (value >= 1.0) {
                    config.backoffMultiplier = value;
                } else {
                    logger.warn("Ignoring {}={}: must be at least 1.0", PROP_BACKOFF_MULTIPLIER, multiplier);
                }
            } catch (NumberFormatException e) {
                logger.warn("Ignoring malformed {}={}", PROP_BACKOFF_MULTIPLIER, multiplier);
            }
        }

        String maxDepth = System.getProperty(PROP_MAX_DEPTH);
        if (maxDepth != null) {
            int depth = intProperty(PROP_MAX_DEPTH, 0, 1);
            config.maxQueryDepth = depth > 0 ? Integer.valueOf(depth) : null;
        }

        String queryLogging = System.getProperty(PROP_QUERY_LOGGING);
        if (queryLogging != null) {
            config.queryLogging = Boolean.parseBoolean(queryLogging.trim());
        }

        return config;
    }

    private static int intProperty(String name, int defaultValue, int min) {
        String value = System.getProperty(name);
        if (value != null) {
            try {
                int parsed = Integer.parseInt(value.trim());
                if (parsed >= min) {
                    return parsed;
                }
                logger.warn("Ignoring {}={}: must be at least {}", name, value, min);
            } catch (NumberFormatException e) {
                logger.warn("Ignoring malformed {}={}", name, value);
            }
        }
        return defaultValue;
    }

    private static long longProperty(String name, long defaultValue, long min) {
        String value = System.getProperty(name);
        if (value != null) {
            try {
                long parsed = Long.parseLong(value.trim());
                if (parsed >= min) {
                    return parsed;
                }
                logger.warn("Ignoring {}={}: must be at least {}", name, value, min);
            } catch (NumberFormatException e) {
                logger.warn("Ignoring malformed {}={}", name, value);
            }
        }
        return defaultValue;
    }

    /**
     * Returns the effective pool size, resolving 0 to the hardware default.
     *
     * @return the pool size
     */
    public int effectivePoolSize() {
        return poolSize > 0 ? poolSize : Math.min(Runtime.getRuntime().availableProcessors(), 8);
    }

    public EngineConfig withDatabasePath(String path) {
        this.databasePath = Objects.requireNonNull(path, "path must not be null");
        return this;
    }

    public EngineConfig withPoolSize(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("poolSize must be non-negative");
        }
        this.poolSize = size;
        return this;
    }

    public EngineConfig withMaxAttempts(int attempts) {
        if (attempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = attempts;
        return this;
    }

    public EngineConfig withBaseRetryDelay(Duration delay) {
        Objects.requireNonNull(delay, "delay must not be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("baseRetryDelay must be non-negative");
        }
        this.baseRetryDelay = delay;
        return this;
    }

    public EngineConfig withBackoffMultiplier(double multiplier) {
        if (multiplier < 1.0 || Double.isNaN(multiplier) || Double.isInfinite(multiplier)) {
            throw new IllegalArgumentException("backoffMultiplier must be a finite value >= 1.0");
        }
        this.backoffMultiplier = multiplier;
        return this;
    }

    public EngineConfig withAcquireTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("acquireTimeout must be positive");
        }
        this.acquireTimeout = timeout;
        return this;
    }

    public EngineConfig withSlowQueryThreshold(Duration threshold) {
        Objects.requireNonNull(threshold, "threshold must not be null");
        if (threshold.isNegative()) {
            throw new IllegalArgumentException("slowQueryThreshold must be non-negative");
        }
        this.slowQueryThreshold = threshold;
        return this;
    }

    public EngineConfig withSlowQueryListSize(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("slowQueryListSize must be non-negative");
        }
        this.slowQueryListSize = size;
        return this;
    }

    public EngineConfig withRecentErrorListSize(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("recentErrorListSize must be non-negative");
        }
        this.recentErrorListSize = size;
        return this;
    }

    /**
     * Sets the maximum selection depth.
     *
     * @param depth the maximum depth (at least 1), or null for unlimited
     * @return this configuration
     */
    public EngineConfig withMaxQueryDepth(Integer depth) {
        if (depth != null && depth < 1) {
            throw new IllegalArgumentException("maxQueryDepth must be at least 1");
        }
        this.maxQueryDepth = depth;
        return this;
    }

    public EngineConfig withMetricsCapacity(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("metricsCapacity must be at least 1");
        }
        this.metricsCapacity = capacity;
        return this;
    }

    public EngineConfig withQueryLogging(boolean enabled) {
        this.queryLogging = enabled;
        return this;
    }

    @Override
    public String toString() {
        return "EngineConfig{database=" + (databasePath == null ? ":memory:" : databasePath)
            + ", poolSize=" + effectivePoolSize()
            + ", maxAttempts=" + maxAttempts
            + ", baseRetryDelay=" + baseRetryDelay.toMillis() + "ms"
            + ", backoffMultiplier=" + backoffMultiplier
            + ", maxQueryDepth=" + (maxQueryDepth == null ? "unlimited" : maxQueryDepth)
            + ", metricsCapacity=" + metricsCapacity
            + ", queryLogging=" + queryLogging + "}";
    }
}
