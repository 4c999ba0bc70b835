package admission.engine;

import java.time.Duration;

/**
 * Configuration for a {@link RateLimiterEngine}.
 *
 * Validated on construction; an invalid combination throws {@link InvalidConfigException}
 * so a misconfigured limiter never starts.
 *
 * @param algorithm The algorithm to use
 * @param requestsPerMinute Steady-state rate; for window algorithms the limit per window
 * @param burstSize Token bucket capacity / leaky bucket queue capacity, or null to use requestsPerMinute
 * @param windowSize Window length for window-based algorithms
 * @param cleanupInterval Idle time after which a client's state may be evicted, and the sweep period
 * @param enableMetrics Whether decisions are counted
 */
public record RateLimitConfig(
    AlgorithmType algorithm,
    int requestsPerMinute,
    Integer burstSize,
    Duration windowSize,
    Duration cleanupInterval,
    boolean enableMetrics
) {
    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);
    public static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofMinutes(5);
    /** Longest period the nanosecond clock can represent. */
    public static final Duration MAX_DURATION = Duration.ofNanos(Long.MAX_VALUE);

    public RateLimitConfig {
        if (algorithm == null) {
            throw new InvalidConfigException("algorithm cannot be null");
        }
        if (requestsPerMinute <= 0) {
            throw new InvalidConfigException("requestsPerMinute must be > 0, got: " + requestsPerMinute);
        }
        if (burstSize != null && burstSize <= 0) {
            throw new InvalidConfigException("burstSize must be > 0 when set, got: " + burstSize);
        }
        if (windowSize == null || windowSize.isNegative() || windowSize.isZero()) {
            throw new InvalidConfigException("windowSize must be > 0");
        }
        if (windowSize.compareTo(MAX_DURATION) > 0) {
            throw new InvalidConfigException("windowSize must be <= " + MAX_DURATION + ", got: " + windowSize);
        }
        if (cleanupInterval == null || cleanupInterval.isNegative() || cleanupInterval.isZero()) {
            throw new InvalidConfigException("cleanupInterval must be > 0");
        }
        if (cleanupInterval.compareTo(MAX_DURATION) > 0) {
            throw new InvalidConfigException("cleanupInterval must be <= " + MAX_DURATION + ", got: " + cleanupInterval);
        }
    }

    /**
     * TokenBucket, 60 rpm, burst 10, 60s window, 5 min cleanup, metrics on.
     */
    public static RateLimitConfig defaults() {
        return tokenBucket(60, 10);
    }

    /**
     * Standard API limiter: TokenBucket, 100 rpm, burst 20.
     */
    public static RateLimitConfig api() {
        return tokenBucket(100, 20);
    }

    /**
     * Strict limiter for sensitive endpoints: SlidingWindow, 10 rpm.
     */
    public static RateLimitConfig strict() {
        return new RateLimitConfig(AlgorithmType.SLIDING_WINDOW, 10, 2,
            DEFAULT_WINDOW, DEFAULT_CLEANUP_INTERVAL, true);
    }

    /**
     * High-throughput limiter: LeakyBucket, 1000 rpm, capacity 100.
     */
    public static RateLimitConfig highThroughput() {
        return leakyBucket(1000, 100);
    }

    public static RateLimitConfig tokenBucket(int requestsPerMinute, int burstSize) {
        return new RateLimitConfig(AlgorithmType.TOKEN_BUCKET, requestsPerMinute, burstSize,
            DEFAULT_WINDOW, DEFAULT_CLEANUP_INTERVAL, true);
    }

    public static RateLimitConfig fixedWindow(int requestsPerWindow, Duration windowSize) {
        return new RateLimitConfig(AlgorithmType.FIXED_WINDOW, requestsPerWindow, null,
            windowSize, DEFAULT_CLEANUP_INTERVAL, true);
    }

    public static RateLimitConfig slidingWindow(int requestsPerWindow, Duration windowSize) {
        return new RateLimitConfig(AlgorithmType.SLIDING_WINDOW, requestsPerWindow, null,
            windowSize, DEFAULT_CLEANUP_INTERVAL, true);
    }

    public static RateLimitConfig leakyBucket(int requestsPerMinute, int capacity) {
        return new RateLimitConfig(AlgorithmType.LEAKY_BUCKET, requestsPerMinute, capacity,
            DEFAULT_WINDOW, DEFAULT_CLEANUP_INTERVAL, true);
    }

    public RateLimitConfig withCleanupInterval(Duration interval) {
        return new RateLimitConfig(algorithm, requestsPerMinute, burstSize, windowSize, interval, enableMetrics);
    }

    public RateLimitConfig withMetrics(boolean enabled) {
        return new RateLimitConfig(algorithm, requestsPerMinute, burstSize, windowSize, cleanupInterval, enabled);
    }

    /**
     * Bucket capacity for TOKEN_BUCKET and LEAKY_BUCKET.
     */
    public int effectiveBurstSize() {
        return burstSize != null ? burstSize : requestsPerMinute;
    }
}
