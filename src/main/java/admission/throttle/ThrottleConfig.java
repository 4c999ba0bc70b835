package admission.throttle;

import admission.engine.InvalidConfigException;
import admission.engine.RateLimitConfig;

import java.time.Duration;

/**
 * Configuration for a {@link Throttler}.
 *
 * @param maxConcurrentRequests Execution slots
 * @param queueSize Requests allowed to wait for a slot, excluding in-flight ones (0 disables queueing)
 * @param timeout Longest a request may wait in the queue
 * @param enablePriority When false every request is FIFO regardless of its priority
 */
public record ThrottleConfig(
    int maxConcurrentRequests,
    int queueSize,
    Duration timeout,
    boolean enablePriority
) {
    public ThrottleConfig {
        if (maxConcurrentRequests <= 0) {
            throw new InvalidConfigException("maxConcurrentRequests must be > 0, got: " + maxConcurrentRequests);
        }
        if (queueSize < 0) {
            throw new InvalidConfigException("queueSize must be >= 0, got: " + queueSize);
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new InvalidConfigException("timeout must be > 0");
        }
        if (timeout.compareTo(RateLimitConfig.MAX_DURATION) > 0) {
            throw new InvalidConfigException("timeout must be <= " + RateLimitConfig.MAX_DURATION + ", got: " + timeout);
        }
    }

    /**
     * 100 slots, 1000 queued, 30s timeout, FIFO.
     */
    public static ThrottleConfig defaults() {
        return new ThrottleConfig(100, 1000, Duration.ofSeconds(30), false);
    }

    public static ThrottleConfig fifo(int maxConcurrentRequests, int queueSize, Duration timeout) {
        return new ThrottleConfig(maxConcurrentRequests, queueSize, timeout, false);
    }

    public static ThrottleConfig prioritized(int maxConcurrentRequests, int queueSize, Duration timeout) {
        return new ThrottleConfig(maxConcurrentRequests, queueSize, timeout, true);
    }
}
