package admission.engine;

import admission.core.algorithms.fixed_window.FixedWindow;
import admission.core.algorithms.leaky_bucket.LeakyBucket;
import admission.core.algorithms.sliding_window.SlidingWindowLog;
import admission.core.algorithms.token_bucket.TokenBucket;
import admission.core.clock.Clock;
import admission.core.model.RateLimitAlgorithm;

import java.util.function.Supplier;

/**
 * Factory for per-client algorithm state.
 *
 * The algorithm switch runs once, in {@link #resolve}; the returned supplier is what the
 * engine calls for every new client, so the hot path never re-inspects the config.
 *
 * Thread-safety: This class is stateless and thread-safe.
 */
public final class RateLimiterFactory {

    private RateLimiterFactory() {
        // Utility class, no instantiation
    }

    /**
     * Resolves the configured algorithm to a supplier of fresh per-client state.
     *
     * @param clock Clock instance for time control (injected for testability)
     * @param config Configuration specifying algorithm and parameters
     * @return Supplier creating a new, independent algorithm instance on each call
     * @throws IllegalArgumentException if clock or config is null
     */
    public static Supplier<RateLimitAlgorithm> resolve(Clock clock, RateLimitConfig config) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (config == null) throw new IllegalArgumentException("config cannot be null");

        int rpm = config.requestsPerMinute();
        int burst = config.effectiveBurstSize();
        long windowNanos = config.windowSize().toNanos();

        return switch (config.algorithm()) {
            case TOKEN_BUCKET -> () -> new TokenBucket(clock, burst, rpm);
            case SLIDING_WINDOW -> () -> new SlidingWindowLog(clock, windowNanos, rpm);
            case FIXED_WINDOW -> () -> new FixedWindow(clock, windowNanos, rpm);
            case LEAKY_BUCKET -> () -> new LeakyBucket(clock, burst, rpm);
        };
    }

    /**
     * Creates a single algorithm instance.
     */
    public static RateLimitAlgorithm create(Clock clock, RateLimitConfig config) {
        return resolve(clock, config).get();
    }
}
