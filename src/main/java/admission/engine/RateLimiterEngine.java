package admission.engine;

import admission.core.clock.Clock;
import admission.core.clock.SystemClock;
import admission.core.model.RateLimitResult;
import admission.metrics.MetricsCollector;
import admission.metrics.RateLimitMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Thread-safe rate limiter with one algorithm and per-client state.
 *
 * Features:
 * - ConcurrentHashMap-based ClientState Store, one ReentrantLock per client
 * - Algorithm resolved once at construction (token bucket, sliding window, fixed window, leaky bucket)
 * - Administrative blocks that override the algorithm until they expire
 * - Idle-client eviction via {@link #cleanupExpired()}
 * - Lock-free decision counters in a {@link MetricsCollector}
 *
 * Thread-safety:
 * - Calls for the same client are serialized on that client's lock
 * - Calls for different clients never share a lock
 * - Eviction takes the client's lock, so it cannot interleave with a check for that client
 *
 * Decisions are values: a denied or blocked request is a {@link RateLimitResult}, never an exception.
 *
 * Usage example:
 * <pre>
 * RateLimiterEngine limiter = new RateLimiterEngine(SystemClock.instance(), RateLimitConfig.api());
 *
 * RateLimitResult result = limiter.check("user:123");
 * if (result.isAllowed()) {
 *     // hand over to the throttler
 * } else {
 *     // reject with retry-after: result.retryAfterNanos()
 * }
 * </pre>
 */
public final class RateLimiterEngine {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterEngine.class);

    private final Clock clock;
    private final RateLimitConfig config;
    private final ClientStateStore store;
    private final MetricsCollector metrics;

    /**
     * Creates a limiter on the system clock with its own metrics collector.
     */
    public RateLimiterEngine(RateLimitConfig config) {
        this(SystemClock.instance(), config);
    }

    /**
     * Creates a limiter with its own metrics collector.
     */
    public RateLimiterEngine(Clock clock, RateLimitConfig config) {
        this(clock, config, new MetricsCollector());
    }

    /**
     * Creates a new rate limiter.
     *
     * @param clock Clock instance for time control (injected for testability)
     * @param config Limiter configuration, already validated by its constructor
     * @param metrics Collector receiving decision counts (shared with the throttler if desired)
     * @throws IllegalArgumentException if any parameter is null
     */
    public RateLimiterEngine(Clock clock, RateLimitConfig config, MetricsCollector metrics) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }

        this.clock = clock;
        this.config = config;
        this.store = new ClientStateStore(clock, RateLimiterFactory.resolve(clock, config));
        this.metrics = metrics;
        this.metrics.trackClients(store::size);

        log.info("Rate limiter ready: algorithm={}, requestsPerMinute={}, burstSize={}, window={}",
            config.algorithm(), config.requestsPerMinute(), config.effectiveBurstSize(), config.windowSize());
    }

    /**
     * Decides whether one request from the client is admitted.
     *
     * @param clientId The client to rate limit (e.g., user ID, API key)
     * @return true if admitted
     */
    public boolean isAllowed(String clientId) {
        return check(clientId, 1).isAllowed();
    }

    public RateLimitResult check(String clientId) {
        return check(clientId, 1);
    }

    /**
     * Decides whether a request of {@code permits} units from the client is admitted.
     *
     * An active administrative block denies without touching the algorithm state.
     *
     * @param clientId The client to rate limit
     * @param permits Units the request costs (must be > 0)
     * @return ALLOW, REJECT (limit exceeded) or BLOCKED, with a retry-after hint
     * @throws IllegalArgumentException if clientId is null or permits <= 0
     */
    public RateLimitResult check(String clientId, int permits) {
        if (clientId == null) {
            throw new IllegalArgumentException("clientId cannot be null");
        }
        if (permits <= 0) {
            throw new IllegalArgumentException("permits must be > 0");
        }

        long started = System.nanoTime();
        RateLimitResult result = store.withEntry(clientId, entry -> decide(entry, permits));
        record(result, System.nanoTime() - started);

        if (log.isDebugEnabled()) {
            log.debug("Rate limit {} for client {} (permits={})", result.decision(), clientId, permits);
        }
        return result;
    }

    private RateLimitResult decide(ClientEntry entry, int permits) {
        long now = clock.nowNanos();
        entry.touch(now);
        if (entry.isBlockedAt(now)) {
            return RateLimitResult.blocked(entry.blockedUntilNanos() - now);
        }
        return entry.algorithm().tryAcquire(permits);
    }

    private void record(RateLimitResult result, long latencyNanos) {
        if (!config.enableMetrics()) {
            return;
        }
        try {
            metrics.recordDecision(result.decision(), latencyNanos);
        } catch (RuntimeException e) {
            log.warn("Failed to record rate limit decision; decision unaffected", e);
        }
    }

    /**
     * Blocks the client for {@code duration}, overriding the algorithm until it expires.
     * Replaces any existing block. Durations past the clock's range block indefinitely.
     *
     * @throws IllegalArgumentException if clientId is null or duration is not positive
     */
    public void blockClient(String clientId, Duration duration) {
        if (clientId == null) {
            throw new IllegalArgumentException("clientId cannot be null");
        }
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("duration must be > 0");
        }

        long blockNanos = saturatedNanos(duration);
        long until = store.withEntry(clientId, entry -> {
            long now = clock.nowNanos();
            long deadline = now > Long.MAX_VALUE - blockNanos ? Long.MAX_VALUE : now + blockNanos;
            entry.blockUntil(deadline);
            return deadline;
        });
        log.warn("Blocked client {} for {} (until {}ns)", clientId, duration, until);
    }

    private static long saturatedNanos(Duration duration) {
        return duration.compareTo(RateLimitConfig.MAX_DURATION) >= 0 ? Long.MAX_VALUE : duration.toNanos();
    }

    /**
     * Lifts an administrative block.
     *
     * @return true if a block was in effect
     */
    public boolean unblockClient(String clientId) {
        if (clientId == null) {
            throw new IllegalArgumentException("clientId cannot be null");
        }
        boolean lifted = store.withExistingEntry(clientId, entry -> entry.unblock(clock.nowNanos()), false);
        if (lifted) {
            log.info("Unblocked client {}", clientId);
        }
        return lifted;
    }

    public boolean isBlocked(String clientId) {
        if (clientId == null) {
            throw new IllegalArgumentException("clientId cannot be null");
        }
        return store.withExistingEntry(clientId, entry -> entry.isBlockedAt(clock.nowNanos()), false);
    }

    /**
     * Evicts clients idle for longer than the cleanup interval.
     * A client with a block still in effect is never evicted.
     *
     * @return number of entries removed
     */
    public int cleanupExpired() {
        long now = clock.nowNanos();
        long idleNanos = config.cleanupInterval().toNanos();
        int removed = store.removeIf(entry ->
            !entry.isBlockedAt(now) && now - entry.lastAccessNanos() > idleNanos);
        if (removed > 0) {
            log.debug("Cleaned up {} expired rate limit entries", removed);
        }
        return removed;
    }

    /**
     * Copies the client's bookkeeping, or empty if the client is not tracked.
     */
    public Optional<ClientSnapshot> snapshot(String clientId) {
        if (clientId == null) {
            throw new IllegalArgumentException("clientId cannot be null");
        }
        return store.withExistingEntry(clientId, entry -> {
            OptionalLong blockedUntil = entry.isBlockedAt(clock.nowNanos())
                ? OptionalLong.of(entry.blockedUntilNanos())
                : OptionalLong.empty();
            return Optional.of(new ClientSnapshot(
                clientId, entry.algorithm().state(), entry.lastAccessNanos(), blockedUntil));
        }, Optional.empty());
    }

    public RateLimitMetrics metrics() {
        return metrics.rateLimitMetrics();
    }

    /**
     * Returns the number of currently tracked clients.
     */
    public int clientCount() {
        return store.size();
    }

    /**
     * Drops every client's state. Blocks are dropped too.
     */
    public void clear() {
        store.clear();
    }

    public RateLimitConfig config() {
        return config;
    }

    public MetricsCollector metricsCollector() {
        return metrics;
    }
}
