package admission.core.algorithms.token_bucket;

import admission.core.clock.Clock;
import admission.core.model.AlgorithmState;
import admission.core.model.RateLimitAlgorithm;
import admission.core.model.RateLimitResult;

/**
 * Token Bucket:
 * - capacity: tokens max (burst size)
 * - requestsPerMinute: refill continuo, requestsPerMinute / 60 tokens por segundo
 *
 * Pros: buen burst + tasa media estable.
 * Contras: estado por key.
 *
 * Fractional tokens are kept between calls so low rates still refill.
 * Starts full.
 */
public final class TokenBucket implements RateLimitAlgorithm {
    private static final double NANOS_PER_MINUTE = 60_000_000_000d;

    private final Clock clock;
    private final long capacity;
    private final long requestsPerMinute;

    private double tokens;
    private long lastNanos;

    public TokenBucket(Clock clock, long capacity, long requestsPerMinute) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity <= 0");
        if (requestsPerMinute <= 0) throw new IllegalArgumentException("requestsPerMinute <= 0");
        this.clock = clock;
        this.capacity = capacity;
        this.requestsPerMinute = requestsPerMinute;
        this.tokens = capacity;
        this.lastNanos = clock.nowNanos();
    }

    @Override
    public RateLimitResult tryAcquire(int permits) {
        if (permits <= 0) throw new IllegalArgumentException("permits <= 0");
        refill();

        if (tokens >= permits) {
            tokens -= permits;
            return RateLimitResult.allow();
        }

        double missing = permits - tokens;
        long retryAfter = (long) Math.ceil(missing * NANOS_PER_MINUTE / requestsPerMinute);
        return RateLimitResult.reject(retryAfter);
    }

    @Override
    public AlgorithmState state() {
        return new AlgorithmState(tokens, lastNanos, 0, 0L);
    }

    private void refill() {
        long now = clock.nowNanos();
        long elapsed = Math.max(0L, now - lastNanos);
        if (elapsed == 0) return;

        tokens = Math.min(capacity, tokens + elapsed * (double) requestsPerMinute / NANOS_PER_MINUTE);
        lastNanos = now;
    }
}
