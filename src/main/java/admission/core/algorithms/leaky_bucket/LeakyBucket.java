package admission.core.algorithms.leaky_bucket;

import admission.core.clock.Clock;
import admission.core.model.AlgorithmState;
import admission.core.model.RateLimitAlgorithm;
import admission.core.model.RateLimitResult;

/**
 * Leaky Bucket (as a meter):
 * - capacity: queue length the bucket can hold
 * - requestsPerMinute: constant drain rate
 *
 * A request is accepted when it still fits in the bucket after draining for the
 * elapsed time. Governs the rate of acceptance only; nothing is actually queued here.
 * Starts empty.
 */
public final class LeakyBucket implements RateLimitAlgorithm {
    private static final double NANOS_PER_MINUTE = 60_000_000_000d;

    private final Clock clock;
    private final long capacity;
    private final long requestsPerMinute;

    private double level;
    private long lastNanos;

    public LeakyBucket(Clock clock, long capacity, long requestsPerMinute) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity <= 0");
        if (requestsPerMinute <= 0) throw new IllegalArgumentException("requestsPerMinute <= 0");
        this.clock = clock;
        this.capacity = capacity;
        this.requestsPerMinute = requestsPerMinute;
        this.level = 0d;
        this.lastNanos = clock.nowNanos();
    }

    @Override
    public RateLimitResult tryAcquire(int permits) {
        if (permits <= 0) throw new IllegalArgumentException("permits <= 0");
        drain();

        if (level + permits <= capacity) {
            level += permits;
            return RateLimitResult.allow();
        }

        double overflow = level + permits - capacity;
        long retryAfter = (long) Math.ceil(overflow * NANOS_PER_MINUTE / requestsPerMinute);
        return RateLimitResult.reject(retryAfter);
    }

    @Override
    public AlgorithmState state() {
        return new AlgorithmState(level, lastNanos, 0, 0L);
    }

    private void drain() {
        long now = clock.nowNanos();
        long elapsed = Math.max(0L, now - lastNanos);
        if (elapsed == 0) return;

        level = Math.max(0d, level - elapsed * (double) requestsPerMinute / NANOS_PER_MINUTE);
        lastNanos = now;
    }
}
