package admission.core.algorithms.fixed_window;

import admission.core.clock.Clock;
import admission.core.model.AlgorithmState;
import admission.core.model.RateLimitAlgorithm;
import admission.core.model.RateLimitResult;

/**
 * Fixed Window anchored at the client's first request.
 * A window resets once {@code now - windowStart >= window}; the new window starts at {@code now}.
 *
 * Boundary problem: a burst at the end of one window plus a burst at the start of the
 * next admits up to 2 * limit in a short interval.
 */
public final class FixedWindow implements RateLimitAlgorithm {
    private final Clock clock;
    private final long windowNanos;
    private final int limit;

    private long windowStart;
    private int used;

    public FixedWindow(Clock clock, long windowNanos, int limit) {
        if (windowNanos <= 0) throw new IllegalArgumentException("window <= 0");
        if (limit <= 0) throw new IllegalArgumentException("limit <= 0");
        this.clock = clock;
        this.windowNanos = windowNanos;
        this.limit = limit;
        this.windowStart = clock.nowNanos();
        this.used = 0;
    }

    @Override
    public RateLimitResult tryAcquire(int permits) {
        if (permits <= 0) throw new IllegalArgumentException("permits <= 0");

        long now = clock.nowNanos();
        if (now - windowStart >= windowNanos) {
            windowStart = now;
            used = 0;
        }

        if (used + permits <= limit) {
            used += permits;
            return RateLimitResult.allow();
        }

        long retryAfter = windowNanos - (now - windowStart);
        return RateLimitResult.reject(retryAfter);
    }

    @Override
    public AlgorithmState state() {
        return new AlgorithmState(0d, 0L, used, windowStart);
    }
}
