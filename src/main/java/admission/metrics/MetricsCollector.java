package admission.metrics;

import admission.core.model.Decision;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.IntSupplier;

/**
 * Passive, lock-free counters fed by the rate limiter and the throttler.
 *
 * Recording never blocks and never influences a decision. Gauges (client count,
 * active and queued requests) are read on demand from suppliers registered by the
 * components that own the underlying state. A collector may be shared: counters and
 * gauges then cover every limiter and throttler registered with it.
 */
public class MetricsCollector {

    private final LongAdder totalRequests = new LongAdder();
    private final LongAdder allowedRequests = new LongAdder();
    private final LongAdder blockedRequests = new LongAdder();
    private final LongAdder decisionNanos = new LongAdder();

    private final LongAdder submitted = new LongAdder();
    private final LongAdder dispatched = new LongAdder();
    private final LongAdder queued = new LongAdder();
    private final LongAdder rejected = new LongAdder();
    private final LongAdder expired = new LongAdder();
    private final LongAdder completed = new LongAdder();
    private final LongAdder cancelled = new LongAdder();

    private final List<IntSupplier> clientCounts = new CopyOnWriteArrayList<>();
    private final List<IntSupplier> activeCounts = new CopyOnWriteArrayList<>();
    private final List<IntSupplier> queuedCounts = new CopyOnWriteArrayList<>();

    /**
     * Adds a limiter's client count to the {@code currentClients} gauge.
     */
    public void trackClients(IntSupplier clientCount) {
        if (clientCount == null) {
            throw new IllegalArgumentException("clientCount cannot be null");
        }
        clientCounts.add(clientCount);
    }

    /**
     * Adds a throttler's in-flight and queued counts to the throttle gauges.
     */
    public void trackThrottle(IntSupplier activeRequests, IntSupplier queuedRequests) {
        if (activeRequests == null || queuedRequests == null) {
            throw new IllegalArgumentException("suppliers cannot be null");
        }
        activeCounts.add(activeRequests);
        queuedCounts.add(queuedRequests);
    }

    public void recordDecision(Decision decision, long latencyNanos) {
        totalRequests.increment();
        if (decision == Decision.ALLOW) {
            allowedRequests.increment();
        } else {
            blockedRequests.increment();
        }
        decisionNanos.add(Math.max(0L, latencyNanos));
    }

    public void recordSubmitted() {
        submitted.increment();
    }

    public void recordDispatched() {
        dispatched.increment();
    }

    public void recordQueued() {
        queued.increment();
    }

    public void recordRejected() {
        rejected.increment();
    }

    public void recordExpired(int count) {
        expired.add(count);
    }

    public void recordCompleted() {
        completed.increment();
    }

    public void recordCancelled() {
        cancelled.increment();
    }

    public RateLimitMetrics rateLimitMetrics() {
        long total = totalRequests.sum();
        long avg = total == 0 ? 0L : decisionNanos.sum() / total;
        return new RateLimitMetrics(
            total,
            allowedRequests.sum(),
            blockedRequests.sum(),
            currentClients(),
            Duration.ofNanos(avg)
        );
    }

    public ThrottleMetrics throttleMetrics() {
        return new ThrottleMetrics(
            submitted.sum(),
            dispatched.sum(),
            queued.sum(),
            rejected.sum(),
            expired.sum(),
            completed.sum(),
            cancelled.sum(),
            activeRequests(),
            queuedRequests()
        );
    }

    int currentClients() {
        return sum(clientCounts);
    }

    int activeRequests() {
        return sum(activeCounts);
    }

    int queuedRequests() {
        return sum(queuedCounts);
    }

    private static int sum(List<IntSupplier> gauges) {
        int total = 0;
        for (IntSupplier gauge : gauges) {
            total += gauge.getAsInt();
        }
        return total;
    }

    double averageDecisionNanos() {
        long total = totalRequests.sum();
        return total == 0 ? 0d : (double) decisionNanos.sum() / total;
    }

    long totalRequests() {
        return totalRequests.sum();
    }

    long allowedRequests() {
        return allowedRequests.sum();
    }

    long blockedRequests() {
        return blockedRequests.sum();
    }

    long submitted() {
        return submitted.sum();
    }

    long rejected() {
        return rejected.sum();
    }

    long expired() {
        return expired.sum();
    }

    long completed() {
        return completed.sum();
    }

    /**
     * Zeroes every counter. Gauges are unaffected.
     */
    public void reset() {
        totalRequests.reset();
        allowedRequests.reset();
        blockedRequests.reset();
        decisionNanos.reset();
        submitted.reset();
        dispatched.reset();
        queued.reset();
        rejected.reset();
        expired.reset();
        completed.reset();
        cancelled.reset();
    }
}
