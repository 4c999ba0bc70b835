package admission.cleanup;

import admission.engine.RateLimiterEngine;
import admission.throttle.Throttler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntSupplier;

/**
 * Background driver for periodic sweeps: idle rate limit state and overdue queued requests.
 *
 * <p>Features:
 * <ul>
 *   <li>One daemon thread, each sweep on its own fixed-delay period</li>
 *   <li>A sweep that throws is logged and runs again on its next period</li>
 *   <li>Graceful shutdown with timeout via {@link #close()}</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 * try (CleanupScheduler cleanup = CleanupScheduler.builder()
 *         .rateLimiter(limiter)
 *         .throttler(throttler)
 *         .build()) {
 *     cleanup.start();
 *     ...
 * }
 * </pre>
 */
public final class CleanupScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CleanupScheduler.class);

    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;
    private static final Duration MIN_THROTTLER_PERIOD = Duration.ofMillis(10);

    private final List<Sweep> sweeps;
    private final ScheduledExecutorService executor;
    private final AtomicBoolean started = new AtomicBoolean();

    /**
     * A named cleanup action returning how many items it removed.
     */
    public record Sweep(String name, Duration period, IntSupplier action) {
        public Sweep {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be blank");
            }
            if (period == null || period.isNegative() || period.isZero()) {
                throw new IllegalArgumentException("period must be > 0");
            }
            if (action == null) {
                throw new IllegalArgumentException("action cannot be null");
            }
        }
    }

    private CleanupScheduler(List<Sweep> sweeps) {
        this.sweeps = List.copyOf(sweeps);
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "admission-cleanup");
            thread.setDaemon(true);
            return thread;
        });
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Schedules every sweep. Calling it again has no effect.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        for (Sweep sweep : sweeps) {
            long periodNanos = sweep.period().toNanos();
            executor.scheduleWithFixedDelay(() -> run(sweep), periodNanos, periodNanos, TimeUnit.NANOSECONDS);
            log.info("Scheduled cleanup sweep '{}' every {}", sweep.name(), sweep.period());
        }
    }

    /**
     * Runs every sweep once on the calling thread.
     *
     * @return total items removed by the sweeps that succeeded
     */
    public int runOnce() {
        int total = 0;
        for (Sweep sweep : sweeps) {
            total += run(sweep);
        }
        return total;
    }

    private int run(Sweep sweep) {
        try {
            int removed = sweep.action().getAsInt();
            if (removed > 0) {
                log.debug("Cleanup sweep '{}' removed {}", sweep.name(), removed);
            }
            return removed;
        } catch (RuntimeException e) {
            // escaping would cancel the periodic task
            log.warn("Cleanup sweep '{}' failed, retrying next cycle", sweep.name(), e);
            return 0;
        }
    }

    public boolean isRunning() {
        return started.get() && !executor.isShutdown();
    }

    public List<Sweep> sweeps() {
        return sweeps;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Cleanup scheduler did not stop within {}s, forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static final class Builder {
        private final List<Sweep> sweeps = new ArrayList<>();

        private Builder() {
        }

        /**
         * Evicts idle clients every {@code cleanupInterval} of the limiter's config.
         */
        public Builder rateLimiter(RateLimiterEngine limiter) {
            return sweep("rate-limiter", limiter.config().cleanupInterval(), limiter::cleanupExpired);
        }

        /**
         * Expires overdue queued requests every quarter of the throttler's timeout, so a
         * request outlives its timeout by at most that much when no traffic triggers expiry.
         */
        public Builder throttler(Throttler throttler) {
            Duration period = throttler.config().timeout().dividedBy(4);
            if (period.compareTo(MIN_THROTTLER_PERIOD) < 0) {
                period = MIN_THROTTLER_PERIOD;
            }
            return sweep("throttler", period, throttler::expireStale);
        }

        public Builder sweep(String name, Duration period, IntSupplier action) {
            sweeps.add(new Sweep(name, period, action));
            return this;
        }

        public CleanupScheduler build() {
            if (sweeps.isEmpty()) {
                throw new IllegalStateException("at least one sweep is required");
            }
            return new CleanupScheduler(sweeps);
        }
    }
}
