package admission.cleanup;

import admission.core.clock.ManualClock;
import admission.engine.RateLimitConfig;
import admission.engine.RateLimiterEngine;
import admission.throttle.RequestHandle;
import admission.throttle.RequestPriority;
import admission.throttle.ThrottleConfig;
import admission.throttle.Throttler;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CleanupSchedulerTest {

    @Test
    void runOnce_sweepsLimiterAndThrottler() {
        ManualClock clock = new ManualClock(0L);
        RateLimiterEngine limiter = new RateLimiterEngine(clock,
            RateLimitConfig.tokenBucket(60, 10).withCleanupInterval(Duration.ofMinutes(1)));
        Throttler throttler = new Throttler(clock, ThrottleConfig.fifo(1, 5, Duration.ofSeconds(10)));

        limiter.check("a");
        limiter.check("b");
        throttler.submit("a", RequestPriority.NORMAL);
        RequestHandle waiting = throttler.submit("b", RequestPriority.NORMAL);

        try (CleanupScheduler cleanup = CleanupScheduler.builder()
                .rateLimiter(limiter)
                .throttler(throttler)
                .build()) {
            assertEquals(0, cleanup.runOnce());

            clock.advance(Duration.ofMinutes(2));
            assertEquals(3, cleanup.runOnce());
        }

        assertEquals(0, limiter.clientCount());
        assertTrue(waiting.dispatched().isCompletedExceptionally());
    }

    @Test
    void builder_derivesPeriodsFromConfigs() {
        RateLimiterEngine limiter = new RateLimiterEngine(new ManualClock(0L),
            RateLimitConfig.defaults().withCleanupInterval(Duration.ofSeconds(90)));
        Throttler throttler = new Throttler(new ManualClock(0L), ThrottleConfig.fifo(1, 1, Duration.ofSeconds(8)));
        Throttler fast = new Throttler(new ManualClock(0L), ThrottleConfig.fifo(1, 1, Duration.ofMillis(4)));

        try (CleanupScheduler cleanup = CleanupScheduler.builder()
                .rateLimiter(limiter)
                .throttler(throttler)
                .throttler(fast)
                .build()) {
            assertEquals(Duration.ofSeconds(90), cleanup.sweeps().get(0).period());
            assertEquals(Duration.ofSeconds(2), cleanup.sweeps().get(1).period());
            assertEquals(Duration.ofMillis(10), cleanup.sweeps().get(2).period());
        }
    }

    @Test
    void failingSweep_doesNotStopOthers() {
        AtomicInteger calls = new AtomicInteger();
        try (CleanupScheduler cleanup = CleanupScheduler.builder()
                .sweep("broken", Duration.ofSeconds(1), () -> {
                    throw new IllegalStateException("boom");
                })
                .sweep("counting", Duration.ofSeconds(1), () -> {
                    calls.incrementAndGet();
                    return 2;
                })
                .build()) {
            assertEquals(2, cleanup.runOnce());
            assertEquals(2, cleanup.runOnce());
        }
        assertEquals(2, calls.get());
    }

    @Test
    void start_runsSweepsPeriodically() throws InterruptedException {
        CountDownLatch ran = new CountDownLatch(3);
        AtomicInteger failures = new AtomicInteger();

        CleanupScheduler cleanup = CleanupScheduler.builder()
            .sweep("flaky", Duration.ofMillis(5), () -> {
                failures.incrementAndGet();
                throw new IllegalStateException("boom");
            })
            .sweep("tick", Duration.ofMillis(5), () -> {
                ran.countDown();
                return 0;
            })
            .build();
        try {
            assertFalse(cleanup.isRunning());
            cleanup.start();
            cleanup.start();
            assertTrue(cleanup.isRunning());

            assertTrue(ran.await(5, TimeUnit.SECONDS), "sweep did not repeat");
            assertTrue(failures.get() >= 1);
        } finally {
            cleanup.close();
        }
        assertFalse(cleanup.isRunning());
    }

    @Test
    void build_requiresAtLeastOneSweep() {
        assertThrows(IllegalStateException.class, () -> CleanupScheduler.builder().build());
    }

    @Test
    void sweep_invalidArguments() {
        CleanupScheduler.Builder builder = CleanupScheduler.builder();
        assertThrows(IllegalArgumentException.class, () -> builder.sweep(" ", Duration.ofSeconds(1), () -> 0));
        assertThrows(IllegalArgumentException.class, () -> builder.sweep("x", Duration.ZERO, () -> 0));
        assertThrows(IllegalArgumentException.class, () -> builder.sweep("x", Duration.ofSeconds(1), null));
    }
}
