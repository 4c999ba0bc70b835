package admission.service;

import admission.core.clock.ManualClock;
import admission.engine.RateLimitConfig;
import admission.engine.RateLimiterEngine;
import admission.metrics.MetricsCollector;
import admission.throttle.RequestPriority;
import admission.throttle.ThrottleConfig;
import admission.throttle.Throttler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AdmissionService: limiter first, throttler second.
 */
class AdmissionServiceTest {

    private ManualClock clock;
    private AdmissionService service;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(0L);
        MetricsCollector metrics = new MetricsCollector();
        RateLimiterEngine limiter = new RateLimiterEngine(clock, RateLimitConfig.tokenBucket(60, 3), metrics);
        Throttler throttler = new Throttler(clock, ThrottleConfig.fifo(1, 1, Duration.ofSeconds(30)), metrics);
        service = new AdmissionService(limiter, throttler);
    }

    @Test
    void admit_dispatchesThenQueuesThenReportsQueueFull() {
        AdmissionOutcome first = service.admit("a");
        AdmissionOutcome second = service.admit("b");
        AdmissionOutcome third = service.admit("c");

        assertEquals(AdmissionOutcome.Status.DISPATCHED, first.status());
        assertTrue(first.handle().isPresent());
        assertTrue(first.admitted());

        assertEquals(AdmissionOutcome.Status.QUEUED, second.status());
        assertFalse(second.handle().orElseThrow().isDispatched());

        assertEquals(AdmissionOutcome.Status.QUEUE_FULL, third.status());
        assertTrue(third.handle().isEmpty());
        assertTrue(third.tooManyRequests());

        assertTrue(service.complete(first.handle().orElseThrow().requestId()));
        assertTrue(second.handle().orElseThrow().isDispatched());
    }

    @Test
    void admit_deniedRequestNeverReachesThrottler() {
        for (int i = 0; i < 3; i++) {
            AdmissionOutcome outcome = service.admit("greedy");
            service.complete(outcome.handle().orElseThrow().requestId());
        }

        AdmissionOutcome denied = service.admit("greedy");

        assertEquals(AdmissionOutcome.Status.DENIED, denied.status());
        assertEquals(Duration.ofSeconds(1).toNanos(), denied.retryAfterNanos());
        assertEquals(3, service.throttleMetrics().submitted());
        assertEquals(1, service.rateLimitMetrics().blockedRequests());
    }

    @Test
    void admit_blockedClient() {
        service.limiter().blockClient("banned", Duration.ofMinutes(1));

        AdmissionOutcome outcome = service.admit("banned", RequestPriority.CRITICAL);

        assertEquals(AdmissionOutcome.Status.BLOCKED, outcome.status());
        assertEquals(Duration.ofMinutes(1).toNanos(), outcome.retryAfterNanos());
        assertEquals(0, service.throttleMetrics().submitted());

        clock.advance(Duration.ofMinutes(1));
        assertEquals(AdmissionOutcome.Status.DISPATCHED, service.admit("banned").status());
    }

    @Test
    void cancel_delegatesToThrottler() {
        service.admit("a");
        AdmissionOutcome queued = service.admit("b");

        assertTrue(service.cancel(queued.handle().orElseThrow().requestId()));
        assertTrue(queued.handle().orElseThrow().dispatched().isCancelled());
        assertEquals(0, service.throttler().status().queued());
    }

    @Test
    void complete_unknownId() {
        assertFalse(service.complete("nope"));
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> service.admit(null));
        assertThrows(IllegalArgumentException.class, () -> service.admit("  "));
        assertThrows(IllegalArgumentException.class, () -> service.admit("a", null));
        assertThrows(IllegalArgumentException.class, () -> new AdmissionService(null, service.throttler()));
        assertThrows(IllegalArgumentException.class, () -> new AdmissionService(service.limiter(), null));
    }
}
