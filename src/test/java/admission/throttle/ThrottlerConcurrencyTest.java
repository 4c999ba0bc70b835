package admission.throttle;

import admission.core.clock.SystemClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrency tests for Throttler.
 *
 * Focus:
 * - Running requests never exceed the slot count
 * - Every admitted request eventually runs once slots free up
 */
class ThrottlerConcurrencyTest {

    @Test
    void testConcurrent_runningNeverExceedsMax() throws InterruptedException {
        int maxConcurrent = 4;
        Throttler throttler = new Throttler(SystemClock.instance(),
            ThrottleConfig.prioritized(maxConcurrent, 1_000, Duration.ofSeconds(30)));

        int numThreads = 32;
        int requestsPerThread = 20;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxSeen = new AtomicInteger();
        AtomicInteger finished = new AtomicInteger();
        AtomicInteger failures = new AtomicInteger();

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        RequestPriority[] priorities = RequestPriority.values();

        for (int i = 0; i < numThreads; i++) {
            RequestPriority priority = priorities[i % priorities.length];
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < requestsPerThread; j++) {
                        RequestHandle handle = throttler.submit("client", priority);
                        handle.dispatched().get(10, TimeUnit.SECONDS);

                        int now = running.incrementAndGet();
                        maxSeen.accumulateAndGet(now, Math::max);
                        Thread.onSpinWait();
                        running.decrementAndGet();

                        assertTrue(throttler.complete(handle.requestId()));
                        finished.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (ExecutionException | TimeoutException | RuntimeException e) {
                    failures.incrementAndGet();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(0, failures.get());
        assertEquals(numThreads * requestsPerThread, finished.get());
        assertTrue(maxSeen.get() <= maxConcurrent, "Saw " + maxSeen.get() + " running at once");
        assertEquals(new ThrottleStatus(0, 0), throttler.status());
        assertEquals(numThreads * requestsPerThread, throttler.metrics().completed());
    }

    @Test
    void testConcurrent_queueBoundHolds() throws InterruptedException {
        Throttler throttler = new Throttler(SystemClock.instance(),
            ThrottleConfig.fifo(2, 10, Duration.ofSeconds(30)));

        int numThreads = 50;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);
        AtomicInteger accepted = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    throttler.submit("client", RequestPriority.NORMAL);
                    accepted.incrementAndGet();
                } catch (QueueFullException e) {
                    rejected.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(5, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(12, accepted.get(), "2 in flight + 10 queued");
        assertEquals(38, rejected.get());
        assertEquals(new ThrottleStatus(2, 10), throttler.status());
    }
}
