package admission.benchmarks;

import admission.core.clock.SystemClock;
import admission.engine.RateLimitConfig;
import admission.engine.RateLimiterEngine;
import admission.throttle.RequestHandle;
import admission.throttle.RequestPriority;
import admission.throttle.ThrottleConfig;
import admission.throttle.Throttler;
import org.openjdk.jmh.annotations.*;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmarks for RateLimiterEngine and Throttler.
 *
 * Measures throughput (ops/sec) across 4 scenarios:
 * - singleKey: All requests to same client
 * - multiKey: Rotating through 1000 different clients (low contention)
 * - parallel: 8 threads with high contention on a single client
 * - throttleRoundTrip: submit then complete, 8 threads sharing the slots
 *
 * Run from the test classpath:
 *   java -cp target/test-classes:target/classes:&lt;deps&gt; org.openjdk.jmh.Main Engine
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Benchmark)
public class EngineBenchmark {

    private RateLimiterEngine engine;
    private Throttler throttler;

    @Setup
    public void setup() {
        RateLimitConfig config = RateLimitConfig.tokenBucket(Integer.MAX_VALUE, Integer.MAX_VALUE);
        engine = new RateLimiterEngine(SystemClock.instance(), config);
        throttler = new Throttler(SystemClock.instance(),
            ThrottleConfig.prioritized(8, 1_000, Duration.ofSeconds(30)));
    }

    /**
     * Single client throughput.
     */
    @Benchmark
    public boolean singleKey() {
        return engine.isAllowed("user1");
    }

    /**
     * Multi-client throughput (rotating through 1000 clients, low contention).
     */
    @Benchmark
    public boolean multiKey() {
        String key = "user:" + ThreadLocalRandom.current().nextInt(1000);
        return engine.isAllowed(key);
    }

    /**
     * Parallel throughput with 8 threads on a single client (high contention).
     */
    @Benchmark
    @Threads(8)
    public boolean parallel() {
        return engine.isAllowed("user1");
    }

    @Benchmark
    @Threads(8)
    public boolean throttleRoundTrip() {
        RequestHandle handle = throttler.submit("user1", RequestPriority.NORMAL);
        handle.dispatched().join();
        return throttler.complete(handle.requestId());
    }
}
