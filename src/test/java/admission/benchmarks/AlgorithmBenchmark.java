package admission.benchmarks;

import admission.core.algorithms.fixed_window.FixedWindow;
import admission.core.algorithms.leaky_bucket.LeakyBucket;
import admission.core.algorithms.sliding_window.SlidingWindowLog;
import admission.core.algorithms.token_bucket.TokenBucket;
import admission.core.clock.ManualClock;
import admission.core.clock.SystemClock;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmarks for the rate limiting algorithms.
 *
 * Measures throughput (ops/sec) for 4 algorithms across 3 scenarios:
 * - allow: Successfully acquire permits (hot path)
 * - reject: Attempt to acquire when exhausted (clock frozen, nothing refills)
 * - parallel: 8 threads, each with its own instance
 *
 * Run from the test classpath:
 *   java -cp target/test-classes:target/classes:&lt;deps&gt; org.openjdk.jmh.Main Algorithm
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Thread)
public class AlgorithmBenchmark {

    private static final long ONE_SECOND = 1_000_000_000L;

    // Allow scenario: Large capacity, should always succeed
    private TokenBucket tokenBucketAllow;
    private FixedWindow fixedWindowAllow;
    private SlidingWindowLog slidingWindowLogAllow;
    private LeakyBucket leakyBucketAllow;

    // Reject scenario: Exhausted state, should always reject
    private TokenBucket tokenBucketReject;
    private FixedWindow fixedWindowReject;
    private SlidingWindowLog slidingWindowLogReject;
    private LeakyBucket leakyBucketReject;

    @Setup
    public void setup() {
        SystemClock clock = SystemClock.instance();

        tokenBucketAllow = new TokenBucket(clock, 1_000_000_000L, 1_000_000_000L);
        fixedWindowAllow = new FixedWindow(clock, ONE_SECOND, Integer.MAX_VALUE);
        slidingWindowLogAllow = new SlidingWindowLog(clock, 1_000L, 1_000); // 1µs window keeps the log short
        leakyBucketAllow = new LeakyBucket(clock, 1_000_000_000L, 1_000_000_000L);

        ManualClock frozen = new ManualClock(0L);
        tokenBucketReject = new TokenBucket(frozen, 1, 1);
        fixedWindowReject = new FixedWindow(frozen, ONE_SECOND, 1);
        slidingWindowLogReject = new SlidingWindowLog(frozen, ONE_SECOND, 1);
        leakyBucketReject = new LeakyBucket(frozen, 1, 1);

        tokenBucketReject.tryAcquire(1);
        fixedWindowReject.tryAcquire(1);
        slidingWindowLogReject.tryAcquire(1);
        leakyBucketReject.tryAcquire(1);
    }

    // ====== TokenBucket Benchmarks ======

    @Benchmark
    public boolean tokenBucket_allow() {
        return tokenBucketAllow.tryAcquire(1).isAllowed();
    }

    @Benchmark
    public boolean tokenBucket_reject() {
        return tokenBucketReject.tryAcquire(1).isAllowed();
    }

    @Benchmark
    @Threads(8)
    public boolean tokenBucket_parallel() {
        return tokenBucketAllow.tryAcquire(1).isAllowed();
    }

    // ====== FixedWindow Benchmarks ======

    @Benchmark
    public boolean fixedWindow_allow() {
        return fixedWindowAllow.tryAcquire(1).isAllowed();
    }

    @Benchmark
    public boolean fixedWindow_reject() {
        return fixedWindowReject.tryAcquire(1).isAllowed();
    }

    @Benchmark
    @Threads(8)
    public boolean fixedWindow_parallel() {
        return fixedWindowAllow.tryAcquire(1).isAllowed();
    }

    // ====== SlidingWindowLog Benchmarks ======

    @Benchmark
    public boolean slidingWindowLog_allow() {
        return slidingWindowLogAllow.tryAcquire(1).isAllowed();
    }

    @Benchmark
    public boolean slidingWindowLog_reject() {
        return slidingWindowLogReject.tryAcquire(1).isAllowed();
    }

    @Benchmark
    @Threads(8)
    public boolean slidingWindowLog_parallel() {
        return slidingWindowLogAllow.tryAcquire(1).isAllowed();
    }

    // ====== LeakyBucket Benchmarks ======

    @Benchmark
    public boolean leakyBucket_allow() {
        return leakyBucketAllow.tryAcquire(1).isAllowed();
    }

    @Benchmark
    public boolean leakyBucket_reject() {
        return leakyBucketReject.tryAcquire(1).isAllowed();
    }

    @Benchmark
    @Threads(8)
    public boolean leakyBucket_parallel() {
        return leakyBucketAllow.tryAcquire(1).isAllowed();
    }
}
