package admission.core.algorithms.sliding_window;

import admission.core.clock.Clock;
import admission.core.model.AlgorithmState;
import admission.core.model.RateLimitAlgorithm;
import admission.core.model.RateLimitResult;

/**
 * Exact sliding window (log):
 * guarda el timestamp de cada permit admitido.
 *
 * The log is a ring of (timestamp, permits) runs: permits admitted at the same instant share
 * one slot, so a weighted request costs one entry. The ring starts small and doubles on
 * demand, never beyond {@code limit} slots. An event at time {@code t} counts for every check
 * in {@code (t, t + window)}, which bounds admissions in any trailing window to {@code limit}.
 */
public final class SlidingWindowLog implements RateLimitAlgorithm {

    private static final int INITIAL_CAPACITY = 8;
    private static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private final Clock clock;
    private final long windowNanos;
    private final int limit;

    private long[] times;
    private int[] counts;
    private int head;
    private int size;
    private long permitsInWindow;

    public SlidingWindowLog(Clock clock, long windowNanos, int limit) {
        if (windowNanos <= 0) throw new IllegalArgumentException("window <= 0");
        if (limit <= 0) throw new IllegalArgumentException("limit <= 0");
        this.clock = clock;
        this.windowNanos = windowNanos;
        this.limit = limit;
        int initial = Math.min(limit, INITIAL_CAPACITY);
        this.times = new long[initial];
        this.counts = new int[initial];
    }

    @Override
    public RateLimitResult tryAcquire(int permits) {
        if (permits <= 0) throw new IllegalArgumentException("permits <= 0");
        long now = clock.nowNanos();
        prune(now);

        if (permitsInWindow + permits <= limit) {
            append(now, permits);
            return RateLimitResult.allow();
        }

        if (permits > limit) {
            return RateLimitResult.reject(windowNanos);
        }

        // the request fits once the oldest (permitsInWindow + permits - limit) permits have aged out
        long mustExpire = permitsInWindow + permits - limit;
        long freed = 0;
        for (int i = 0; i < size; i++) {
            int slot = slot(i);
            freed += counts[slot];
            if (freed >= mustExpire) {
                return RateLimitResult.reject(windowNanos - (now - times[slot]));
            }
        }
        return RateLimitResult.reject(windowNanos);
    }

    @Override
    public AlgorithmState state() {
        long oldest = size == 0 ? 0L : times[head];
        return new AlgorithmState(0d, 0L, (int) permitsInWindow, oldest);
    }

    private void append(long now, int permits) {
        if (size > 0) {
            int tail = slot(size - 1);
            if (times[tail] == now) {
                counts[tail] += permits;
                permitsInWindow += permits;
                return;
            }
        }
        if (size == times.length && !grow()) {
            // ring cannot grow: move the newest run forward, which only delays its expiry
            int tail = slot(size - 1);
            times[tail] = now;
            counts[tail] += permits;
            permitsInWindow += permits;
            return;
        }
        int slot = slot(size);
        times[slot] = now;
        counts[slot] = permits;
        size++;
        permitsInWindow += permits;
    }

    private boolean grow() {
        int capacity = times.length;
        int ceiling = Math.min(limit, MAX_CAPACITY);
        if (capacity >= ceiling) {
            return false;
        }
        int next = (int) Math.min((long) capacity * 2, ceiling);
        long[] newTimes = new long[next];
        int[] newCounts = new int[next];
        for (int i = 0; i < size; i++) {
            int slot = slot(i);
            newTimes[i] = times[slot];
            newCounts[i] = counts[slot];
        }
        times = newTimes;
        counts = newCounts;
        head = 0;
        return true;
    }

    private void prune(long now) {
        while (size > 0 && now - times[head] >= windowNanos) {
            permitsInWindow -= counts[head];
            head = slot(1);
            size--;
        }
    }

    private int slot(int offset) {
        long index = (long) head + offset;
        return (int) (index < times.length ? index : index - times.length);
    }
}
