package admission.core.clock;

import java.time.Duration;

/**
 * Clock advanced by hand. Reads and writes are volatile so a test thread can move
 * time while scheduler or worker threads observe it.
 */
public final class ManualClock implements Clock {
    private volatile long now;

    public ManualClock(long startNanos) {
        this.now = startNanos;
    }

    @Override
    public long nowNanos() {
        return now;
    }

    public synchronized void advanceNanos(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now += delta;
    }

    public void advance(Duration delta) {
        advanceNanos(delta.toNanos());
    }

    public void setNanos(long value) {
        now = value;
    }
}
