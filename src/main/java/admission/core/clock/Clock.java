package admission.core.clock;

/**
 * Monotonic time source in nanoseconds.
 * Injected everywhere time is read so tests can drive it with {@link ManualClock}.
 */
public interface Clock {
    long nowNanos();
}
