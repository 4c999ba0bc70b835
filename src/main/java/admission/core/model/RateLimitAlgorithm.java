package admission.core.model;

/**
 * Per-client algorithm state plus the decision rule that mutates it.
 * No I/O, no threads: instances are not thread-safe and callers serialize access
 * (the engine holds the client's lock around every call).
 */
public interface RateLimitAlgorithm {

    RateLimitResult tryAcquire(int permits);

    AlgorithmState state();
}
