package admission.engine;

/**
 * Supported rate limiting algorithms.
 *
 * Each enum defines the algorithm characteristics and trade-offs:
 * - TOKEN_BUCKET: Continuous refill, burst-friendly, O(1) time/memory
 * - SLIDING_WINDOW: Exact timestamp log, no boundary problem, O(limit) memory
 * - FIXED_WINDOW: Simple reset, has boundary problem, O(1) time/memory
 * - LEAKY_BUCKET: Constant drain rate, smooths bursts, O(1) time/memory
 */
public enum AlgorithmType {
    /**
     * Token Bucket: Continuous refill algorithm.
     * Best for: Most use cases requiring burst capacity.
     * Memory: O(1) per key
     * Precision: Good (continuous refill)
     */
    TOKEN_BUCKET,

    /**
     * Sliding Window: Exact tracking with a bounded timestamp log.
     * Best for: High precision requirements, acceptable memory cost.
     * Memory: O(limit) per key
     * Precision: Exact (no boundary problem)
     */
    SLIDING_WINDOW,

    /**
     * Fixed Window: Simple reset once the window has elapsed.
     * Best for: Simple cases where 2x rate spike is acceptable.
     * Memory: O(1) per key
     * Precision: Poor (boundary problem allows 2x rate at boundaries)
     */
    FIXED_WINDOW,

    /**
     * Leaky Bucket: Bounded bucket drained at a constant rate.
     * Best for: Smoothing acceptance to a steady rate.
     * Memory: O(1) per key
     * Precision: Good (continuous drain)
     */
    LEAKY_BUCKET
}
