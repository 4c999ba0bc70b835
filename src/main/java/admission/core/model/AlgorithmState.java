package admission.core.model;

/**
 * Point-in-time view of one client's algorithm bookkeeping.
 * Fields an algorithm does not use are zero.
 *
 * @param tokens available tokens (token bucket) or water level (leaky bucket)
 * @param lastRefillNanos last refill/drain timestamp
 * @param requestCount admitted requests in the current window
 * @param windowStartNanos start of the current window (oldest logged event for the sliding log)
 */
public record AlgorithmState(
    double tokens,
    long lastRefillNanos,
    int requestCount,
    long windowStartNanos
) {
}
