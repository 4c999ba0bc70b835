package admission.metrics;

/**
 * Aggregate throttler counters at a point in time.
 *
 * @param submitted every submission, including rejected ones
 * @param dispatched requests that got an execution slot (immediately or from the queue)
 * @param queued requests that had to wait in the queue
 * @param rejected submissions refused because the queue was full
 * @param expired queued requests that timed out
 * @param completed in-flight requests reported finished
 * @param cancelled requests withdrawn by the caller, queued or in flight
 * @param active in-flight requests now
 * @param waiting queued requests now
 */
public record ThrottleMetrics(
    long submitted,
    long dispatched,
    long queued,
    long rejected,
    long expired,
    long completed,
    long cancelled,
    int active,
    int waiting
) {
}
