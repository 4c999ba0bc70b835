package admission.throttle;

/**
 * @param active in-flight requests
 * @param queued requests waiting for a slot
 */
public record ThrottleStatus(int active, int queued) {
}
