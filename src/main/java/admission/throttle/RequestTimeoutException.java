package admission.throttle;

import java.time.Duration;

/**
 * A queued request waited longer than the configured timeout and was dropped without running.
 */
public class RequestTimeoutException extends ThrottleException {

    private final String requestId;
    private final Duration waited;

    public RequestTimeoutException(String requestId, Duration waited) {
        super("Request " + requestId + " expired in queue after " + waited.toMillis() + "ms");
        this.requestId = requestId;
        this.waited = waited;
    }

    public String requestId() {
        return requestId;
    }

    public Duration waited() {
        return waited;
    }
}
