package admission.throttle;

import java.util.concurrent.CompletableFuture;

/**
 * Caller's view of a submission.
 *
 * {@code dispatched} completes normally when the request gets an execution slot, exceptionally
 * with {@link RequestTimeoutException} if it expires in the queue, and is cancelled by
 * {@link Throttler#cancel(String)}. The throttler tracks state on its own; completing the
 * future from outside has no effect on it.
 *
 * @param requestId Opaque id, unique per submission; pass it to {@link Throttler#complete(String)}
 * @param clientId Submitting client
 * @param priority Requested priority
 * @param dispatched Start-of-execution signal
 */
public record RequestHandle(
    String requestId,
    String clientId,
    RequestPriority priority,
    CompletableFuture<Void> dispatched
) {
    /**
     * @return true if the request already holds an execution slot (or ran and completed)
     */
    public boolean isDispatched() {
        return dispatched.isDone() && !dispatched.isCompletedExceptionally();
    }
}
