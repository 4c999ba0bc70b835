package admission.throttle;

import java.util.concurrent.CompletableFuture;

/**
 * Throttler-owned record of one submission. Only touched under the throttler's lock.
 */
final class QueuedRequest {

    private final String id;
    private final String clientId;
    private final RequestPriority priority;
    private final long enqueuedNanos;
    private final CompletableFuture<Void> dispatched = new CompletableFuture<>();

    private RequestState state = RequestState.QUEUED;

    QueuedRequest(String id, String clientId, RequestPriority priority, long enqueuedNanos) {
        this.id = id;
        this.clientId = clientId;
        this.priority = priority;
        this.enqueuedNanos = enqueuedNanos;
    }

    String id() {
        return id;
    }

    String clientId() {
        return clientId;
    }

    RequestPriority priority() {
        return priority;
    }

    long enqueuedNanos() {
        return enqueuedNanos;
    }

    CompletableFuture<Void> dispatched() {
        return dispatched;
    }

    RequestState state() {
        return state;
    }

    void markDispatched() {
        state = RequestState.DISPATCHED;
    }

    boolean isOverdue(long nowNanos, long timeoutNanos) {
        return nowNanos - enqueuedNanos > timeoutNanos;
    }

    RequestHandle handle() {
        return new RequestHandle(id, clientId, priority, dispatched);
    }
}
