package admission.service;

import admission.throttle.RequestHandle;

import java.util.Optional;

/**
 * Result of {@link AdmissionService#admit}. Every status is a normal operating condition.
 *
 * @param status What happened to the request
 * @param handle Present for DISPATCHED and QUEUED
 * @param retryAfterNanos Hint for DENIED and BLOCKED, 0 otherwise
 */
public record AdmissionOutcome(
    Status status,
    Optional<RequestHandle> handle,
    long retryAfterNanos
) {
    public enum Status {
        /** Holds an execution slot now. */
        DISPATCHED,
        /** Waiting for a slot; watch the handle. */
        QUEUED,
        /** Rate limit exceeded. */
        DENIED,
        /** Administrative block in effect. */
        BLOCKED,
        /** Throttler queue at capacity. */
        QUEUE_FULL
    }

    static AdmissionOutcome admitted(RequestHandle handle) {
        Status status = handle.isDispatched() ? Status.DISPATCHED : Status.QUEUED;
        return new AdmissionOutcome(status, Optional.of(handle), 0L);
    }

    static AdmissionOutcome rejected(Status status, long retryAfterNanos) {
        return new AdmissionOutcome(status, Optional.empty(), retryAfterNanos);
    }

    public boolean admitted() {
        return status == Status.DISPATCHED || status == Status.QUEUED;
    }

    /**
     * True for every status a transport layer should answer with "too many requests".
     */
    public boolean tooManyRequests() {
        return !admitted();
    }
}
