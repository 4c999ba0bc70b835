package admission.service;

import admission.core.model.RateLimitResult;
import admission.engine.RateLimiterEngine;
import admission.metrics.RateLimitMetrics;
import admission.metrics.ThrottleMetrics;
import admission.throttle.QueueFullException;
import admission.throttle.RequestHandle;
import admission.throttle.RequestPriority;
import admission.throttle.Throttler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the transport layer: rate limit first, then throttle.
 *
 * <p>This is a thin wrapper over {@link RateLimiterEngine} and {@link Throttler} with:
 * <ul>
 *   <li>Request validation (fail-fast with IllegalArgumentException)</li>
 *   <li>Outcome mapping (decision and QueueFull → {@link AdmissionOutcome})</li>
 * </ul>
 *
 * <p>Thread-safety: both components handle concurrency internally.
 * This service is stateless and can be called from any number of request workers.
 */
public final class AdmissionService {

    private static final Logger log = LoggerFactory.getLogger(AdmissionService.class);

    private final RateLimiterEngine limiter;
    private final Throttler throttler;

    /**
     * @param limiter Rate limiter (must be thread-safe)
     * @param throttler Throttler (must be thread-safe)
     * @throws IllegalArgumentException if either is null
     */
    public AdmissionService(RateLimiterEngine limiter, Throttler throttler) {
        if (limiter == null) {
            throw new IllegalArgumentException("limiter cannot be null");
        }
        if (throttler == null) {
            throw new IllegalArgumentException("throttler cannot be null");
        }
        this.limiter = limiter;
        this.throttler = throttler;
    }

    /**
     * Runs one request through admission control. A denied request never reaches the throttler.
     *
     * @throws IllegalArgumentException if clientId is null/blank or priority is null
     */
    public AdmissionOutcome admit(String clientId, RequestPriority priority) {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("clientId must not be blank");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }

        RateLimitResult decision = limiter.check(clientId);
        switch (decision.decision()) {
            case REJECT:
                return AdmissionOutcome.rejected(AdmissionOutcome.Status.DENIED, decision.retryAfterNanos());
            case BLOCKED:
                return AdmissionOutcome.rejected(AdmissionOutcome.Status.BLOCKED, decision.retryAfterNanos());
            default:
                break;
        }

        try {
            RequestHandle handle = throttler.submit(clientId, priority);
            return AdmissionOutcome.admitted(handle);
        } catch (QueueFullException e) {
            log.debug("Admission refused for client {}: {}", clientId, e.getMessage());
            return AdmissionOutcome.rejected(AdmissionOutcome.Status.QUEUE_FULL, 0L);
        }
    }

    public AdmissionOutcome admit(String clientId) {
        return admit(clientId, RequestPriority.NORMAL);
    }

    /**
     * Reports an admitted request finished.
     *
     * @return false for ids that are unknown, already completed or expired
     */
    public boolean complete(String requestId) {
        return throttler.complete(requestId);
    }

    public boolean cancel(String requestId) {
        return throttler.cancel(requestId);
    }

    public RateLimitMetrics rateLimitMetrics() {
        return limiter.metrics();
    }

    public ThrottleMetrics throttleMetrics() {
        return throttler.metrics();
    }

    public RateLimiterEngine limiter() {
        return limiter;
    }

    public Throttler throttler() {
        return throttler;
    }
}
