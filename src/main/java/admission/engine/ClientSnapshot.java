package admission.engine;

import admission.core.model.AlgorithmState;

import java.util.OptionalLong;

/**
 * Immutable copy of a client's bookkeeping, taken under the client's lock.
 *
 * @param clientId The client
 * @param state Algorithm counters (tokens, request count, window start, last refill)
 * @param lastAccessNanos Last time a check touched the client
 * @param blockedUntilNanos Administrative block deadline, if one is in effect
 */
public record ClientSnapshot(
    String clientId,
    AlgorithmState state,
    long lastAccessNanos,
    OptionalLong blockedUntilNanos
) {
    public double tokens() {
        return state.tokens();
    }

    public int requestCount() {
        return state.requestCount();
    }

    public long windowStartNanos() {
        return state.windowStartNanos();
    }

    public long lastRefillNanos() {
        return state.lastRefillNanos();
    }

    public boolean blocked() {
        return blockedUntilNanos.isPresent();
    }
}
