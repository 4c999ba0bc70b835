package admission.metrics;

import java.time.Duration;

/**
 * Aggregate rate limiter counters at a point in time.
 *
 * @param totalRequests every check
 * @param allowedRequests checks that admitted the request
 * @param blockedRequests checks denied by the algorithm or an administrative block
 * @param currentClients live ClientState Store size
 * @param averageResponseTime mean decision latency (not task latency)
 */
public record RateLimitMetrics(
    long totalRequests,
    long allowedRequests,
    long blockedRequests,
    int currentClients,
    Duration averageResponseTime
) {
    public double allowRate() {
        return totalRequests == 0 ? 0.0 : (double) allowedRequests / totalRequests;
    }

    public double blockRate() {
        return totalRequests == 0 ? 0.0 : (double) blockedRequests / totalRequests;
    }
}
