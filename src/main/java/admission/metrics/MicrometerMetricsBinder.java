package admission.metrics;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.TimeGauge;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.concurrent.TimeUnit;

/**
 * Publishes a {@link MetricsCollector} to a Micrometer {@link MeterRegistry}.
 * Meters read the collector lazily, so binding adds nothing to the decision path.
 *
 * <p>Registered meters:</p>
 * <ul>
 *   <li>{@code admission.ratelimit.requests}: FunctionCounter (tag: outcome = total|allowed|blocked)</li>
 *   <li>{@code admission.ratelimit.clients}: Gauge</li>
 *   <li>{@code admission.ratelimit.decision.time}: TimeGauge, mean decision latency</li>
 *   <li>{@code admission.throttle.requests}: FunctionCounter (tag: outcome = submitted|rejected|expired|completed)</li>
 *   <li>{@code admission.throttle.active}: Gauge</li>
 *   <li>{@code admission.throttle.queued}: Gauge</li>
 * </ul>
 */
public class MicrometerMetricsBinder implements MeterBinder {

    private final MetricsCollector collector;

    public MicrometerMetricsBinder(MetricsCollector collector) {
        if (collector == null) {
            throw new IllegalArgumentException("collector cannot be null");
        }
        this.collector = collector;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        FunctionCounter.builder("admission.ratelimit.requests", collector, MetricsCollector::totalRequests)
                .description("Rate limit checks")
                .tag("outcome", "total")
                .register(registry);
        FunctionCounter.builder("admission.ratelimit.requests", collector, MetricsCollector::allowedRequests)
                .description("Rate limit checks")
                .tag("outcome", "allowed")
                .register(registry);
        FunctionCounter.builder("admission.ratelimit.requests", collector, MetricsCollector::blockedRequests)
                .description("Rate limit checks")
                .tag("outcome", "blocked")
                .register(registry);
        Gauge.builder("admission.ratelimit.clients", collector, MetricsCollector::currentClients)
                .description("Clients with live rate limit state")
                .register(registry);
        TimeGauge.builder("admission.ratelimit.decision.time", collector, TimeUnit.NANOSECONDS,
                        MetricsCollector::averageDecisionNanos)
                .description("Mean rate limit decision latency")
                .register(registry);

        FunctionCounter.builder("admission.throttle.requests", collector, MetricsCollector::submitted)
                .description("Throttler submissions")
                .tag("outcome", "submitted")
                .register(registry);
        FunctionCounter.builder("admission.throttle.requests", collector, MetricsCollector::rejected)
                .description("Throttler submissions")
                .tag("outcome", "rejected")
                .register(registry);
        FunctionCounter.builder("admission.throttle.requests", collector, MetricsCollector::expired)
                .description("Throttler submissions")
                .tag("outcome", "expired")
                .register(registry);
        FunctionCounter.builder("admission.throttle.requests", collector, MetricsCollector::completed)
                .description("Throttler submissions")
                .tag("outcome", "completed")
                .register(registry);
        Gauge.builder("admission.throttle.active", collector, MetricsCollector::activeRequests)
                .description("In-flight requests")
                .register(registry);
        Gauge.builder("admission.throttle.queued", collector, MetricsCollector::queuedRequests)
                .description("Requests waiting for a slot")
                .register(registry);
    }
}
