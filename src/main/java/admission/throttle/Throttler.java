package admission.throttle;

import admission.core.clock.Clock;
import admission.core.clock.SystemClock;
import admission.metrics.MetricsCollector;
import admission.metrics.ThrottleMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Bounds concurrently executing requests and queues the excess by priority.
 *
 * Lifecycle of a request:
 * <pre>
 * submit ──► DISPATCHED ──complete/cancel──► (forgotten)
 *    │            ▲
 *    ▼            │ slot freed
 *  QUEUED ────────┘
 *    │
 *    ├─ timeout ──► RequestTimeoutException on the handle
 *    └─ cancel  ──► handle cancelled
 * submit with a full queue ──► QueueFullException, nothing created
 * </pre>
 *
 * Queue: one FIFO lane per priority, scanned CRITICAL to LOW, so ties within a priority go to
 * the earliest enqueued request. With priority disabled every request shares one lane.
 *
 * Expiry runs on every submission and dispatch attempt, and on {@link #expireStale()} for
 * periodic sweeps; an overdue request is never dispatched.
 *
 * Thread-safety: all state is guarded by one lock held only for bookkeeping. Handle futures
 * are completed after the lock is released, so callbacks may call back into the throttler.
 * Relies on a monotonic clock: each lane is ordered by enqueue time.
 */
public final class Throttler {

    private static final Logger log = LoggerFactory.getLogger(Throttler.class);

    private static final RequestPriority[] DISPATCH_ORDER = {
        RequestPriority.CRITICAL, RequestPriority.HIGH, RequestPriority.NORMAL, RequestPriority.LOW
    };

    private final Clock clock;
    private final ThrottleConfig config;
    private final MetricsCollector metrics;
    private final long timeoutNanos;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, QueuedRequest> inFlight = new HashMap<>();
    private final Map<String, QueuedRequest> waiting = new HashMap<>();
    private final EnumMap<RequestPriority, ArrayDeque<QueuedRequest>> lanes = new EnumMap<>(RequestPriority.class);
    private final AtomicLong sequence = new AtomicLong();

    private volatile int activeCount;
    private volatile int queuedCount;

    public Throttler(ThrottleConfig config) {
        this(SystemClock.instance(), config);
    }

    public Throttler(Clock clock, ThrottleConfig config) {
        this(clock, config, new MetricsCollector());
    }

    /**
     * @param clock Clock used for enqueue timestamps and expiry
     * @param config Throttler configuration
     * @param metrics Collector receiving submission outcomes
     * @throws IllegalArgumentException if any parameter is null
     */
    public Throttler(Clock clock, ThrottleConfig config, MetricsCollector metrics) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
        this.clock = clock;
        this.config = config;
        this.metrics = metrics;
        this.timeoutNanos = config.timeout().toNanos();
        for (RequestPriority priority : RequestPriority.values()) {
            lanes.put(priority, new ArrayDeque<>());
        }
        this.metrics.trackThrottle(() -> activeCount, () -> queuedCount);

        log.info("Throttler ready: maxConcurrent={}, queueSize={}, timeout={}, priority={}",
            config.maxConcurrentRequests(), config.queueSize(), config.timeout(), config.enablePriority());
    }

    /**
     * Submits a request. Never blocks: the request is either dispatched now or queued, and
     * the handle's future signals when it actually starts.
     *
     * @param clientId Submitting client
     * @param priority Requested priority (ignored for ordering when priority is disabled)
     * @return handle carrying the request id and the dispatch signal
     * @throws QueueFullException if every slot is busy and the queue is full
     * @throws IllegalArgumentException if clientId or priority is null
     */
    public RequestHandle submit(String clientId, RequestPriority priority) {
        if (clientId == null) {
            throw new IllegalArgumentException("clientId cannot be null");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }

        List<Runnable> notifications = new ArrayList<>();
        QueuedRequest request;
        lock.lock();
        try {
            long now = clock.nowNanos();
            expireOverdue(now, notifications);
            record(MetricsCollector::recordSubmitted);

            request = new QueuedRequest(nextId(clientId), clientId, priority, now);
            if (inFlight.size() < config.maxConcurrentRequests()) {
                dispatch(request, notifications);
                log.debug("Request {} dispatched immediately", request.id());
            } else if (waiting.size() < config.queueSize()) {
                waiting.put(request.id(), request);
                lane(priority).addLast(request);
                record(MetricsCollector::recordQueued);
                log.debug("Request {} queued with priority {}", request.id(), priority);
            } else {
                record(MetricsCollector::recordRejected);
                log.warn("Request queue is full, rejecting request from client {}", clientId);
                throw new QueueFullException(clientId, config.queueSize());
            }
        } finally {
            updateGauges();
            lock.unlock();
            notifications.forEach(Runnable::run);
        }
        return request.handle();
    }

    /**
     * Marks an in-flight request finished and hands its slot to the next queued request.
     *
     * @return true if the id was in flight; false (with no side effects) otherwise
     */
    public boolean complete(String requestId) {
        if (requestId == null) {
            return false;
        }
        List<Runnable> notifications = new ArrayList<>();
        lock.lock();
        try {
            QueuedRequest request = inFlight.remove(requestId);
            if (request == null) {
                return false;
            }
            record(MetricsCollector::recordCompleted);
            log.debug("Request {} completed", requestId);
            dispatchNext(clock.nowNanos(), notifications);
            return true;
        } finally {
            updateGauges();
            lock.unlock();
            notifications.forEach(Runnable::run);
        }
    }

    /**
     * Withdraws a request. A queued request leaves the queue and its handle is cancelled;
     * an in-flight request releases its slot without counting as completed.
     *
     * @return true if the id was queued or in flight
     */
    public boolean cancel(String requestId) {
        if (requestId == null) {
            return false;
        }
        List<Runnable> notifications = new ArrayList<>();
        lock.lock();
        try {
            QueuedRequest running = inFlight.remove(requestId);
            if (running != null) {
                record(MetricsCollector::recordCancelled);
                log.debug("In-flight request {} cancelled", requestId);
                dispatchNext(clock.nowNanos(), notifications);
                return true;
            }
            QueuedRequest queued = waiting.remove(requestId);
            if (queued != null) {
                lane(queued.priority()).remove(queued);
                record(MetricsCollector::recordCancelled);
                log.debug("Queued request {} cancelled", requestId);
                notifications.add(() -> queued.dispatched().cancel(false));
                return true;
            }
            return false;
        } finally {
            updateGauges();
            lock.unlock();
            notifications.forEach(Runnable::run);
        }
    }

    /**
     * Expires every queued request that has waited longer than the timeout.
     *
     * @return number of requests expired
     */
    public int expireStale() {
        List<Runnable> notifications = new ArrayList<>();
        lock.lock();
        try {
            return expireOverdue(clock.nowNanos(), notifications);
        } finally {
            updateGauges();
            lock.unlock();
            notifications.forEach(Runnable::run);
        }
    }

    public Optional<RequestState> state(String requestId) {
        lock.lock();
        try {
            QueuedRequest request = inFlight.get(requestId);
            if (request == null) {
                request = waiting.get(requestId);
            }
            return request == null ? Optional.empty() : Optional.of(request.state());
        } finally {
            lock.unlock();
        }
    }

    public ThrottleStatus status() {
        lock.lock();
        try {
            return new ThrottleStatus(inFlight.size(), waiting.size());
        } finally {
            lock.unlock();
        }
    }

    public ThrottleMetrics metrics() {
        return metrics.throttleMetrics();
    }

    public ThrottleConfig config() {
        return config;
    }

    private void dispatchNext(long now, List<Runnable> notifications) {
        expireOverdue(now, notifications);
        while (inFlight.size() < config.maxConcurrentRequests()) {
            QueuedRequest next = pollHighestPriority();
            if (next == null) {
                return;
            }
            waiting.remove(next.id());
            dispatch(next, notifications);
            log.debug("Queued request {} dispatched after {}ns", next.id(), now - next.enqueuedNanos());
        }
    }

    private void dispatch(QueuedRequest request, List<Runnable> notifications) {
        request.markDispatched();
        inFlight.put(request.id(), request);
        record(MetricsCollector::recordDispatched);
        notifications.add(() -> request.dispatched().complete(null));
    }

    private QueuedRequest pollHighestPriority() {
        for (RequestPriority priority : DISPATCH_ORDER) {
            QueuedRequest next = lanes.get(priority).pollFirst();
            if (next != null) {
                return next;
            }
        }
        return null;
    }

    private int expireOverdue(long now, List<Runnable> notifications) {
        int expired = 0;
        for (ArrayDeque<QueuedRequest> lane : lanes.values()) {
            QueuedRequest head;
            while ((head = lane.peekFirst()) != null && head.isOverdue(now, timeoutNanos)) {
                lane.pollFirst();
                waiting.remove(head.id());
                expired++;
                RequestTimeoutException timeout =
                    new RequestTimeoutException(head.id(), Duration.ofNanos(now - head.enqueuedNanos()));
                QueuedRequest dropped = head;
                notifications.add(() -> dropped.dispatched().completeExceptionally(timeout));
            }
        }
        if (expired > 0) {
            int count = expired;
            record(m -> m.recordExpired(count));
            log.warn("Expired {} queued requests after waiting more than {}", expired, config.timeout());
        }
        return expired;
    }

    private void record(Consumer<MetricsCollector> update) {
        try {
            update.accept(metrics);
        } catch (RuntimeException e) {
            log.warn("Failed to record throttle metrics; request unaffected", e);
        }
    }

    private ArrayDeque<QueuedRequest> lane(RequestPriority priority) {
        return lanes.get(config.enablePriority() ? priority : RequestPriority.NORMAL);
    }

    private void updateGauges() {
        activeCount = inFlight.size();
        queuedCount = waiting.size();
    }

    private String nextId(String clientId) {
        return clientId + "-" + sequence.incrementAndGet();
    }
}
