package admission.engine;

import admission.core.clock.Clock;
import admission.core.model.RateLimitAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Concurrent map from client id to {@link ClientEntry} with per-key locking.
 *
 * Lookups go through {@link ConcurrentHashMap} (no global lock); every action on an entry runs
 * while holding that entry's lock. Eviction takes the same lock, marks the entry retired and
 * removes it, so an action racing with eviction either completes first or retries on a fresh
 * entry. A client recreated right after eviction behaves like a new client.
 */
final class ClientStateStore {

    private static final Logger log = LoggerFactory.getLogger(ClientStateStore.class);

    private final ConcurrentHashMap<String, ClientEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Supplier<RateLimitAlgorithm> algorithms;

    ClientStateStore(Clock clock, Supplier<RateLimitAlgorithm> algorithms) {
        this.clock = clock;
        this.algorithms = algorithms;
    }

    /**
     * Runs {@code action} on the client's entry under its lock, creating the entry if absent.
     */
    <T> T withEntry(String clientId, Function<ClientEntry, T> action) {
        while (true) {
            ClientEntry entry = entries.computeIfAbsent(clientId, k -> new ClientEntry(algorithms.get(), clock.nowNanos()));
            entry.lock().lock();
            try {
                if (!entry.isRetired()) {
                    return action.apply(entry);
                }
            } finally {
                entry.lock().unlock();
            }
            // evicted between lookup and lock: retry against the replacement
        }
    }

    /**
     * Runs {@code action} on an existing entry under its lock.
     *
     * @return the action's result, or {@code absent} when the client has no live entry
     */
    <T> T withExistingEntry(String clientId, Function<ClientEntry, T> action, T absent) {
        ClientEntry entry = entries.get(clientId);
        if (entry == null) {
            return absent;
        }
        entry.lock().lock();
        try {
            return entry.isRetired() ? absent : action.apply(entry);
        } finally {
            entry.lock().unlock();
        }
    }

    /**
     * Evicts every entry matching {@code evictable}, tested under the entry's lock.
     *
     * @return number of entries removed
     */
    int removeIf(Predicate<ClientEntry> evictable) {
        int removed = 0;
        for (Map.Entry<String, ClientEntry> e : entries.entrySet()) {
            ClientEntry entry = e.getValue();
            entry.lock().lock();
            try {
                if (!entry.isRetired() && evictable.test(entry)) {
                    entry.retire();
                    if (entries.remove(e.getKey(), entry)) {
                        removed++;
                    }
                }
            } finally {
                entry.lock().unlock();
            }
        }
        if (removed > 0) {
            log.debug("Evicted {} client entries, {} remain", removed, entries.size());
        }
        return removed;
    }

    int size() {
        return entries.size();
    }

    void clear() {
        removeIf(entry -> true);
    }
}
