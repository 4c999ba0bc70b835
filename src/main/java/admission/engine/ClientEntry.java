package admission.engine;

import admission.core.model.RateLimitAlgorithm;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Bookkeeping for one client: its algorithm state, administrative block and last access.
 *
 * Thread-safety:
 * - The lock must be held for every read or write of the mutable fields
 * - A retired entry has been removed from the store; holders must look the client up again
 */
final class ClientEntry {

    private final RateLimitAlgorithm algorithm;
    private final ReentrantLock lock;

    private long lastAccessNanos;
    private boolean blocked;
    private long blockedUntilNanos;
    private boolean retired;

    ClientEntry(RateLimitAlgorithm algorithm, long createdNanos) {
        if (algorithm == null) {
            throw new IllegalArgumentException("algorithm cannot be null");
        }
        this.algorithm = algorithm;
        this.lock = new ReentrantLock(); // Non-fair for better throughput
        this.lastAccessNanos = createdNanos;
    }

    RateLimitAlgorithm algorithm() {
        return algorithm;
    }

    ReentrantLock lock() {
        return lock;
    }

    void touch(long nowNanos) {
        lastAccessNanos = nowNanos;
    }

    long lastAccessNanos() {
        return lastAccessNanos;
    }

    void blockUntil(long untilNanos) {
        blocked = true;
        blockedUntilNanos = untilNanos;
    }

    /**
     * @return true if a block was in effect at {@code nowNanos}
     */
    boolean unblock(long nowNanos) {
        boolean wasActive = isBlockedAt(nowNanos);
        blocked = false;
        blockedUntilNanos = 0L;
        return wasActive;
    }

    /**
     * Checks the block at {@code nowNanos}, clearing it once it has expired.
     */
    boolean isBlockedAt(long nowNanos) {
        if (!blocked) {
            return false;
        }
        if (nowNanos < blockedUntilNanos) {
            return true;
        }
        blocked = false;
        blockedUntilNanos = 0L;
        return false;
    }

    long blockedUntilNanos() {
        return blockedUntilNanos;
    }

    boolean isRetired() {
        return retired;
    }

    void retire() {
        retired = true;
    }
}
