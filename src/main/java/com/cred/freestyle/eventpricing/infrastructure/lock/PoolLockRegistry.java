package com.cred.freestyle.eventpricing.infrastructure.lock;

import com.cred.freestyle.eventpricing.exception.PoolBusyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process mutual exclusion per event (inventory pool).
 *
 * Lock Pattern:
 * - One fair ReentrantLock per event ID, created on first use
 * - Entries are use-counted and dropped when the last holder or waiter leaves, so
 *   requests for arbitrary ids leave nothing behind
 * - Bounded wait: a caller that cannot get the lock in time fails with PoolBusyException
 * - Different events never contend with each other
 *
 * Usage:
 * poolLockRegistry.acquire(eventId);
 * try {
 *     // Critical section - read, price, write
 * } finally {
 *     poolLockRegistry.release(eventId);
 * }
 *
 * This orders the work of one node. The SELECT ... FOR UPDATE taken inside the lock
 * orders nodes that share the database.
 *
 * @author Event Pricing Team
 */
@Service
public class PoolLockRegistry {

    private static final Logger logger = LoggerFactory.getLogger(PoolLockRegistry.class);

    private final ConcurrentMap<String, PoolLock> locks = new ConcurrentHashMap<>();

    private final long waitTimeoutMs;

    public PoolLockRegistry(@Value("${eventpricing.lock.wait-timeout-ms:5000}") long waitTimeoutMs) {
        this.waitTimeoutMs = waitTimeoutMs;
    }

    /**
     * Acquire the lock of an event, waiting at most the configured timeout.
     *
     * @param eventId Event ID
     * @throws PoolBusyException if the lock is not acquired in time or the thread is interrupted
     */
    public void acquire(String eventId) {
        PoolLock poolLock = locks.compute(eventId, (id, existing) -> {
            PoolLock entry = existing != null ? existing : new PoolLock();
            entry.users++;
            return entry;
        });
        boolean acquired = false;
        try {
            acquired = poolLock.lock.tryLock(waitTimeoutMs, TimeUnit.MILLISECONDS);
            if (!acquired) {
                logger.warn("Failed to acquire pool lock for event {} within {}ms", eventId, waitTimeoutMs);
                throw new PoolBusyException(eventId, waitTimeoutMs);
            }
            logger.debug("Acquired pool lock for event: {}", eventId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Pool lock acquisition interrupted for event: {}", eventId);
            throw new PoolBusyException(eventId, e);
        } finally {
            if (!acquired) {
                leave(eventId);
            }
        }
    }

    /**
     * Release the lock of an event held by the current thread.
     *
     * @param eventId Event ID
     */
    public void release(String eventId) {
        PoolLock poolLock = locks.get(eventId);
        if (poolLock == null || !poolLock.lock.isHeldByCurrentThread()) {
            logger.warn("Release of pool lock not held by current thread: {}", eventId);
            return;
        }
        poolLock.lock.unlock();
        leave(eventId);
        logger.debug("Released pool lock for event: {}", eventId);
    }

    public boolean isLocked(String eventId) {
        PoolLock poolLock = locks.get(eventId);
        return poolLock != null && poolLock.lock.isLocked();
    }

    int trackedPools() {
        return locks.size();
    }

    private void leave(String eventId) {
        locks.computeIfPresent(eventId, (id, entry) -> --entry.users == 0 ? null : entry);
    }

    /**
     * Lock plus the number of threads holding or waiting for it.
     * The count is only changed inside map compute calls for its key.
     */
    private static final class PoolLock {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }
}
