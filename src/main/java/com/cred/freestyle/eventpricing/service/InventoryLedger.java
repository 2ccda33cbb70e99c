package com.cred.freestyle.eventpricing.service;

import com.cred.freestyle.eventpricing.domain.model.Event;
import com.cred.freestyle.eventpricing.exception.CapacityExceededException;
import com.cred.freestyle.eventpricing.exception.ResourceNotFoundException;
import com.cred.freestyle.eventpricing.infrastructure.lock.PoolLockRegistry;
import com.cred.freestyle.eventpricing.repository.EventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Authoritative ticket ledger of every event.
 *
 * All changes to an event's booked tickets go through {@link #withPoolLock}, which runs
 * a unit of work with exclusive access to one event:
 * 1. Acquire the in-process pool lock of the event
 * 2. Run {@link PoolTransaction#prepare()} (no database transaction open yet)
 * 3. Open a transaction and read the event with SELECT ... FOR UPDATE
 * 4. Run {@link PoolTransaction#execute(Event)} on the locked, managed event
 * 5. Commit; any exception rolls everything back and skips step 6
 * 6. Run {@link PoolTransaction#afterCommit(Object)} (cache invalidation, notifications)
 * 7. Release the pool lock
 *
 * Because the lock is held from step 1 to 7, no other booking or cancellation of the
 * same event can read the booked count between another transaction's read and commit,
 * and caches are already invalidated when the next one starts.
 *
 * @author Event Pricing Team
 */
@Service
public class InventoryLedger {

    private static final Logger logger = LoggerFactory.getLogger(InventoryLedger.class);

    private final EventRepository eventRepository;
    private final PoolLockRegistry poolLockRegistry;
    private final TransactionTemplate transactionTemplate;

    public InventoryLedger(
            EventRepository eventRepository,
            PoolLockRegistry poolLockRegistry,
            PlatformTransactionManager transactionManager
    ) {
        this.eventRepository = eventRepository;
        this.poolLockRegistry = poolLockRegistry;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Run a unit of work with exclusive access to an event.
     *
     * @param eventId Event ID
     * @param work Work to run
     * @return Result of {@link PoolTransaction#execute(Event)}
     * @throws ResourceNotFoundException if the event does not exist
     */
    public <T> T withPoolLock(String eventId, PoolTransaction<T> work) {
        poolLockRegistry.acquire(eventId);
        try {
            work.prepare();

            T result = transactionTemplate.execute(status -> {
                Event event = eventRepository.findByIdForUpdate(eventId)
                        .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
                return work.execute(event);
            });

            work.afterCommit(result);
            return result;
        } finally {
            poolLockRegistry.release(eventId);
        }
    }

    /**
     * Take tickets from a locked event.
     *
     * @param event Event read under the pool lock
     * @param tickets Tickets to take
     * @throws CapacityExceededException if fewer than {@code tickets} remain
     */
    public void reserve(Event event, int tickets) {
        int remaining = event.getCapacity() - event.getBookedTickets();
        if (tickets > remaining) {
            throw new CapacityExceededException(event.getEventId(), tickets, Math.max(0, remaining));
        }
        event.setBookedTickets(event.getBookedTickets() + tickets);
        logger.debug("Reserved {} tickets for event {}, booked now {}/{}",
                tickets, event.getEventId(), event.getBookedTickets(), event.getCapacity());
    }

    /**
     * Return tickets to a locked event. The booked count never drops below zero.
     *
     * @param event Event read under the pool lock
     * @param tickets Tickets to return
     */
    public void release(Event event, int tickets) {
        int booked = event.getBookedTickets() - tickets;
        if (booked < 0) {
            logger.warn("Releasing {} tickets from event {} with only {} booked, flooring at 0",
                    tickets, event.getEventId(), event.getBookedTickets());
            booked = 0;
        }
        event.setBookedTickets(booked);
        logger.debug("Released {} tickets for event {}, booked now {}/{}",
                tickets, event.getEventId(), event.getBookedTickets(), event.getCapacity());
    }

    /**
     * A unit of work run by {@link #withPoolLock(String, PoolTransaction)}.
     *
     * @param <T> Result type
     */
    public interface PoolTransaction<T> {

        /**
         * Runs under the pool lock before the database transaction opens.
         * Reads that must not share the locked transaction belong here.
         */
        default void prepare() {
        }

        /**
         * Runs inside the transaction with the event row locked.
         * Changes to the managed event are flushed on commit.
         */
        T execute(Event event);

        /**
         * Runs after a successful commit, still under the pool lock.
         */
        default void afterCommit(T result) {
        }
    }
}
