package com.cred.freestyle.eventpricing.exception;

/**
 * Exception thrown when an event's pool lock could not be acquired in time.
 * Nothing was written; the request is safe to retry.
 *
 * @author Event Pricing Team
 */
public class PoolBusyException extends RuntimeException {

    private final String eventId;

    public PoolBusyException(String eventId, long waitMillis) {
        super(String.format("Event %s is busy, lock not acquired within %d ms", eventId, waitMillis));
        this.eventId = eventId;
    }

    public PoolBusyException(String eventId, Throwable cause) {
        super(String.format("Interrupted while waiting for the lock of event %s", eventId), cause);
        this.eventId = eventId;
    }

    public String getEventId() {
        return eventId;
    }
}
