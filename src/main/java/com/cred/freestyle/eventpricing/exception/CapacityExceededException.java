package com.cred.freestyle.eventpricing.exception;

/**
 * Exception thrown when a booking asks for more tickets than the event has left.
 * Carries the exact remaining count so the caller can retry with a smaller quantity.
 *
 * @author Event Pricing Team
 */
public class CapacityExceededException extends RuntimeException {

    private final String eventId;
    private final int requestedTickets;
    private final int remainingTickets;

    public CapacityExceededException(String eventId, int requestedTickets, int remainingTickets) {
        super(String.format("Not enough tickets available. Only %d tickets remaining.", remainingTickets));
        this.eventId = eventId;
        this.requestedTickets = requestedTickets;
        this.remainingTickets = remainingTickets;
    }

    public String getEventId() {
        return eventId;
    }

    public int getRequestedTickets() {
        return requestedTickets;
    }

    public int getRemainingTickets() {
        return remainingTickets;
    }
}
