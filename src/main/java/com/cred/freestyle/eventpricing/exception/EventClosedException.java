package com.cred.freestyle.eventpricing.exception;

/**
 * Exception thrown when booking an event that is inactive or has already taken place.
 *
 * @author Event Pricing Team
 */
public class EventClosedException extends RuntimeException {

    private final String eventId;

    public EventClosedException(String eventId, String reason) {
        super(String.format("Event %s is not open for booking: %s", eventId, reason));
        this.eventId = eventId;
    }

    public String getEventId() {
        return eventId;
    }
}
