package com.cred.freestyle.eventpricing.exception;

/**
 * Exception thrown when a booking or cancellation fails for an unexpected storage reason.
 * The transaction was rolled back, so the caller may retry.
 *
 * @author Event Pricing Team
 */
public class BookingFailedException extends RuntimeException {

    private final String eventId;

    public BookingFailedException(String eventId, String message, Throwable cause) {
        super(message, cause);
        this.eventId = eventId;
    }

    public String getEventId() {
        return eventId;
    }
}
