package com.cred.freestyle.eventpricing.exception;

/**
 * Exception thrown when cancelling a booking for an event that has already taken place.
 *
 * @author Event Pricing Team
 */
public class CancellationExpiredException extends RuntimeException {

    private final String bookingId;
    private final String eventId;

    public CancellationExpiredException(String bookingId, String eventId) {
        super(String.format("Booking %s cannot be cancelled: event %s has already taken place", bookingId, eventId));
        this.bookingId = bookingId;
        this.eventId = eventId;
    }

    public String getBookingId() {
        return bookingId;
    }

    public String getEventId() {
        return eventId;
    }
}
