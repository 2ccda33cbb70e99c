package com.cred.freestyle.eventpricing.exception;

/**
 * Exception thrown when a customer acts on a booking that belongs to someone else.
 *
 * @author Event Pricing Team
 */
public class ForbiddenOperationException extends RuntimeException {

    private final String bookingId;

    public ForbiddenOperationException(String bookingId, String message) {
        super(message);
        this.bookingId = bookingId;
    }

    public String getBookingId() {
        return bookingId;
    }
}
