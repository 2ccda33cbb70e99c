package com.cred.freestyle.eventpricing.exception;

/**
 * Exception thrown when a booking request is malformed (quantity out of range, bad email).
 * Raised before any lock is taken.
 *
 * @author Event Pricing Team
 */
public class BookingValidationException extends RuntimeException {

    private final String field;

    public BookingValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
