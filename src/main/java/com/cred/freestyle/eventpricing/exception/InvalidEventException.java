package com.cred.freestyle.eventpricing.exception;

/**
 * Exception thrown when an event cannot be created as requested
 * (price bounds out of order, event date in the past, non-positive capacity).
 *
 * @author Event Pricing Team
 */
public class InvalidEventException extends RuntimeException {

    private final String field;

    public InvalidEventException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
