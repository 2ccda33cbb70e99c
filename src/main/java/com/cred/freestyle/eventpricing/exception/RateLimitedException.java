package com.cred.freestyle.eventpricing.exception;

/**
 * Exception thrown when a customer sends more booking requests than the sliding window allows.
 *
 * @author Event Pricing Team
 */
public class RateLimitedException extends RuntimeException {

    private final String customerEmail;
    private final long retryAfterSeconds;

    public RateLimitedException(String customerEmail, long retryAfterSeconds, String message) {
        super(message);
        this.customerEmail = customerEmail;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public String getCustomerEmail() {
        return customerEmail;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
