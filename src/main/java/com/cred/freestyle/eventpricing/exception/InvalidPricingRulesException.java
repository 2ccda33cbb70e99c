package com.cred.freestyle.eventpricing.exception;

/**
 * Exception thrown when an event is configured with an invalid pricing rule set.
 *
 * @author Event Pricing Team
 */
public class InvalidPricingRulesException extends RuntimeException {

    public InvalidPricingRulesException(String message) {
        super(message);
    }
}
