package com.cred.freestyle.eventpricing.infrastructure.ratelimit;

/**
 * Result of rate limit check.
 *
 * @author Event Pricing Team
 */
public class RateLimitResult {
    private final boolean allowed;
    private final int remainingRequests;
    private final long retryAfterSeconds;
    private final String reason;

    private RateLimitResult(boolean allowed, int remainingRequests, long retryAfterSeconds, String reason) {
        this.allowed = allowed;
        this.remainingRequests = remainingRequests;
        this.retryAfterSeconds = retryAfterSeconds;
        this.reason = reason;
    }

    public static RateLimitResult allowed(int remainingRequests) {
        return new RateLimitResult(true, remainingRequests, 0, null);
    }

    public static RateLimitResult rejected(long retryAfterSeconds, String reason) {
        return new RateLimitResult(false, 0, retryAfterSeconds, reason);
    }

    public boolean isAllowed() {
        return allowed;
    }

    public int getRemainingRequests() {
        return remainingRequests;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public String getReason() {
        return reason;
    }
}
