package com.cred.freestyle.eventpricing.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.concurrent.TimeUnit;

/**
 * Metrics service for monitoring and observability.
 * Publishes custom metrics to AWS CloudWatch via Micrometer.
 *
 * Key Metrics:
 * - Booking success/failure rates and latency
 * - Cancellations and rate limit rejections
 * - Computed prices per event
 * - Cache hit/miss rates
 * - Error rates
 *
 * @author Event Pricing Team
 */
@Service
public class PricingMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(PricingMetricsService.class);

    private final MeterRegistry meterRegistry;

    // Metric name prefixes
    private static final String METRIC_PREFIX = "eventpricing.";
    private static final String BOOKING_PREFIX = METRIC_PREFIX + "booking.";
    private static final String PRICE_PREFIX = METRIC_PREFIX + "price.";
    private static final String CACHE_PREFIX = METRIC_PREFIX + "cache.";

    public PricingMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record successful booking.
     *
     * @param eventId Event ID
     * @param tickets Tickets booked
     */
    public void recordBookingSuccess(String eventId, int tickets) {
        Counter.builder(BOOKING_PREFIX + "success")
                .tag("event_id", eventId)
                .description("Successful bookings")
                .register(meterRegistry)
                .increment();
        Counter.builder(BOOKING_PREFIX + "tickets")
                .tag("event_id", eventId)
                .description("Tickets sold")
                .register(meterRegistry)
                .increment(tickets);
        logger.debug("Recorded booking success for event: {}", eventId);
    }

    /**
     * Record rejected or failed booking attempt.
     *
     * @param eventId Event ID
     * @param reason Failure reason (e.g., "CAPACITY_EXCEEDED", "EVENT_CLOSED")
     */
    public void recordBookingFailure(String eventId, String reason) {
        Counter.builder(BOOKING_PREFIX + "failure")
                .tag("event_id", eventId)
                .tag("reason", reason)
                .description("Failed booking attempts")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded booking failure for event: {}, reason: {}", eventId, reason);
    }

    public void recordCancellation(String eventId) {
        Counter.builder(BOOKING_PREFIX + "cancelled")
                .tag("event_id", eventId)
                .description("Cancelled bookings")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded cancellation for event: {}", eventId);
    }

    public void recordRateLimited() {
        Counter.builder(BOOKING_PREFIX + "rate_limited")
                .description("Booking requests rejected by the customer rate limit")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record booking latency, lock wait included.
     *
     * @param durationMs Duration in milliseconds
     */
    public void recordBookingLatency(long durationMs) {
        Timer.builder(BOOKING_PREFIX + "latency")
                .description("Booking latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record a freshly computed price.
     *
     * @param eventId Event ID
     * @param price Final price
     */
    public void recordComputedPrice(String eventId, BigDecimal price) {
        DistributionSummary.builder(PRICE_PREFIX + "computed")
                .tag("event_id", eventId)
                .description("Computed ticket prices")
                .register(meterRegistry)
                .record(price.doubleValue());
    }

    public void recordCacheHit(String cacheType) {
        Counter.builder(CACHE_PREFIX + "hit")
                .tag("cache_type", cacheType)
                .description("Cache hits")
                .register(meterRegistry)
                .increment();
    }

    public void recordCacheMiss(String cacheType) {
        Counter.builder(CACHE_PREFIX + "miss")
                .tag("cache_type", cacheType)
                .description("Cache misses")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record error occurrence.
     *
     * @param errorType Error type (e.g., "DEMAND_SIGNAL_ERROR", "RATE_LIMIT_CHECK_ERROR")
     * @param operation Operation where error occurred
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "error")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("System errors")
                .register(meterRegistry)
                .increment();
        logger.warn("Recorded error: type={}, operation={}", errorType, operation);
    }
}
