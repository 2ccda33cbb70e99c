package com.cred.freestyle.eventpricing.service;

import com.cred.freestyle.eventpricing.infrastructure.metrics.PricingMetricsService;
import com.cred.freestyle.eventpricing.repository.BookingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;

/**
 * Demand signal of the price model: bookings of an event in a trailing window.
 *
 * Best effort. The count runs in its own read-only transaction, and any failure
 * yields 0 so that pricing and booking never depend on it.
 *
 * @author Event Pricing Team
 */
@Service
public class DemandSignal {

    private static final Logger logger = LoggerFactory.getLogger(DemandSignal.class);

    private final BookingRepository bookingRepository;
    private final PricingMetricsService metricsService;
    private final TransactionTemplate readOnlyTransaction;

    @Value("${eventpricing.demand.window-minutes:60}")
    private long windowMinutes = 60;

    public DemandSignal(
            BookingRepository bookingRepository,
            PricingMetricsService metricsService,
            PlatformTransactionManager transactionManager
    ) {
        this.bookingRepository = bookingRepository;
        this.metricsService = metricsService;
        this.readOnlyTransaction = new TransactionTemplate(transactionManager);
        this.readOnlyTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.readOnlyTransaction.setReadOnly(true);
    }

    /**
     * Count bookings of an event created within the demand window ending at {@code now}.
     *
     * @param eventId Event ID
     * @param now End of the window
     * @return Booking count, or 0 if it could not be obtained
     */
    public long recentBookingCount(String eventId, Instant now) {
        Instant since = windowStart(now);
        try {
            Long count = readOnlyTransaction.execute(status ->
                    bookingRepository.countByEventIdAndCreatedAtGreaterThanEqual(eventId, since));
            return count != null ? count : 0;
        } catch (RuntimeException e) {
            logger.warn("Demand signal unavailable for event {}, pricing with zero demand", eventId, e);
            metricsService.recordError("DEMAND_SIGNAL_ERROR", "recentBookingCount");
            return 0;
        }
    }

    /**
     * Whether a booking created at {@code createdAt} counts towards the demand at {@code now}.
     */
    public boolean isInWindow(Instant createdAt, Instant now) {
        return createdAt != null && !createdAt.isBefore(windowStart(now));
    }

    private Instant windowStart(Instant now) {
        return now.minus(Duration.ofMinutes(windowMinutes));
    }
}
