package com.cred.freestyle.eventpricing.service;

import com.cred.freestyle.eventpricing.domain.booking.BookingStats;
import com.cred.freestyle.eventpricing.domain.model.Booking;
import com.cred.freestyle.eventpricing.infrastructure.cache.PriceCacheService;
import com.cred.freestyle.eventpricing.infrastructure.metrics.PricingMetricsService;
import com.cred.freestyle.eventpricing.repository.BookingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Read-only booking views, served from cache when possible.
 * Booking and cancellation invalidate the views they change.
 *
 * @author Event Pricing Team
 */
@Service
public class BookingQueryService {

    private static final Logger logger = LoggerFactory.getLogger(BookingQueryService.class);

    private final BookingRepository bookingRepository;
    private final PriceCacheService cacheService;
    private final PricingMetricsService metricsService;

    public BookingQueryService(
            BookingRepository bookingRepository,
            PriceCacheService cacheService,
            PricingMetricsService metricsService
    ) {
        this.bookingRepository = bookingRepository;
        this.cacheService = cacheService;
        this.metricsService = metricsService;
    }

    /**
     * Bookings of an event, newest first.
     *
     * @param eventId Event ID
     * @return Bookings
     */
    public List<Booking> getEventBookings(String eventId) {
        long generation = cacheService.currentGeneration(eventId);
        Optional<List<Booking>> cached = cacheService.getEventBookings(eventId, Booking.class);
        if (cached.isPresent()) {
            metricsService.recordCacheHit("event_bookings");
            return cached.get();
        }
        metricsService.recordCacheMiss("event_bookings");

        List<Booking> bookings = bookingRepository.findByEventIdOrderByCreatedAtDesc(eventId);
        cacheService.cacheEventBookings(eventId, bookings, generation);
        return bookings;
    }

    /**
     * Bookings of a customer, newest first.
     *
     * @param customerEmail Customer email (case-insensitive)
     * @return Bookings
     */
    public List<Booking> getCustomerBookings(String customerEmail) {
        String email = customerEmail.trim().toLowerCase(Locale.ROOT);

        long generation = cacheService.currentCustomerGeneration(email);
        Optional<List<Booking>> cached = cacheService.getCustomerBookings(email, Booking.class);
        if (cached.isPresent()) {
            metricsService.recordCacheHit("customer_bookings");
            return cached.get();
        }
        metricsService.recordCacheMiss("customer_bookings");

        List<Booking> bookings = bookingRepository.findByCustomerEmailOrderByCreatedAtDesc(email);
        cacheService.cacheCustomerBookings(email, bookings, generation);
        return bookings;
    }

    /**
     * Booking statistics of an event. An event without bookings has all figures at zero.
     *
     * @param eventId Event ID
     * @return BookingStats
     */
    @Transactional(readOnly = true)
    public BookingStats getEventStats(String eventId) {
        long generation = cacheService.currentGeneration(eventId);
        Optional<BookingStats> cached = cacheService.getEventStats(eventId, BookingStats.class);
        if (cached.isPresent()) {
            metricsService.recordCacheHit("event_stats");
            return cached.get();
        }
        metricsService.recordCacheMiss("event_stats");

        long totalBookings = bookingRepository.countByEventId(eventId);
        Long tickets = bookingRepository.sumTicketCountByEventId(eventId);
        BigDecimal revenue = bookingRepository.sumTotalAmountByEventId(eventId);

        long totalTickets = tickets != null ? tickets : 0;
        BookingStats stats = BookingStats.builder()
                .eventId(eventId)
                .totalBookings(totalBookings)
                .totalTickets(totalTickets)
                .totalRevenue(revenue != null ? revenue : BigDecimal.ZERO)
                .averageTickets(totalBookings > 0
                        ? BigDecimal.valueOf(totalTickets).divide(BigDecimal.valueOf(totalBookings), 2, RoundingMode.HALF_UP)
                        : BigDecimal.ZERO)
                .build();

        cacheService.cacheEventStats(eventId, stats, generation);
        logger.debug("Computed booking stats for event {}: {} bookings, {} tickets", eventId, totalBookings, totalTickets);
        return stats;
    }
}
