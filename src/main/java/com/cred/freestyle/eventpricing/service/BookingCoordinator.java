package com.cred.freestyle.eventpricing.service;

import com.cred.freestyle.eventpricing.domain.model.Booking;
import com.cred.freestyle.eventpricing.domain.model.Booking.BookingStatus;
import com.cred.freestyle.eventpricing.domain.model.Event;
import com.cred.freestyle.eventpricing.domain.pricing.PriceBreakdown;
import com.cred.freestyle.eventpricing.exception.BookingFailedException;
import com.cred.freestyle.eventpricing.exception.BookingValidationException;
import com.cred.freestyle.eventpricing.exception.CapacityExceededException;
import com.cred.freestyle.eventpricing.exception.EventClosedException;
import com.cred.freestyle.eventpricing.exception.PoolBusyException;
import com.cred.freestyle.eventpricing.exception.RateLimitedException;
import com.cred.freestyle.eventpricing.exception.ResourceNotFoundException;
import com.cred.freestyle.eventpricing.infrastructure.cache.PriceCacheService;
import com.cred.freestyle.eventpricing.infrastructure.messaging.BookingEventProducer;
import com.cred.freestyle.eventpricing.infrastructure.messaging.events.BookingLifecycleEvent;
import com.cred.freestyle.eventpricing.infrastructure.metrics.PricingMetricsService;
import com.cred.freestyle.eventpricing.infrastructure.ratelimit.RateLimitResult;
import com.cred.freestyle.eventpricing.infrastructure.ratelimit.RateLimitService;
import com.cred.freestyle.eventpricing.repository.BookingRepository;
import jakarta.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Books tickets of an event at its current dynamic price.
 *
 * Flow:
 * 1. Validate ticket count and email, then apply the customer rate limit (no lock held)
 * 2. Under the event's pool lock: check the event is open and has enough tickets left
 * 3. Resolve the price (cache hit, or price model on the locked state)
 * 4. Take the tickets, persist the booking and the event's current price in one transaction
 * 5. After commit: invalidate the event's caches and publish BOOKING_CONFIRMED
 *
 * @author Event Pricing Team
 */
@Service
public class BookingCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(BookingCoordinator.class);

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private final InventoryLedger inventoryLedger;
    private final BookingRepository bookingRepository;
    private final PricingService pricingService;
    private final PriceCacheService cacheService;
    private final RateLimitService rateLimitService;
    private final BookingEventProducer eventProducer;
    private final PricingMetricsService metricsService;

    @Value("${eventpricing.booking.max-tickets-per-order:10}")
    private int maxTicketsPerOrder = 10;

    public BookingCoordinator(
            InventoryLedger inventoryLedger,
            BookingRepository bookingRepository,
            PricingService pricingService,
            PriceCacheService cacheService,
            RateLimitService rateLimitService,
            BookingEventProducer eventProducer,
            PricingMetricsService metricsService
    ) {
        this.inventoryLedger = inventoryLedger;
        this.bookingRepository = bookingRepository;
        this.pricingService = pricingService;
        this.cacheService = cacheService;
        this.rateLimitService = rateLimitService;
        this.eventProducer = eventProducer;
        this.metricsService = metricsService;
    }

    /**
     * Book tickets of an event.
     *
     * @param eventId Event ID
     * @param ticketCount Tickets to book
     * @param customerEmail Customer email
     * @return The committed booking
     * @throws BookingValidationException if the ticket count or email is invalid
     * @throws RateLimitedException if the customer sent too many booking requests
     * @throws ResourceNotFoundException if the event does not exist
     * @throws EventClosedException if the event is inactive or has taken place
     * @throws CapacityExceededException if not enough tickets remain
     * @throws PoolBusyException if the event's pool lock could not be acquired in time
     * @throws BookingFailedException on any storage failure
     */
    public Booking book(String eventId, Integer ticketCount, String customerEmail) {
        long startTime = System.currentTimeMillis();

        validateTicketCount(ticketCount);
        String email = normalizeEmail(customerEmail);

        RateLimitResult rateLimit = rateLimitService.checkRateLimit(email);
        if (!rateLimit.isAllowed()) {
            metricsService.recordBookingFailure(eventId, "RATE_LIMITED");
            throw new RateLimitedException(email, rateLimit.getRetryAfterSeconds(), rateLimit.getReason());
        }

        logger.info("Booking {} tickets of event {} for {}", ticketCount, eventId, email);

        try {
            Booking booking = inventoryLedger.withPoolLock(eventId, new InventoryLedger.PoolTransaction<Booking>() {
                private PricingService.PriceQuote quote;
                private BigDecimal price;

                @Override
                public void prepare() {
                    quote = pricingService.prepareQuote(eventId, Instant.now());
                }

                @Override
                public Booking execute(Event event) {
                    Instant now = Instant.now();
                    if (!Boolean.TRUE.equals(event.getIsActive())) {
                        throw new EventClosedException(eventId, "event is not active");
                    }
                    if (event.hasStarted(now)) {
                        throw new EventClosedException(eventId, "event has already taken place");
                    }
                    if (ticketCount > event.getAvailableTickets()) {
                        throw new CapacityExceededException(eventId, ticketCount, Math.max(0, event.getAvailableTickets()));
                    }

                    PriceBreakdown breakdown = pricingService.resolvePrice(quote, event);
                    price = breakdown.getFinalPrice();

                    inventoryLedger.reserve(event, ticketCount);
                    event.setCurrentPrice(price);

                    Booking created = Booking.builder()
                            .eventId(eventId)
                            .customerEmail(email)
                            .ticketCount(ticketCount)
                            .pricePerTicket(price)
                            .totalAmount(price.multiply(BigDecimal.valueOf(ticketCount)))
                            .status(BookingStatus.CONFIRMED)
                            .build();
                    return bookingRepository.save(created);
                }

                @Override
                public void afterCommit(Booking result) {
                    cacheService.invalidateEvent(eventId);
                    cacheService.invalidateCustomer(email);
                    eventProducer.publish(new BookingLifecycleEvent(
                            result, price, BookingLifecycleEvent.EventType.BOOKING_CONFIRMED));
                }
            });

            metricsService.recordBookingSuccess(eventId, ticketCount);
            logger.info("Booking {} confirmed: {} tickets of event {} at {} each",
                    booking.getBookingId(), ticketCount, eventId, booking.getPricePerTicket());
            return booking;

        } catch (CapacityExceededException e) {
            logger.warn("Booking rejected for event {}: {}", eventId, e.getMessage());
            metricsService.recordBookingFailure(eventId, "CAPACITY_EXCEEDED");
            throw e;
        } catch (EventClosedException e) {
            logger.warn("Booking rejected for event {}: {}", eventId, e.getMessage());
            metricsService.recordBookingFailure(eventId, "EVENT_CLOSED");
            throw e;
        } catch (ResourceNotFoundException e) {
            logger.warn("Booking rejected, event not found: {}", eventId);
            metricsService.recordBookingFailure(eventId, "EVENT_NOT_FOUND");
            throw e;
        } catch (PoolBusyException e) {
            logger.warn("Booking rejected, event {} is busy: {}", eventId, e.getMessage());
            metricsService.recordBookingFailure(eventId, "POOL_BUSY");
            throw e;
        } catch (DataAccessException | TransactionException | PersistenceException e) {
            logger.error("Error booking {} tickets of event {} for {}", ticketCount, eventId, email, e);
            metricsService.recordBookingFailure(eventId, "STORAGE_ERROR");
            metricsService.recordError("BOOKING_STORAGE_ERROR", "book");
            throw new BookingFailedException(eventId, "Booking failed, please try again", e);
        } finally {
            metricsService.recordBookingLatency(System.currentTimeMillis() - startTime);
        }
    }

    private void validateTicketCount(Integer ticketCount) {
        if (ticketCount == null || ticketCount < 1 || ticketCount > maxTicketsPerOrder) {
            throw new BookingValidationException("ticketCount",
                    String.format("Ticket count must be between 1 and %d", maxTicketsPerOrder));
        }
    }

    /**
     * Trim and lower-case an email after checking its shape.
     *
     * @throws BookingValidationException if the email is missing or malformed
     */
    static String normalizeEmail(String customerEmail) {
        if (customerEmail == null || !EMAIL_PATTERN.matcher(customerEmail.trim()).matches()) {
            throw new BookingValidationException("customerEmail", "A valid customer email is required");
        }
        return customerEmail.trim().toLowerCase(Locale.ROOT);
    }
}
