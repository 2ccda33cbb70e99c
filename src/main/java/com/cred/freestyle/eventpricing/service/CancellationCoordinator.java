package com.cred.freestyle.eventpricing.service;

import com.cred.freestyle.eventpricing.domain.booking.CancellationReceipt;
import com.cred.freestyle.eventpricing.domain.model.Booking;
import com.cred.freestyle.eventpricing.domain.model.Booking.BookingStatus;
import com.cred.freestyle.eventpricing.domain.model.Event;
import com.cred.freestyle.eventpricing.domain.pricing.PriceBreakdown;
import com.cred.freestyle.eventpricing.exception.BookingFailedException;
import com.cred.freestyle.eventpricing.exception.BookingValidationException;
import com.cred.freestyle.eventpricing.exception.CancellationExpiredException;
import com.cred.freestyle.eventpricing.exception.ForbiddenOperationException;
import com.cred.freestyle.eventpricing.exception.ResourceNotFoundException;
import com.cred.freestyle.eventpricing.infrastructure.cache.PriceCacheService;
import com.cred.freestyle.eventpricing.infrastructure.messaging.BookingEventProducer;
import com.cred.freestyle.eventpricing.infrastructure.messaging.events.BookingLifecycleEvent;
import com.cred.freestyle.eventpricing.infrastructure.metrics.PricingMetricsService;
import com.cred.freestyle.eventpricing.repository.BookingRepository;
import com.cred.freestyle.eventpricing.repository.EventRepository;
import jakarta.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Instant;
import java.util.Locale;

/**
 * Cancels bookings, returning their tickets to the event and re-pricing it.
 *
 * Ownership and the event date are checked before the pool lock. Under the lock the
 * booking is read again, so two racing cancellations release its tickets only once.
 *
 * @author Event Pricing Team
 */
@Service
public class CancellationCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(CancellationCoordinator.class);

    private final InventoryLedger inventoryLedger;
    private final BookingRepository bookingRepository;
    private final EventRepository eventRepository;
    private final PricingService pricingService;
    private final DemandSignal demandSignal;
    private final PriceCacheService cacheService;
    private final BookingEventProducer eventProducer;
    private final PricingMetricsService metricsService;

    public CancellationCoordinator(
            InventoryLedger inventoryLedger,
            BookingRepository bookingRepository,
            EventRepository eventRepository,
            PricingService pricingService,
            DemandSignal demandSignal,
            PriceCacheService cacheService,
            BookingEventProducer eventProducer,
            PricingMetricsService metricsService
    ) {
        this.inventoryLedger = inventoryLedger;
        this.bookingRepository = bookingRepository;
        this.eventRepository = eventRepository;
        this.pricingService = pricingService;
        this.demandSignal = demandSignal;
        this.cacheService = cacheService;
        this.eventProducer = eventProducer;
        this.metricsService = metricsService;
    }

    /**
     * Cancel a booking on behalf of its owner.
     *
     * @param bookingId Booking ID
     * @param customerEmail Email the booking was made with (case-insensitive)
     * @return Cancellation receipt
     * @throws BookingValidationException if no email is given
     * @throws ResourceNotFoundException if the booking (or its event) does not exist
     * @throws ForbiddenOperationException if the email does not own the booking
     * @throws CancellationExpiredException if the event has already taken place
     * @throws BookingFailedException on any storage failure
     */
    public CancellationReceipt cancel(String bookingId, String customerEmail) {
        if (customerEmail == null || customerEmail.isBlank()) {
            throw new BookingValidationException("email", "Email is required for cancellation");
        }
        String email = customerEmail.trim().toLowerCase(Locale.ROOT);

        try {
            Booking booking = bookingRepository.findById(bookingId)
                    .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));

            if (!booking.getCustomerEmail().equalsIgnoreCase(email)) {
                logger.warn("Cancellation of booking {} refused for {}", bookingId, email);
                throw new ForbiddenOperationException(bookingId, "You can only cancel your own bookings");
            }

            String eventId = booking.getEventId();
            Event event = eventRepository.findById(eventId)
                    .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
            if (event.hasStarted(Instant.now())) {
                logger.warn("Cancellation of booking {} refused, event {} has taken place", bookingId, eventId);
                throw new CancellationExpiredException(bookingId, eventId);
            }

            CancellationReceipt receipt = inventoryLedger.withPoolLock(eventId,
                    new InventoryLedger.PoolTransaction<CancellationReceipt>() {
                private Instant now;
                private long demandCount;
                private Booking cancelled;

                @Override
                public void prepare() {
                    now = Instant.now();
                    demandCount = demandSignal.recentBookingCount(eventId, now);
                }

                @Override
                public CancellationReceipt execute(Event locked) {
                    cancelled = bookingRepository.findById(bookingId)
                            .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));

                    bookingRepository.delete(cancelled);
                    inventoryLedger.release(locked, cancelled.getTicketCount());

                    // The demand count was taken before the delete.
                    long demand = demandSignal.isInWindow(cancelled.getCreatedAt(), now)
                            ? Math.max(0, demandCount - 1)
                            : demandCount;
                    PriceBreakdown breakdown = pricingService.computeFresh(locked, demand, now);
                    locked.setCurrentPrice(breakdown.getFinalPrice());

                    return CancellationReceipt.builder()
                            .bookingId(bookingId)
                            .eventId(eventId)
                            .ticketsReleased(cancelled.getTicketCount())
                            .refundAmount(cancelled.getTotalAmount())
                            .newPrice(breakdown.getFinalPrice())
                            .status(BookingStatus.CANCELLED)
                            .message(String.format("Booking cancelled successfully. Refund of %s will be processed.",
                                    cancelled.getTotalAmount().toPlainString()))
                            .build();
                }

                @Override
                public void afterCommit(CancellationReceipt result) {
                    cacheService.invalidateEvent(eventId);
                    cacheService.invalidateCustomer(cancelled.getCustomerEmail());
                    cancelled.setStatus(BookingStatus.CANCELLED);
                    eventProducer.publish(new BookingLifecycleEvent(
                            cancelled, result.getNewPrice(), BookingLifecycleEvent.EventType.BOOKING_CANCELLED));
                }
            });

            metricsService.recordCancellation(eventId);
            logger.info("Booking {} cancelled: {} tickets returned to event {}, new price {}",
                    bookingId, receipt.getTicketsReleased(), eventId, receipt.getNewPrice());
            return receipt;

        } catch (DataAccessException | TransactionException | PersistenceException e) {
            logger.error("Error cancelling booking {}", bookingId, e);
            metricsService.recordError("CANCELLATION_STORAGE_ERROR", "cancel");
            throw new BookingFailedException(null, "Cancellation failed, please try again", e);
        }
    }
}
