package com.cred.freestyle.eventpricing.service;

import com.cred.freestyle.eventpricing.domain.booking.CancellationReceipt;
import com.cred.freestyle.eventpricing.domain.model.Booking;
import com.cred.freestyle.eventpricing.domain.model.Event;
import com.cred.freestyle.eventpricing.domain.pricing.PriceBreakdown;
import com.cred.freestyle.eventpricing.exception.BookingFailedException;
import com.cred.freestyle.eventpricing.exception.BookingValidationException;
import com.cred.freestyle.eventpricing.exception.CancellationExpiredException;
import com.cred.freestyle.eventpricing.exception.ForbiddenOperationException;
import com.cred.freestyle.eventpricing.exception.ResourceNotFoundException;
import com.cred.freestyle.eventpricing.infrastructure.cache.PriceCacheService;
import com.cred.freestyle.eventpricing.infrastructure.lock.PoolLockRegistry;
import com.cred.freestyle.eventpricing.infrastructure.messaging.BookingEventProducer;
import com.cred.freestyle.eventpricing.infrastructure.messaging.events.BookingLifecycleEvent;
import com.cred.freestyle.eventpricing.infrastructure.metrics.PricingMetricsService;
import com.cred.freestyle.eventpricing.repository.BookingRepository;
import com.cred.freestyle.eventpricing.repository.EventRepository;
import com.cred.freestyle.eventpricing.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.PlatformTransactionManager;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for CancellationCoordinator.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CancellationCoordinator Unit Tests")
class CancellationCoordinatorTest {

    private static final String EVENT_ID = "event-001";
    private static final String BOOKING_ID = "booking-001";

    @Mock
    private EventRepository eventRepository;

    @Mock
    private BookingRepository bookingRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    @Mock
    private PricingService pricingService;

    @Mock
    private DemandSignal demandSignal;

    @Mock
    private PriceCacheService cacheService;

    @Mock
    private BookingEventProducer eventProducer;

    @Mock
    private PricingMetricsService metricsService;

    private CancellationCoordinator cancellationCoordinator;

    private Event event;
    private Booking booking;

    @BeforeEach
    void setUp() {
        InventoryLedger inventoryLedger = new InventoryLedger(
                eventRepository, new PoolLockRegistry(5000), transactionManager);
        cancellationCoordinator = new CancellationCoordinator(
                inventoryLedger, bookingRepository, eventRepository, pricingService,
                demandSignal, cacheService, eventProducer, metricsService);

        event = TestDataBuilder.event().eventId(EVENT_ID).capacity(10).bookedTickets(5).build();
        booking = TestDataBuilder.booking()
                .bookingId(BOOKING_ID)
                .eventId(EVENT_ID)
                .customerEmail("alice@example.com")
                .ticketCount(2)
                .pricePerTicket("100.00")
                .build();
    }

    // ========================================
    // Successful Cancellation Tests
    // ========================================

    @Test
    @DisplayName("cancel - Releases tickets, re-prices with reduced demand and returns a receipt")
    void cancel_Success() {
        // Given
        when(bookingRepository.findById(BOOKING_ID)).thenReturn(Optional.of(booking));
        when(eventRepository.findById(EVENT_ID)).thenReturn(Optional.of(event));
        when(eventRepository.findByIdForUpdate(EVENT_ID)).thenReturn(Optional.of(event));
        when(demandSignal.recentBookingCount(eq(EVENT_ID), any(Instant.class))).thenReturn(3L);
        when(demandSignal.isInWindow(eq(booking.getCreatedAt()), any(Instant.class))).thenReturn(true);
        when(pricingService.computeFresh(eq(event), eq(2L), any(Instant.class)))
                .thenReturn(PriceBreakdown.builder().eventId(EVENT_ID).finalPrice(new BigDecimal("95.00")).build());

        // When
        CancellationReceipt receipt = cancellationCoordinator.cancel(BOOKING_ID, " ALICE@example.com");

        // Then
        assertThat(receipt.getBookingId()).isEqualTo(BOOKING_ID);
        assertThat(receipt.getTicketsReleased()).isEqualTo(2);
        assertThat(receipt.getRefundAmount()).isEqualByComparingTo("200.00");
        assertThat(receipt.getNewPrice()).isEqualByComparingTo("95.00");
        assertThat(receipt.getStatus()).isEqualTo(Booking.BookingStatus.CANCELLED);
        assertThat(receipt.getMessage())
                .isEqualTo("Booking cancelled successfully. Refund of 200.00 will be processed.");

        assertThat(event.getBookedTickets()).isEqualTo(3);
        assertThat(event.getCurrentPrice()).isEqualByComparingTo("95.00");

        verify(bookingRepository).delete(booking);
        verify(cacheService).invalidateEvent(EVENT_ID);
        verify(cacheService).invalidateCustomer("alice@example.com");
        verify(metricsService).recordCancellation(EVENT_ID);

        ArgumentCaptor<BookingLifecycleEvent> captor = ArgumentCaptor.forClass(BookingLifecycleEvent.class);
        verify(eventProducer).publish(captor.capture());
        assertThat(captor.getValue().getEventType()).isEqualTo(BookingLifecycleEvent.EventType.BOOKING_CANCELLED);
        assertThat(captor.getValue().getEventPrice()).isEqualByComparingTo("95.00");
    }

    @Test
    @DisplayName("cancel - Booking outside the demand window leaves the demand count unchanged")
    void cancel_OldBooking_KeepsDemand() {
        // Given
        booking.setCreatedAt(Instant.now().minus(3, ChronoUnit.HOURS));
        when(bookingRepository.findById(BOOKING_ID)).thenReturn(Optional.of(booking));
        when(eventRepository.findById(EVENT_ID)).thenReturn(Optional.of(event));
        when(eventRepository.findByIdForUpdate(EVENT_ID)).thenReturn(Optional.of(event));
        when(demandSignal.recentBookingCount(eq(EVENT_ID), any(Instant.class))).thenReturn(3L);
        when(demandSignal.isInWindow(eq(booking.getCreatedAt()), any(Instant.class))).thenReturn(false);
        when(pricingService.computeFresh(eq(event), eq(3L), any(Instant.class)))
                .thenReturn(PriceBreakdown.builder().eventId(EVENT_ID).finalPrice(new BigDecimal("100.00")).build());

        // When
        CancellationReceipt receipt = cancellationCoordinator.cancel(BOOKING_ID, "alice@example.com");

        // Then
        assertThat(receipt.getNewPrice()).isEqualByComparingTo("100.00");
        verify(pricingService).computeFresh(eq(event), eq(3L), any(Instant.class));
    }

    // ========================================
    // Rejection Tests
    // ========================================

    @Test
    @DisplayName("cancel - Blank email is rejected")
    void cancel_BlankEmail_Throws() {
        assertThatThrownBy(() -> cancellationCoordinator.cancel(BOOKING_ID, "  "))
                .isInstanceOf(BookingValidationException.class);

        verifyNoInteractions(bookingRepository);
    }

    @Test
    @DisplayName("cancel - Unknown booking throws ResourceNotFoundException")
    void cancel_BookingNotFound_Throws() {
        when(bookingRepository.findById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> cancellationCoordinator.cancel("missing", "alice@example.com"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("Booking with ID missing");
    }

    @Test
    @DisplayName("cancel - Someone else's booking is forbidden")
    void cancel_WrongOwner_Throws() {
        when(bookingRepository.findById(BOOKING_ID)).thenReturn(Optional.of(booking));

        assertThatThrownBy(() -> cancellationCoordinator.cancel(BOOKING_ID, "mallory@example.com"))
                .isInstanceOf(ForbiddenOperationException.class)
                .hasMessage("You can only cancel your own bookings");

        verify(bookingRepository, never()).delete(any());
        verifyNoInteractions(eventProducer);
    }

    @Test
    @DisplayName("cancel - Booking of an event that has taken place cannot be cancelled")
    void cancel_EventPassed_Throws() {
        event.setEventDate(Instant.now().minus(1, ChronoUnit.DAYS));
        when(bookingRepository.findById(BOOKING_ID)).thenReturn(Optional.of(booking));
        when(eventRepository.findById(EVENT_ID)).thenReturn(Optional.of(event));

        assertThatThrownBy(() -> cancellationCoordinator.cancel(BOOKING_ID, "alice@example.com"))
                .isInstanceOf(CancellationExpiredException.class);

        assertThat(event.getBookedTickets()).isEqualTo(5);
        verify(bookingRepository, never()).delete(any());
    }

    @Test
    @DisplayName("cancel - Booking removed by a concurrent cancellation releases nothing")
    void cancel_ConcurrentlyCancelled_Throws() {
        // Given: the pre-lock read sees the booking, the locked read no longer does
        when(bookingRepository.findById(BOOKING_ID))
                .thenReturn(Optional.of(booking))
                .thenReturn(Optional.empty());
        when(eventRepository.findById(EVENT_ID)).thenReturn(Optional.of(event));
        when(eventRepository.findByIdForUpdate(EVENT_ID)).thenReturn(Optional.of(event));
        when(demandSignal.recentBookingCount(eq(EVENT_ID), any(Instant.class))).thenReturn(0L);

        // When & Then
        assertThatThrownBy(() -> cancellationCoordinator.cancel(BOOKING_ID, "alice@example.com"))
                .isInstanceOf(ResourceNotFoundException.class);

        assertThat(event.getBookedTickets()).isEqualTo(5);
        verify(bookingRepository, never()).delete(any());
        verify(pricingService, never()).computeFresh(any(), anyLong(), any());
    }

    @Test
    @DisplayName("cancel - Storage failure is reported as BookingFailedException")
    void cancel_StorageFailure_Throws() {
        when(bookingRepository.findById(BOOKING_ID)).thenThrow(new QueryTimeoutException("timeout"));

        assertThatThrownBy(() -> cancellationCoordinator.cancel(BOOKING_ID, "alice@example.com"))
                .isInstanceOf(BookingFailedException.class)
                .hasMessage("Cancellation failed, please try again");

        verify(metricsService).recordError("CANCELLATION_STORAGE_ERROR", "cancel");
    }
}
