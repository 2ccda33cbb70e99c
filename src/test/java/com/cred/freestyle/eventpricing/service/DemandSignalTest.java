package com.cred.freestyle.eventpricing.service;

import com.cred.freestyle.eventpricing.infrastructure.metrics.PricingMetricsService;
import com.cred.freestyle.eventpricing.repository.BookingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for DemandSignal.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("DemandSignal Unit Tests")
class DemandSignalTest {

    @Mock
    private BookingRepository bookingRepository;

    @Mock
    private PricingMetricsService metricsService;

    @Mock
    private PlatformTransactionManager transactionManager;

    private DemandSignal demandSignal;

    @BeforeEach
    void setUp() {
        demandSignal = new DemandSignal(bookingRepository, metricsService, transactionManager);
    }

    @Test
    @DisplayName("recentBookingCount - Counts bookings of the last 60 minutes")
    void recentBookingCount_UsesWindow() {
        Instant now = Instant.parse("2026-03-01T12:00:00Z");
        when(bookingRepository.countByEventIdAndCreatedAtGreaterThanEqual(
                "event-001", Instant.parse("2026-03-01T11:00:00Z"))).thenReturn(9L);

        assertThat(demandSignal.recentBookingCount("event-001", now)).isEqualTo(9L);
    }

    @Test
    @DisplayName("recentBookingCount - Storage failure yields zero demand")
    void recentBookingCount_Failure_ReturnsZero() {
        when(bookingRepository.countByEventIdAndCreatedAtGreaterThanEqual(eq("event-001"), any(Instant.class)))
                .thenThrow(new QueryTimeoutException("timeout"));

        assertThat(demandSignal.recentBookingCount("event-001", Instant.now())).isZero();
        verify(metricsService).recordError("DEMAND_SIGNAL_ERROR", "recentBookingCount");
    }

    @Test
    @DisplayName("isInWindow - Window start is inclusive, older bookings are outside")
    void isInWindow_Boundaries() {
        Instant now = Instant.parse("2026-03-01T12:00:00Z");

        assertThat(demandSignal.isInWindow(now.minus(60, ChronoUnit.MINUTES), now)).isTrue();
        assertThat(demandSignal.isInWindow(now.minus(5, ChronoUnit.MINUTES), now)).isTrue();
        assertThat(demandSignal.isInWindow(now.minus(61, ChronoUnit.MINUTES), now)).isFalse();
        assertThat(demandSignal.isInWindow(null, now)).isFalse();
    }
}
